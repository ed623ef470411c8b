package com.filterbench.filter;

import net.coobird.thumbnailator.filters.ImageFilter;

import java.awt.image.BufferedImage;
import java.awt.image.WritableRaster;

/**
 * Converts to single-channel luminance (ITU-R 601-2 weights).
 */
public class GrayscaleFilter implements ImageFilter {

    @Override
    public BufferedImage apply(BufferedImage img) {
        int width = img.getWidth();
        int height = img.getHeight();
        int[] src = img.getRGB(0, 0, width, height, null, 0, width);

        BufferedImage result = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
        WritableRaster raster = result.getRaster();
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int rgb = src[y * width + x];
                int r = (rgb >> 16) & 0xFF;
                int g = (rgb >> 8) & 0xFF;
                int b = rgb & 0xFF;
                raster.setSample(x, y, 0, (r * 299 + g * 587 + b * 114) / 1000);
            }
        }
        return result;
    }
}
