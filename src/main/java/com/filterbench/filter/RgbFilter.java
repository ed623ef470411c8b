package com.filterbench.filter;

import net.coobird.thumbnailator.filters.ImageFilter;

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;

/**
 * Normalises any input image to opaque 8-bit RGB before a transform runs.
 */
public class RgbFilter implements ImageFilter {

    @Override
    public BufferedImage apply(BufferedImage img) {
        if (img.getType() == BufferedImage.TYPE_INT_RGB) {
            return img;
        }
        BufferedImage rgb = new BufferedImage(img.getWidth(), img.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        try {
            g.drawImage(img, 0, 0, null);
        } finally {
            g.dispose();
        }
        return rgb;
    }
}
