package com.filterbench.filter;

import net.coobird.thumbnailator.filters.ImageFilter;

import java.awt.image.BufferedImage;

/**
 * Square-kernel convolution applied per RGB channel.
 *
 * Each channel sum is divided by {@code divisor}, shifted by {@code offset}
 * and clamped to 0..255. Pixels outside the image repeat the nearest edge
 * pixel.
 */
public class ConvolutionFilter implements ImageFilter {

    private final int size;
    private final int[] kernel;
    private final int divisor;
    private final int offset;

    public ConvolutionFilter(int size, int[] kernel, int divisor, int offset) {
        if (size % 2 == 0 || kernel.length != size * size) {
            throw new IllegalArgumentException("Kernel must be an odd square, got size " + size
                    + " with " + kernel.length + " weights");
        }
        if (divisor == 0) {
            throw new IllegalArgumentException("Divisor must not be zero");
        }
        this.size = size;
        this.kernel = kernel.clone();
        this.divisor = divisor;
        this.offset = offset;
    }

    @Override
    public BufferedImage apply(BufferedImage img) {
        int width = img.getWidth();
        int height = img.getHeight();
        int half = size / 2;

        int[] src = img.getRGB(0, 0, width, height, null, 0, width);
        int[] dst = new int[src.length];

        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int sumR = 0, sumG = 0, sumB = 0;
                int k = 0;
                for (int ky = -half; ky <= half; ky++) {
                    int sy = clamp(y + ky, 0, height - 1);
                    for (int kx = -half; kx <= half; kx++) {
                        int sx = clamp(x + kx, 0, width - 1);
                        int weight = kernel[k++];
                        if (weight == 0)
                            continue;
                        int rgb = src[sy * width + sx];
                        sumR += weight * ((rgb >> 16) & 0xFF);
                        sumG += weight * ((rgb >> 8) & 0xFF);
                        sumB += weight * (rgb & 0xFF);
                    }
                }
                int r = clamp(sumR / divisor + offset, 0, 255);
                int g = clamp(sumG / divisor + offset, 0, 255);
                int b = clamp(sumB / divisor + offset, 0, 255);
                dst[y * width + x] = (r << 16) | (g << 8) | b;
            }
        }

        BufferedImage result = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        result.setRGB(0, 0, width, height, dst, 0, width);
        return result;
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }
}
