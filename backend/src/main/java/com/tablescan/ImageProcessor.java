package com.tablescan;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.awt.image.WritableRaster;

/**
 * Pixel-level helpers shared by every stage. Nothing here mutates its input; every method
 * returns a fresh image of the same dimensions unless stated otherwise.
 *
 * <p>Grayscale and binary images are {@code TYPE_BYTE_GRAY}. Binary images use 0 for
 * background and 255 for foreground.
 */
public final class ImageProcessor {

    public static final int FOREGROUND = 255;
    public static final int BACKGROUND = 0;

    private ImageProcessor() {
    }

    /**
     * Weighted reduction {@code 0.299 R + 0.587 G + 0.114 B}. Computed per pixel instead of
     * drawing into a gray image, which would apply a colour-space conversion.
     */
    public static BufferedImage toGrayscale(BufferedImage image) {
        requireImage(image);
        int width = image.getWidth();
        int height = image.getHeight();
        BufferedImage gray = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
        WritableRaster grayRaster = gray.getRaster();

        if (image.getType() == BufferedImage.TYPE_BYTE_GRAY) {
            grayRaster.setRect(image.getRaster());
            return gray;
        }

        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int rgb = image.getRGB(x, y);
                int r = (rgb >> 16) & 0xFF;
                int g = (rgb >> 8) & 0xFF;
                int b = rgb & 0xFF;
                int value = (int) Math.round(0.299 * r + 0.587 * g + 0.114 * b);
                grayRaster.setSample(x, y, 0, Math.min(255, value));
            }
        }
        return gray;
    }

    /** 256-bin histogram of a single-channel image. */
    public static int[] histogram(BufferedImage gray) {
        requireImage(gray);
        int[] histogram = new int[256];
        WritableRaster raster = gray.getRaster();
        for (int y = 0; y < gray.getHeight(); y++) {
            for (int x = 0; x < gray.getWidth(); x++) {
                histogram[raster.getSample(x, y, 0)]++;
            }
        }
        return histogram;
    }

    public static BufferedImage invert(BufferedImage gray) {
        requireImage(gray);
        BufferedImage inverted = blankLike(gray);
        WritableRaster src = gray.getRaster();
        WritableRaster dst = inverted.getRaster();
        for (int y = 0; y < gray.getHeight(); y++) {
            for (int x = 0; x < gray.getWidth(); x++) {
                dst.setSample(x, y, 0, 255 - src.getSample(x, y, 0));
            }
        }
        return inverted;
    }

    /** Pixel-wise sum saturating at 255. */
    public static BufferedImage add(BufferedImage a, BufferedImage b) {
        requireSameSize(a, b);
        BufferedImage sum = blankLike(a);
        WritableRaster ra = a.getRaster();
        WritableRaster rb = b.getRaster();
        WritableRaster dst = sum.getRaster();
        for (int y = 0; y < a.getHeight(); y++) {
            for (int x = 0; x < a.getWidth(); x++) {
                dst.setSample(x, y, 0, Math.min(255, ra.getSample(x, y, 0) + rb.getSample(x, y, 0)));
            }
        }
        return sum;
    }

    /** Pixel-wise {@code a - b} clamped at 0. */
    public static BufferedImage subtract(BufferedImage a, BufferedImage b) {
        requireSameSize(a, b);
        BufferedImage difference = blankLike(a);
        WritableRaster ra = a.getRaster();
        WritableRaster rb = b.getRaster();
        WritableRaster dst = difference.getRaster();
        for (int y = 0; y < a.getHeight(); y++) {
            for (int x = 0; x < a.getWidth(); x++) {
                dst.setSample(x, y, 0, Math.max(0, ra.getSample(x, y, 0) - rb.getSample(x, y, 0)));
            }
        }
        return difference;
    }

    /** Uniform border of {@code padding} pixels filled with {@code color}. Keeps the image type. */
    public static BufferedImage addPadding(BufferedImage image, int padding, Color color) {
        requireImage(image);
        if (padding < 0) {
            throw new IllegalArgumentException("Padding cannot be negative: " + padding);
        }
        int width = image.getWidth() + 2 * padding;
        int height = image.getHeight() + 2 * padding;
        BufferedImage padded = new BufferedImage(width, height, imageType(image));
        Graphics2D g2d = padded.createGraphics();
        g2d.setColor(color);
        g2d.fillRect(0, 0, width, height);
        g2d.drawImage(image, padding, padding, null);
        g2d.dispose();
        return padded;
    }

    /** Copy of the region covered by {@code box}, clipped to the image. */
    public static BufferedImage crop(BufferedImage image, BoundingBox box) {
        requireImage(image);
        BoundingBox clipped = box.expand(0, image.getWidth(), image.getHeight());
        if (clipped.width == 0 || clipped.height == 0) {
            throw new IllegalArgumentException("Crop " + box + " lies outside the "
                    + image.getWidth() + "x" + image.getHeight() + " image");
        }
        return copy(image.getSubimage(clipped.x, clipped.y, clipped.width, clipped.height));
    }

    /** Deep copy; sub-images are detached from their parent raster. */
    public static BufferedImage copy(BufferedImage image) {
        requireImage(image);
        BufferedImage copy = new BufferedImage(image.getWidth(), image.getHeight(), imageType(image));
        if (copy.getType() == image.getType()) {
            copy.getRaster().setRect(image.getRaster());
        } else {
            Graphics2D g2d = copy.createGraphics();
            g2d.drawImage(image, 0, 0, null);
            g2d.dispose();
        }
        return copy;
    }

    /** Colour copy as {@code TYPE_INT_RGB}; gray samples are replicated to all channels. */
    public static BufferedImage toRgb(BufferedImage image) {
        requireImage(image);
        if (image.getType() == BufferedImage.TYPE_INT_RGB) {
            return copy(image);
        }
        BufferedImage rgb = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        if (image.getType() == BufferedImage.TYPE_BYTE_GRAY) {
            WritableRaster src = image.getRaster();
            for (int y = 0; y < image.getHeight(); y++) {
                for (int x = 0; x < image.getWidth(); x++) {
                    int v = src.getSample(x, y, 0);
                    rgb.setRGB(x, y, (v << 16) | (v << 8) | v);
                }
            }
            return rgb;
        }
        Graphics2D g2d = rgb.createGraphics();
        g2d.drawImage(image, 0, 0, null);
        g2d.dispose();
        return rgb;
    }

    public static int countForeground(BufferedImage binary) {
        requireImage(binary);
        WritableRaster raster = binary.getRaster();
        int count = 0;
        for (int y = 0; y < binary.getHeight(); y++) {
            for (int x = 0; x < binary.getWidth(); x++) {
                if (raster.getSample(x, y, 0) != BACKGROUND) count++;
            }
        }
        return count;
    }

    /** New black gray image with the dimensions of {@code image}. */
    public static BufferedImage blankLike(BufferedImage image) {
        return new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_BYTE_GRAY);
    }

    static void requireImage(BufferedImage image) {
        if (image == null) {
            throw new IllegalArgumentException("Image cannot be null.");
        }
    }

    static void requireSameSize(BufferedImage a, BufferedImage b) {
        requireImage(a);
        requireImage(b);
        if (a.getWidth() != b.getWidth() || a.getHeight() != b.getHeight()) {
            throw new IllegalArgumentException(String.format("Image sizes differ: %dx%d vs %dx%d",
                    a.getWidth(), a.getHeight(), b.getWidth(), b.getHeight()));
        }
    }

    private static int imageType(BufferedImage image) {
        int type = image.getType();
        return type == BufferedImage.TYPE_CUSTOM ? BufferedImage.TYPE_INT_RGB : type;
    }
}
