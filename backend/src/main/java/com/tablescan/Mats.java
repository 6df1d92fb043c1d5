package com.tablescan;

import java.awt.image.BufferedImage;
import java.awt.image.WritableRaster;

import nu.pattern.OpenCV;
import org.opencv.core.CvType;
import org.opencv.core.Mat;

/**
 * Copies pixels between {@link BufferedImage} and OpenCV {@link Mat}. Gray images map to
 * {@code CV_8UC1}; colour images map to {@code CV_8UC3} in R, G, B channel order.
 */
final class Mats {

    static {
        OpenCV.loadLocally();
    }

    private Mats() {
    }

    /** Single-channel copy of a gray or binary image. Colour input is converted first. */
    static Mat gray(BufferedImage image) {
        ImageProcessor.requireImage(image);
        BufferedImage gray = image.getType() == BufferedImage.TYPE_BYTE_GRAY ? image : ImageProcessor.toGrayscale(image);
        int width = gray.getWidth();
        int height = gray.getHeight();
        byte[] data = (byte[]) gray.getRaster().getDataElements(0, 0, width, height, null);
        Mat mat = new Mat(height, width, CvType.CV_8UC1);
        mat.put(0, 0, data);
        return mat;
    }

    static Mat rgb(BufferedImage image) {
        ImageProcessor.requireImage(image);
        int width = image.getWidth();
        int height = image.getHeight();
        int[] pixels = image.getRGB(0, 0, width, height, null, 0, width);
        byte[] data = new byte[pixels.length * 3];
        for (int i = 0; i < pixels.length; i++) {
            data[3 * i] = (byte) (pixels[i] >> 16);
            data[3 * i + 1] = (byte) (pixels[i] >> 8);
            data[3 * i + 2] = (byte) pixels[i];
        }
        Mat mat = new Mat(height, width, CvType.CV_8UC3);
        mat.put(0, 0, data);
        return mat;
    }

    static BufferedImage toGray(Mat mat) {
        requireType(mat, CvType.CV_8UC1);
        int width = mat.cols();
        int height = mat.rows();
        byte[] data = new byte[width * height];
        mat.get(0, 0, data);
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
        WritableRaster raster = image.getRaster();
        raster.setDataElements(0, 0, width, height, data);
        return image;
    }

    static BufferedImage toRgb(Mat mat) {
        requireType(mat, CvType.CV_8UC3);
        int width = mat.cols();
        int height = mat.rows();
        byte[] data = new byte[width * height * 3];
        mat.get(0, 0, data);
        int[] pixels = new int[width * height];
        for (int i = 0; i < pixels.length; i++) {
            pixels[i] = (data[3 * i] & 0xFF) << 16 | (data[3 * i + 1] & 0xFF) << 8 | data[3 * i + 2] & 0xFF;
        }
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        image.setRGB(0, 0, width, height, pixels, 0, width);
        return image;
    }

    private static void requireType(Mat mat, int type) {
        if (mat == null || mat.empty() || mat.type() != type) {
            throw new IllegalArgumentException("Expected a non-empty " + CvType.typeToString(type) + " matrix.");
        }
    }
}
