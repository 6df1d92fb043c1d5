package com.tablescan;

import java.awt.image.BufferedImage;

import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

/**
 * Turns a grayscale image into a binary one: samples above the cutoff become 255, the rest 0.
 */
public interface Thresholder {

    BufferedImage threshold(BufferedImage gray);

    static Thresholder fixed(int cutoff) {
        if (cutoff < 0 || cutoff > 255) {
            throw new IllegalArgumentException("Threshold must be within 0..255: " + cutoff);
        }
        return gray -> apply(gray, cutoff);
    }

    static Thresholder otsu() {
        return gray -> apply(gray, otsuThreshold(gray));
    }

    /**
     * Local mean over a {@code blockSize} x {@code blockSize} window minus {@code constant}.
     * Windows reaching past the image edge repeat the border pixels.
     */
    static Thresholder adaptiveMean(int blockSize, int constant) {
        if (blockSize < 3 || blockSize % 2 == 0) {
            throw new IllegalArgumentException("Block size must be odd and at least 3: " + blockSize);
        }
        return gray -> applyAdaptiveMean(gray, blockSize, constant);
    }

    static Thresholder create(ThresholdMethod method, int cutoff, int blockSize, int constant) {
        switch (method) {
            case FIXED:
                return fixed(cutoff);
            case OTSU:
                return otsu();
            case ADAPTIVE_MEAN:
                return adaptiveMean(blockSize, constant);
            default:
                throw new IllegalArgumentException("Unknown threshold method: " + method);
        }
    }

    /** Otsu's method: the cutoff maximising between-class variance of the histogram. */
    static int otsuThreshold(BufferedImage gray) {
        int[] histogram = ImageProcessor.histogram(gray);
        int total = gray.getWidth() * gray.getHeight();

        float sum = 0;
        for (int i = 0; i < 256; i++) sum += i * histogram[i];

        float sumB = 0;
        int wB = 0;
        int wF;
        float varMax = 0;
        int threshold = 0;

        for (int t = 0; t < 256; t++) {
            wB += histogram[t];
            if (wB == 0) continue;

            wF = total - wB;
            if (wF == 0) break;

            sumB += (float) (t * histogram[t]);
            float mB = sumB / wB;
            float mF = (sum - sumB) / wF;
            float varBetween = (float) wB * (float) wF * (mB - mF) * (mB - mF);

            if (varBetween > varMax) {
                varMax = varBetween;
                threshold = t;
            }
        }
        return threshold;
    }

    private static BufferedImage apply(BufferedImage gray, int cutoff) {
        Mat src = Mats.gray(gray);
        Mat binary = new Mat();
        Imgproc.threshold(src, binary, cutoff, ImageProcessor.FOREGROUND, Imgproc.THRESH_BINARY);
        return Mats.toGray(binary);
    }

    private static BufferedImage applyAdaptiveMean(BufferedImage gray, int blockSize, int constant) {
        Mat src = Mats.gray(gray);
        Mat binary = new Mat();
        Imgproc.adaptiveThreshold(src, binary, ImageProcessor.FOREGROUND,
                Imgproc.ADAPTIVE_THRESH_MEAN_C, Imgproc.THRESH_BINARY, blockSize, constant);
        return Mats.toGray(binary);
    }
}
