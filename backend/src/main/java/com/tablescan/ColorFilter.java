package com.tablescan;

import java.awt.Color;
import java.awt.image.BufferedImage;

import nu.pattern.OpenCV;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.opencv.imgproc.Imgproc;

/**
 * Selects pixels whose hue lies close to a reference colour. Saturation and brightness only
 * need to clear a floor, so the same printed colour matches under different lighting.
 *
 * <p>Hues are compared on OpenCV's 8-bit scale, where 0..179 covers the full circle.
 */
public final class ColorFilter {

    static {
        OpenCV.loadLocally();
    }

    private static final int HUE_STEPS = 180;

    private final Color reference;
    private final int referenceHue;
    private final double hueTolerance;
    private final double minSaturation;
    private final double minValue;
    private final int closingSize;

    /**
     * @param reference        colour to select
     * @param hueToleranceDeg  accepted hue distance in degrees (0..180)
     * @param minSaturation    saturation floor (0..1)
     * @param minValue         brightness floor (0..1)
     * @param closingSize      size of the block closing that fills holes in the mask, 1 for none
     */
    public ColorFilter(Color reference, float hueToleranceDeg, float minSaturation, float minValue, int closingSize) {
        if (reference == null) {
            throw new IllegalArgumentException("Reference colour cannot be null.");
        }
        if (hueToleranceDeg < 0 || hueToleranceDeg > 180) {
            throw new IllegalArgumentException("Hue tolerance must be within 0..180 degrees: " + hueToleranceDeg);
        }
        if (closingSize < 1) {
            throw new IllegalArgumentException("Closing size must be positive: " + closingSize);
        }
        this.reference = reference;
        this.referenceHue = hueOf(reference);
        this.hueTolerance = hueToleranceDeg / 2.0;
        this.minSaturation = Math.ceil(minSaturation * 255);
        this.minValue = Math.ceil(minValue * 255);
        this.closingSize = closingSize;
    }

    public Color getReference() {
        return reference;
    }

    /** Binary mask, 255 where the pixel matches. */
    public BufferedImage mask(BufferedImage image) {
        Mat hsv = new Mat();
        Imgproc.cvtColor(Mats.rgb(image), hsv, Imgproc.COLOR_RGB2HSV);

        int low = (int) Math.ceil(referenceHue - hueTolerance);
        int high = (int) Math.floor(referenceHue + hueTolerance);
        Mat mask = new Mat();
        if (high - low + 1 >= HUE_STEPS) {
            inRange(hsv, 0, HUE_STEPS - 1, mask);
        } else if (low < 0) {
            inRange(hsv, 0, high, mask);
            orInRange(hsv, low + HUE_STEPS, HUE_STEPS - 1, mask);
        } else if (high >= HUE_STEPS) {
            inRange(hsv, low, HUE_STEPS - 1, mask);
            orInRange(hsv, 0, high - HUE_STEPS, mask);
        } else {
            inRange(hsv, low, high, mask);
        }

        BufferedImage binary = Mats.toGray(mask);
        if (closingSize > 1) {
            binary = Morphology.close(binary, StructuringElement.block(closingSize));
        }
        return binary;
    }

    /** Copy of {@code image} as RGB with every masked pixel set to {@code fill}. */
    public BufferedImage paint(BufferedImage image, Color fill) {
        Mat mask = Mats.gray(mask(image));
        Mat painted = Mats.rgb(image);
        painted.setTo(new Scalar(fill.getRed(), fill.getGreen(), fill.getBlue()), mask);
        return Mats.toRgb(painted);
    }

    private void inRange(Mat hsv, int lowHue, int highHue, Mat dst) {
        Core.inRange(hsv, new Scalar(lowHue, minSaturation, minValue), new Scalar(highHue, 255, 255), dst);
    }

    private void orInRange(Mat hsv, int lowHue, int highHue, Mat dst) {
        Mat extra = new Mat();
        inRange(hsv, lowHue, highHue, extra);
        Core.bitwise_or(dst, extra, dst);
    }

    private static int hueOf(Color color) {
        Mat pixel = new Mat(1, 1, CvType.CV_8UC3);
        pixel.put(0, 0, new byte[]{(byte) color.getRed(), (byte) color.getGreen(), (byte) color.getBlue()});
        Mat hsv = new Mat();
        Imgproc.cvtColor(pixel, hsv, Imgproc.COLOR_RGB2HSV);
        return (int) hsv.get(0, 0)[0];
    }

    /** Parses {@code #RRGGBB} or {@code RRGGBB}. */
    public static Color parseColor(String hex) {
        if (hex == null || hex.isBlank()) {
            throw new IllegalArgumentException("Colour cannot be blank.");
        }
        String value = hex.trim();
        if (value.startsWith("#")) value = value.substring(1);
        if (value.length() != 6) {
            throw new IllegalArgumentException("Expected #RRGGBB colour, got: " + hex);
        }
        try {
            return new Color(Integer.parseInt(value, 16));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Expected #RRGGBB colour, got: " + hex, e);
        }
    }
}
