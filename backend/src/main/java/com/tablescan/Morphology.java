package com.tablescan;

import java.awt.image.BufferedImage;

import nu.pattern.OpenCV;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

/**
 * Binary erosion and dilation with rectangular structuring elements.
 *
 * <p>Neighbours outside the image are ignored rather than treated as background or
 * foreground, so the result always has the input's dimensions. Dilation anchors the kernel
 * at the mirrored position, which makes {@code dilate(erode(img, k), k)} an exact opening
 * for even-sized kernels as well.
 */
public final class Morphology {

    static {
        OpenCV.loadLocally();
    }

    private Morphology() {
    }

    public static BufferedImage erode(BufferedImage binary, StructuringElement element) {
        Mat src = Mats.gray(binary);
        Mat dst = new Mat();
        Imgproc.erode(src, dst, kernel(element), new Point(element.anchorX(), element.anchorY()), element.iterations);
        return Mats.toGray(dst);
    }

    public static BufferedImage dilate(BufferedImage binary, StructuringElement element) {
        Mat src = Mats.gray(binary);
        Mat dst = new Mat();
        Point mirrored = new Point(element.width - 1 - element.anchorX(), element.height - 1 - element.anchorY());
        Imgproc.dilate(src, dst, kernel(element), mirrored, element.iterations);
        return Mats.toGray(dst);
    }

    /** Erosion then dilation: keeps only the shapes the element fits inside. */
    public static BufferedImage open(BufferedImage binary, StructuringElement element) {
        return dilate(erode(binary, element), element);
    }

    /** Dilation then erosion: fills gaps narrower than the element. */
    public static BufferedImage close(BufferedImage binary, StructuringElement element) {
        return erode(dilate(binary, element), element);
    }

    /** Clears every 8-connected component with fewer than {@code minArea} pixels. */
    public static BufferedImage removeSmallComponents(BufferedImage binary, int minArea) {
        Mat src = Mats.gray(binary);
        Mat labels = new Mat();
        Mat stats = new Mat();
        Mat centroids = new Mat();
        int count = Imgproc.connectedComponentsWithStats(src, labels, stats, centroids, 8, CvType.CV_32S);

        boolean[] keep = new boolean[count];
        for (int label = 1; label < count; label++) {
            keep[label] = stats.get(label, Imgproc.CC_STAT_AREA)[0] >= minArea;
        }

        int[] labelData = new int[binary.getWidth() * binary.getHeight()];
        labels.get(0, 0, labelData);
        byte[] cleaned = new byte[labelData.length];
        for (int i = 0; i < labelData.length; i++) {
            if (keep[labelData[i]]) cleaned[i] = (byte) ImageProcessor.FOREGROUND;
        }
        Mat dst = new Mat(src.rows(), src.cols(), CvType.CV_8UC1);
        dst.put(0, 0, cleaned);
        return Mats.toGray(dst);
    }

    private static Mat kernel(StructuringElement element) {
        return Imgproc.getStructuringElement(Imgproc.MORPH_RECT, new Size(element.width, element.height));
    }
}
