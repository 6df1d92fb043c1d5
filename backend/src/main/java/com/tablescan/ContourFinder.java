package com.tablescan;

import java.awt.Point;
import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import nu.pattern.OpenCV;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.MatOfPoint;
import org.opencv.core.Rect;
import org.opencv.imgproc.Imgproc;

/**
 * Outer boundaries of the 8-connected foreground components of a binary image.
 */
public final class ContourFinder {

    static {
        OpenCV.loadLocally();
    }

    private ContourFinder() {
    }

    /**
     * One contour per component, in raster order of each component's first pixel. An image
     * without foreground yields an empty list.
     */
    public static List<Contour> findContours(BufferedImage binary) {
        Mat src = Mats.gray(binary);
        List<MatOfPoint> outlines = new ArrayList<>();
        Mat hierarchy = new Mat();
        Imgproc.findContours(src, outlines, hierarchy, Imgproc.RETR_EXTERNAL, Imgproc.CHAIN_APPROX_NONE);

        Mat labels = new Mat();
        Mat stats = new Mat();
        Mat centroids = new Mat();
        Imgproc.connectedComponentsWithStats(src, labels, stats, centroids, 8, CvType.CV_32S);

        List<Contour> contours = new ArrayList<>(outlines.size());
        int[] label = new int[1];
        for (MatOfPoint outline : outlines) {
            List<Point> points = new ArrayList<>((int) outline.total());
            for (org.opencv.core.Point p : outline.toArray()) {
                points.add(new Point((int) p.x, (int) p.y));
            }
            Rect rect = Imgproc.boundingRect(outline);
            Point first = points.get(0);
            labels.get(first.y, first.x, label);
            int pixelCount = (int) stats.get(label[0], Imgproc.CC_STAT_AREA)[0];

            contours.add(new Contour(points, new BoundingBox(rect.x, rect.y, rect.width, rect.height),
                    pixelCount, Imgproc.contourArea(outline)));
        }

        int width = binary.getWidth();
        contours.sort(Comparator.comparingLong(contour -> firstRasterIndex(contour, width)));
        return contours;
    }

    /** Index of the topmost, then leftmost, boundary pixel. */
    private static long firstRasterIndex(Contour contour, int width) {
        long first = Long.MAX_VALUE;
        for (Point p : contour.getPoints()) {
            first = Math.min(first, (long) p.y * width + p.x);
        }
        return first;
    }
}
