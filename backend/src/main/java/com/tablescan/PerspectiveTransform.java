package com.tablescan;

import java.awt.geom.Point2D;
import java.awt.image.BufferedImage;

import nu.pattern.OpenCV;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.MatOfPoint2f;
import org.opencv.core.Point;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

/**
 * Planar homography defined by four point correspondences.
 */
public final class PerspectiveTransform {

    static {
        OpenCV.loadLocally();
    }

    private static final Scalar WHITE = new Scalar(255, 255, 255);

    private final Mat matrix;
    // row-major copy of the 3x3 matrix
    private final double[] h = new double[9];

    private PerspectiveTransform(Mat matrix) {
        this.matrix = matrix;
        matrix.get(0, 0, h);
    }

    /**
     * Transform mapping each {@code from[i]} onto {@code to[i]}.
     *
     * @throws IllegalArgumentException when fewer than four points are given or three of
     *                                  them are collinear
     */
    public static PerspectiveTransform between(Point2D[] from, Point2D[] to) {
        if (from == null || to == null || from.length != 4 || to.length != 4) {
            throw new IllegalArgumentException("A perspective transform needs exactly four point pairs.");
        }
        if (hasCollinearTriple(from) || hasCollinearTriple(to)) {
            throw new IllegalArgumentException("Degenerate point configuration; three corners are collinear.");
        }
        Mat matrix = Imgproc.getPerspectiveTransform(toMat(from), toMat(to));
        if (Math.abs(Core.determinant(matrix)) < 1e-12) {
            throw new IllegalArgumentException("Degenerate point configuration; no homography maps these corners.");
        }
        return new PerspectiveTransform(matrix);
    }

    public Point2D transform(Point2D point) {
        double u = point.getX();
        double v = point.getY();
        double w = h[6] * u + h[7] * v + h[8];
        return new Point2D.Double((h[0] * u + h[1] * v + h[2]) / w, (h[3] * u + h[4] * v + h[5]) / w);
    }

    /**
     * Resamples the quadrilateral {@code corners} (top-left, top-right, bottom-right,
     * bottom-left) of {@code source} onto an axis-aligned {@code width} x {@code height}
     * RGB image with bilinear interpolation. Points outside the source read as white.
     */
    public static BufferedImage warp(BufferedImage source, Point2D[] corners, int width, int height) {
        ImageProcessor.requireImage(source);
        if (width < 1 || height < 1) {
            throw new IllegalArgumentException("Output size must be positive: " + width + "x" + height);
        }
        Point2D[] target = {
                new Point2D.Double(0, 0),
                new Point2D.Double(width - 1, 0),
                new Point2D.Double(width - 1, height - 1),
                new Point2D.Double(0, height - 1)
        };
        PerspectiveTransform transform = between(corners, target);

        Mat warped = new Mat();
        Imgproc.warpPerspective(Mats.rgb(source), warped, transform.matrix, new Size(width, height),
                Imgproc.INTER_LINEAR, Core.BORDER_CONSTANT, WHITE);
        return Mats.toRgb(warped);
    }

    private static MatOfPoint2f toMat(Point2D[] points) {
        Point[] converted = new Point[points.length];
        for (int i = 0; i < points.length; i++) {
            converted[i] = new Point(points[i].getX(), points[i].getY());
        }
        return new MatOfPoint2f(converted);
    }

    private static boolean hasCollinearTriple(Point2D[] quad) {
        for (int skip = 0; skip < 4; skip++) {
            Point2D[] triple = new Point2D[3];
            int n = 0;
            for (int i = 0; i < 4; i++) {
                if (i != skip) triple[n++] = quad[i];
            }
            double cross = (triple[1].getX() - triple[0].getX()) * (triple[2].getY() - triple[0].getY())
                    - (triple[1].getY() - triple[0].getY()) * (triple[2].getX() - triple[0].getX());
            if (Math.abs(cross) < 1e-9) return true;
        }
        return false;
    }
}
