package com.tablescan;

import java.awt.Point;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Closed outer boundary of one 8-connected foreground component.
 */
public final class Contour {

    private final List<Point> points;
    private final BoundingBox boundingBox;
    private final int pixelCount;
    private final double area;

    public Contour(List<Point> points, BoundingBox boundingBox, int pixelCount, double area) {
        List<Point> copy = new ArrayList<>(points.size());
        for (Point p : points) {
            copy.add(new Point(p));
        }
        this.points = Collections.unmodifiableList(copy);
        this.boundingBox = boundingBox;
        this.pixelCount = pixelCount;
        this.area = area;
    }

    /** Boundary points in tracing order. The returned points are copies. */
    public List<Point> getPoints() {
        List<Point> copy = new ArrayList<>(points.size());
        for (Point p : points) {
            copy.add(new Point(p));
        }
        return copy;
    }

    public int size() {
        return points.size();
    }

    public BoundingBox getBoundingBox() {
        return boundingBox;
    }

    /** Number of foreground pixels in the component this contour encloses. */
    public int getPixelCount() {
        return pixelCount;
    }

    /** Area enclosed by the boundary polygon (zero for one-pixel-wide shapes). */
    public double getArea() {
        return area;
    }

    /** Top-left, top-right, bottom-right, bottom-left extremes along the two diagonals. */
    public Point[] extremeCorners() {
        Point topLeft = points.get(0);
        Point topRight = points.get(0);
        Point bottomRight = points.get(0);
        Point bottomLeft = points.get(0);
        for (Point p : points) {
            int sum = p.x + p.y;
            int diff = p.x - p.y;
            if (sum < topLeft.x + topLeft.y) topLeft = p;
            if (sum > bottomRight.x + bottomRight.y) bottomRight = p;
            if (diff > topRight.x - topRight.y) topRight = p;
            if (diff < bottomLeft.x - bottomLeft.y) bottomLeft = p;
        }
        return new Point[]{new Point(topLeft), new Point(topRight), new Point(bottomRight), new Point(bottomLeft)};
    }

    @Override
    public String toString() {
        return String.format("Contour%s area=%.1f pixels=%d", boundingBox, area, pixelCount);
    }
}
