package com.tablescan;

import java.awt.Point;
import java.awt.image.BufferedImage;

/**
 * Perspective-corrected, padded colour crop of the table plus where it was found.
 */
public final class LocatedTable {

    /** Corrected crop including the padding border. */
    public final BufferedImage image;

    /** Top-left, top-right, bottom-right, bottom-left corners in photo coordinates. */
    private final Point[] corners;

    public final Contour contour;
    public final int padding;

    public LocatedTable(BufferedImage image, Point[] corners, Contour contour, int padding) {
        this.image = image;
        this.corners = copy(corners);
        this.contour = contour;
        this.padding = padding;
    }

    public Point[] getCorners() {
        return copy(corners);
    }

    private static Point[] copy(Point[] points) {
        Point[] copy = new Point[points.length];
        for (int i = 0; i < points.length; i++) {
            copy[i] = new Point(points[i]);
        }
        return copy;
    }
}
