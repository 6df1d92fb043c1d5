package com.tablescan;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Color;
import java.awt.Point;
import java.awt.geom.Point2D;
import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Finds the table in a photograph and cuts it out as an axis-aligned, padded colour image.
 *
 * <p>The table is taken to be the foreground contour enclosing the largest area once the
 * photo is binarised and inverted. Its corners come from the extremes along the two
 * diagonals, and the original photo is resampled through the homography that maps them onto
 * a rectangle whose sides are the longer of each pair of opposite edges.
 */
public class TableLocator {

    private static final Logger log = LoggerFactory.getLogger(TableLocator.class);

    private final TableScanProperties.Locator settings;
    private final Thresholder thresholder;
    private final ColorFilter backgroundFilter;
    private final DebugImageSink debug;

    public TableLocator(TableScanProperties.Locator settings) {
        this(settings, DebugImageSink.NONE);
    }

    public TableLocator(TableScanProperties.Locator settings, DebugImageSink debug) {
        if (settings.getMinTableAreaRatio() < 0 || settings.getMinTableAreaRatio() >= 1) {
            throw new IllegalArgumentException("min-table-area-ratio must be within [0, 1): " + settings.getMinTableAreaRatio());
        }
        if (settings.getAmbiguityMargin() < 0 || settings.getAmbiguityMargin() > 1) {
            throw new IllegalArgumentException("ambiguity-margin must be within [0, 1]: " + settings.getAmbiguityMargin());
        }
        if (settings.getPadding() < 0 || settings.getDilationIterations() < 0) {
            throw new IllegalArgumentException("padding and dilation-iterations cannot be negative");
        }
        this.settings = settings;
        this.thresholder = settings.getThreshold().toThresholder();
        String background = settings.getBackgroundColor();
        this.backgroundFilter = background == null || background.isBlank()
                ? null : settings.getColorMatch().filterFor(background);
        this.debug = debug;
    }

    public LocatedTable locate(BufferedImage photo) throws NoTableFoundException, AmbiguousTableException {
        return locate(photo, null);
    }

    public LocatedTable locate(BufferedImage photo, String imageId) throws NoTableFoundException, AmbiguousTableException {
        if (photo == null || photo.getWidth() == 0 || photo.getHeight() == 0) {
            throw new NoTableFoundException(imageId, "Empty photograph");
        }
        log.info("Locating table in {} ({}x{})", label(imageId), photo.getWidth(), photo.getHeight());

        BufferedImage working = photo;
        if (backgroundFilter != null) {
            working = backgroundFilter.paint(photo, Color.BLACK);
            debug.publish(imageId, "locator_background_filled", working);
        }

        BufferedImage gray = ImageProcessor.toGrayscale(working);
        BufferedImage binary = thresholder.threshold(gray);
        BufferedImage inverted = ImageProcessor.invert(binary);
        if (settings.getDilationIterations() > 0) {
            inverted = Morphology.dilate(inverted,
                    StructuringElement.block(3).withIterations(settings.getDilationIterations()));
        }
        debug.publish(imageId, "locator_binary", inverted);

        Contour table = selectTableContour(ContourFinder.findContours(inverted),
                (double) photo.getWidth() * photo.getHeight(), imageId);

        Point[] corners = table.extremeCorners();
        if (quadrilateralArea(corners) < 1.0) {
            throw new NoTableFoundException(imageId, "Table contour " + table.getBoundingBox() + " has collinear corners");
        }

        int width = (int) Math.round(Math.max(corners[0].distance(corners[1]), corners[3].distance(corners[2]))) + 1;
        int height = (int) Math.round(Math.max(corners[0].distance(corners[3]), corners[1].distance(corners[2]))) + 1;

        Point2D[] source = new Point2D[4];
        for (int i = 0; i < 4; i++) {
            source[i] = new Point2D.Double(corners[i].x, corners[i].y);
        }
        BufferedImage warped = PerspectiveTransform.warp(photo, source, width, height);
        BufferedImage padded = ImageProcessor.addPadding(warped, settings.getPadding(), Color.WHITE);
        debug.publish(imageId, "locator_table", padded);

        log.info("Table found in {}: corners TL{} TR{} BR{} BL{}, corrected to {}x{}", label(imageId),
                format(corners[0]), format(corners[1]), format(corners[2]), format(corners[3]), width, height);
        return new LocatedTable(padded, corners, table, settings.getPadding());
    }

    private Contour selectTableContour(List<Contour> contours, double photoArea, String imageId)
            throws NoTableFoundException, AmbiguousTableException {
        double minArea = settings.getMinTableAreaRatio() * photoArea;
        List<Contour> candidates = new ArrayList<>();
        for (Contour contour : contours) {
            if (contour.getArea() > 0 && contour.getArea() >= minArea) {
                candidates.add(contour);
            }
        }
        log.debug("{} contours, {} above the minimum area {}", contours.size(), candidates.size(), (long) minArea);

        if (candidates.isEmpty()) {
            throw new NoTableFoundException(imageId, String.format(
                    "None of %d contours encloses at least %.0f pixels", contours.size(), minArea));
        }

        candidates.sort(Comparator.comparingDouble(Contour::getArea).reversed());
        Contour largest = candidates.get(0);
        if (candidates.size() > 1) {
            Contour runnerUp = candidates.get(1);
            if (runnerUp.getArea() >= (1.0 - settings.getAmbiguityMargin()) * largest.getArea()) {
                throw new AmbiguousTableException(imageId, largest, runnerUp, settings.getAmbiguityMargin());
            }
        }
        return largest;
    }

    private static double quadrilateralArea(Point[] quad) {
        double twice = 0;
        for (int i = 0; i < quad.length; i++) {
            Point a = quad[i];
            Point b = quad[(i + 1) % quad.length];
            twice += (double) a.x * b.y - (double) b.x * a.y;
        }
        return Math.abs(twice) / 2.0;
    }

    private static String format(Point p) {
        return "(" + p.x + ", " + p.y + ")";
    }

    private static String label(String imageId) {
        return imageId == null ? "photo" : imageId;
    }
}
