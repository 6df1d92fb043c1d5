package com.tablescan;

/**
 * The largest contour is not clearly larger than the runner-up, e.g. two tables in one photo.
 */
public class AmbiguousTableException extends TableExtractionException {

    private final double largestArea;
    private final double runnerUpArea;
    private final BoundingBox largestBox;
    private final BoundingBox runnerUpBox;

    public AmbiguousTableException(String imageId, Contour largest, Contour runnerUp, double margin) {
        super(PipelineStage.TABLE_LOCATION, imageId, String.format(
                "Largest contour %s (area %.0f) is within %.0f%% of runner-up %s (area %.0f)",
                largest.getBoundingBox(), largest.getArea(), margin * 100,
                runnerUp.getBoundingBox(), runnerUp.getArea()));
        this.largestArea = largest.getArea();
        this.runnerUpArea = runnerUp.getArea();
        this.largestBox = largest.getBoundingBox();
        this.runnerUpBox = runnerUp.getBoundingBox();
    }

    public double getLargestArea() {
        return largestArea;
    }

    public double getRunnerUpArea() {
        return runnerUpArea;
    }

    public BoundingBox getLargestBox() {
        return largestBox;
    }

    public BoundingBox getRunnerUpBox() {
        return runnerUpBox;
    }
}
