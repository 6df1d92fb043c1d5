package com.tablescan;

/**
 * Terminal failure for one image. Carries the image identifier and the stage that gave up, so
 * the photograph can be re-inspected by hand. These failures are deterministic for a given
 * image and configuration and are never retried.
 */
public abstract class TableExtractionException extends Exception {

    private final PipelineStage stage;
    private String imageId;

    protected TableExtractionException(PipelineStage stage, String imageId, String message) {
        super(message);
        this.stage = stage;
        this.imageId = imageId;
    }

    protected TableExtractionException(PipelineStage stage, String imageId, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
        this.imageId = imageId;
    }

    public PipelineStage getStage() {
        return stage;
    }

    public String getImageId() {
        return imageId;
    }

    /** Attaches the image identifier when the failing stage was called without one. */
    public TableExtractionException forImage(String imageId) {
        if (this.imageId == null) {
            this.imageId = imageId;
        }
        return this;
    }

    @Override
    public String getMessage() {
        return String.format("[%s] %s: %s", imageId == null ? "unknown image" : imageId, stage, super.getMessage());
    }
}
