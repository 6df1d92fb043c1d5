package com.tablescan;

public class StructureRemovalFailedException extends TableExtractionException {

    public StructureRemovalFailedException(String imageId, String message) {
        super(PipelineStage.STRUCTURE_REMOVAL, imageId, message);
    }

    public StructureRemovalFailedException(String imageId, String message, Throwable cause) {
        super(PipelineStage.STRUCTURE_REMOVAL, imageId, message, cause);
    }
}
