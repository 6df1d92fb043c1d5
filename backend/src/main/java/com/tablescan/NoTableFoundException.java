package com.tablescan;

public class NoTableFoundException extends TableExtractionException {

    public NoTableFoundException(String imageId, String message) {
        super(PipelineStage.TABLE_LOCATION, imageId, message);
    }
}
