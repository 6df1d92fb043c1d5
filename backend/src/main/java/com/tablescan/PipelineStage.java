package com.tablescan;

/** Pipeline stage in which an image failed. */
public enum PipelineStage {
    TABLE_LOCATION,
    STRUCTURE_REMOVAL,
    CELL_EXTRACTION
}
