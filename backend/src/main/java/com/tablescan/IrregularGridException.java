package com.tablescan;

/**
 * A row's cell count differs from the table's column count by more than padding can fix.
 */
public class IrregularGridException extends TableExtractionException {

    private final int row;
    private final int actualColumns;
    private final int expectedColumns;

    public IrregularGridException(String imageId, int row, int actualColumns, int expectedColumns) {
        super(PipelineStage.CELL_EXTRACTION, imageId, String.format(
                "Row %d has %d cells, expected %d", row, actualColumns, expectedColumns));
        this.row = row;
        this.actualColumns = actualColumns;
        this.expectedColumns = expectedColumns;
    }

    public int getRow() {
        return row;
    }

    public int getActualColumns() {
        return actualColumns;
    }

    public int getExpectedColumns() {
        return expectedColumns;
    }
}
