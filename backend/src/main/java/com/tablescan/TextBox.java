package com.tablescan;

/**
 * Candidate text region with the grid position it was ordered into.
 */
public final class TextBox {

    public final BoundingBox box;
    public final int row;
    public final int column;

    public TextBox(BoundingBox box, int row, int column) {
        this.box = box;
        this.row = row;
        this.column = column;
    }

    @Override
    public String toString() {
        return String.format("[%d,%d] %s", row, column, box);
    }
}
