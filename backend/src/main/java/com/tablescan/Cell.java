package com.tablescan;

import java.awt.image.BufferedImage;

/**
 * One table cell. {@code image} is the slice handed to recognition and is {@code null} for
 * cells added as padding; {@code text} is never {@code null}.
 */
public final class Cell {

    public final int row;
    public final int column;
    public final BufferedImage image;
    public final String text;

    public Cell(int row, int column, BufferedImage image, String text) {
        if (row < 0 || column < 0) {
            throw new IllegalArgumentException("Negative cell position: " + row + "," + column);
        }
        this.row = row;
        this.column = column;
        this.image = image;
        this.text = text == null ? "" : text;
    }

    public static Cell empty(int row, int column) {
        return new Cell(row, column, null, "");
    }

    public boolean isEmpty() {
        return text.isBlank();
    }

    @Override
    public String toString() {
        return String.format("[%d,%d] '%s'", row, column, text);
    }
}
