package com.tablescan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Rectangular grid of cells. Every row holds the same number of cells and cell
 * {@code (r, c)} sits at {@code getRows().get(r).get(c)}.
 */
public final class Table {

    private static final Table EMPTY = new Table(Collections.emptyList(), 0);

    private final List<List<Cell>> rows;
    private final int columnCount;

    private Table(List<List<Cell>> rows, int columnCount) {
        this.rows = rows;
        this.columnCount = columnCount;
    }

    public static Table empty() {
        return EMPTY;
    }

    /**
     * Places cells by their {@code (row, column)}. The column count is the widest row; rows
     * with holes get empty cells as long as at most {@code maxPaddedCellsPerRow} are missing.
     *
     * @throws IrregularGridException   when a row misses more cells than may be padded
     * @throws IllegalArgumentException when two cells share a position or a row index is skipped
     */
    public static Table assemble(List<Cell> cells, int maxPaddedCellsPerRow, String imageId) throws IrregularGridException {
        if (cells.isEmpty()) return EMPTY;

        int rowCount = 0;
        int columnCount = 0;
        for (Cell cell : cells) {
            rowCount = Math.max(rowCount, cell.row + 1);
            columnCount = Math.max(columnCount, cell.column + 1);
        }

        Cell[][] grid = new Cell[rowCount][columnCount];
        int[] present = new int[rowCount];
        for (Cell cell : cells) {
            if (grid[cell.row][cell.column] != null) {
                throw new IllegalArgumentException("Two cells at row " + cell.row + ", column " + cell.column);
            }
            grid[cell.row][cell.column] = cell;
            present[cell.row]++;
        }

        List<List<Cell>> rows = new ArrayList<>(rowCount);
        for (int r = 0; r < rowCount; r++) {
            if (present[r] == 0) {
                throw new IllegalArgumentException("Row " + r + " has no cells");
            }
            if (columnCount - present[r] > maxPaddedCellsPerRow) {
                throw new IrregularGridException(imageId, r, present[r], columnCount);
            }
            List<Cell> row = new ArrayList<>(columnCount);
            for (int c = 0; c < columnCount; c++) {
                row.add(grid[r][c] != null ? grid[r][c] : Cell.empty(r, c));
            }
            rows.add(Collections.unmodifiableList(row));
        }
        return new Table(Collections.unmodifiableList(rows), columnCount);
    }

    /** Text-only table, e.g. read back from the flat file. Rows must be of equal length. */
    public static Table ofTexts(List<List<String>> texts) {
        if (texts.isEmpty()) return EMPTY;
        int columnCount = texts.get(0).size();
        List<List<Cell>> rows = new ArrayList<>(texts.size());
        for (int r = 0; r < texts.size(); r++) {
            List<String> source = texts.get(r);
            if (source.size() != columnCount) {
                throw new IllegalArgumentException("Row " + r + " has " + source.size() + " cells, expected " + columnCount);
            }
            List<Cell> row = new ArrayList<>(columnCount);
            for (int c = 0; c < columnCount; c++) {
                row.add(new Cell(r, c, null, source.get(c)));
            }
            rows.add(Collections.unmodifiableList(row));
        }
        return new Table(Collections.unmodifiableList(rows), columnCount);
    }

    public int getRowCount() {
        return rows.size();
    }

    public int getColumnCount() {
        return columnCount;
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public Cell getCell(int row, int column) {
        return rows.get(row).get(column);
    }

    public String getText(int row, int column) {
        return getCell(row, column).text;
    }

    public List<List<Cell>> getRows() {
        return rows;
    }

    public List<List<String>> toTexts() {
        List<List<String>> texts = new ArrayList<>(rows.size());
        for (List<Cell> row : rows) {
            List<String> line = new ArrayList<>(row.size());
            for (Cell cell : row) {
                line.add(cell.text);
            }
            texts.add(line);
        }
        return texts;
    }

    @Override
    public String toString() {
        return "Table " + getRowCount() + "x" + columnCount;
    }
}
