package com.tablescan;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Assigns grid coordinates to text boxes that come out of blob detection in no particular
 * order.
 *
 * <p>Rows: boxes are sorted by vertical centre and a box joins the current row while its
 * centre is within {@code rowTolerance} of the row anchor, the centre of the row's first box.
 * The comparison is inclusive, so a box exactly on the band edge still joins the row.
 *
 * <p>Columns depend on {@link ColumnMode}.
 */
public class TextBoxOrderer {

    private static final Logger log = LoggerFactory.getLogger(TextBoxOrderer.class);

    public enum ColumnMode {
        /** Column is the box's position within its row, left to right. */
        ROW_ORDINAL,
        /**
         * Column is the table-wide band the box's left edge falls into. Rows with an empty
         * cell in the middle keep the remaining cells in their own columns.
         */
        ALIGNED
    }

    public static class Row {
        public final double anchor;
        public final List<BoundingBox> boxes = new ArrayList<>();

        Row(double anchor) {
            this.anchor = anchor;
        }
    }

    /** Left-edge cluster with its running mean. */
    static class ColumnBand {
        double meanX;
        final List<BoundingBox> members = new ArrayList<>();

        ColumnBand(BoundingBox first) {
            this.meanX = first.x;
            members.add(first);
        }

        void add(BoundingBox box) {
            meanX = (meanX * members.size() + box.x) / (members.size() + 1);
            members.add(box);
        }

        int count() {
            return members.size();
        }
    }

    private final int rowTolerance;
    private final ColumnMode columnMode;
    private final int columnTolerance;
    private final int expectedColumns;

    public TextBoxOrderer(int rowTolerance) {
        this(rowTolerance, ColumnMode.ROW_ORDINAL, 0, 0);
    }

    public TextBoxOrderer(int rowTolerance, ColumnMode columnMode, int columnTolerance, int expectedColumns) {
        if (rowTolerance < 0 || columnTolerance < 0 || expectedColumns < 0) {
            throw new IllegalArgumentException("Tolerances and expected column count cannot be negative");
        }
        this.rowTolerance = rowTolerance;
        this.columnMode = columnMode;
        this.columnTolerance = columnTolerance;
        this.expectedColumns = expectedColumns;
    }

    public static TextBoxOrderer from(TableScanProperties.Cells settings) {
        return new TextBoxOrderer(settings.getRowTolerance(), settings.getColumnMode(),
                settings.getColumnTolerance(), settings.getExpectedColumns());
    }

    /** Ordered boxes, row-major. */
    public List<TextBox> order(List<BoundingBox> boxes) {
        List<Row> rows = groupIntoRows(boxes);
        return columnMode == ColumnMode.ALIGNED ? alignColumns(rows) : ordinalColumns(rows);
    }

    public List<Row> groupIntoRows(List<BoundingBox> boxes) {
        List<Row> rows = new ArrayList<>();
        if (boxes.isEmpty()) return rows;

        List<BoundingBox> sorted = new ArrayList<>(boxes);
        sorted.sort(Comparator.comparingDouble(BoundingBox::centerY).thenComparingDouble(BoundingBox::centerX));

        Row currentRow = new Row(sorted.get(0).centerY());
        currentRow.boxes.add(sorted.get(0));

        for (int i = 1; i < sorted.size(); i++) {
            BoundingBox box = sorted.get(i);
            if (Math.abs(box.centerY() - currentRow.anchor) <= rowTolerance) {
                currentRow.boxes.add(box);
            } else {
                rows.add(currentRow);
                currentRow = new Row(box.centerY());
                currentRow.boxes.add(box);
            }
        }
        rows.add(currentRow);

        for (Row row : rows) {
            row.boxes.sort(Comparator.comparingInt((BoundingBox b) -> b.x).thenComparingInt(b -> b.y));
        }
        log.debug("Grouped {} boxes into {} rows (tolerance {})", boxes.size(), rows.size(), rowTolerance);
        return rows;
    }

    private List<TextBox> ordinalColumns(List<Row> rows) {
        List<TextBox> ordered = new ArrayList<>();
        for (int r = 0; r < rows.size(); r++) {
            List<BoundingBox> row = rows.get(r).boxes;
            for (int c = 0; c < row.size(); c++) {
                ordered.add(new TextBox(row.get(c), r, c));
            }
        }
        return ordered;
    }

    private List<TextBox> alignColumns(List<Row> rows) {
        List<BoundingBox> all = new ArrayList<>();
        for (Row row : rows) {
            all.addAll(row.boxes);
        }
        List<ColumnBand> bands = clusterColumns(all);
        Map<BoundingBox, Integer> bandOf = new IdentityHashMap<>();
        for (int i = 0; i < bands.size(); i++) {
            for (BoundingBox member : bands.get(i).members) {
                bandOf.put(member, i);
            }
        }

        List<TextBox> ordered = new ArrayList<>();
        int rowIndex = 0;
        for (Row row : rows) {
            BoundingBox[] merged = new BoundingBox[bands.size()];
            for (BoundingBox box : row.boxes) {
                Integer band = bandOf.get(box);
                if (band == null) {
                    log.debug("Dropping {}: outside the kept column bands", box);
                    continue;
                }
                merged[band] = merged[band] == null ? box : merged[band].union(box);
            }
            boolean any = false;
            for (int c = 0; c < merged.length; c++) {
                if (merged[c] != null) {
                    ordered.add(new TextBox(merged[c], rowIndex, c));
                    any = true;
                }
            }
            if (any) rowIndex++;
        }
        return ordered;
    }

    List<ColumnBand> clusterColumns(List<BoundingBox> boxes) {
        List<BoundingBox> byX = new ArrayList<>(boxes);
        byX.sort(Comparator.comparingInt(b -> b.x));

        List<ColumnBand> bands = new ArrayList<>();
        ColumnBand current = null;
        for (BoundingBox box : byX) {
            if (current != null && Math.abs(box.x - current.meanX) <= columnTolerance) {
                current.add(box);
            } else {
                current = new ColumnBand(box);
                bands.add(current);
            }
        }

        if (expectedColumns > 0) {
            while (bands.size() > expectedColumns) {
                ColumnBand sparsest = bands.get(0);
                for (ColumnBand band : bands) {
                    if (band.count() <= sparsest.count()) sparsest = band;
                }
                log.debug("Dropping column band at x={} with {} boxes", Math.round(sparsest.meanX), sparsest.count());
                bands.remove(sparsest);
            }
        }
        return bands;
    }
}
