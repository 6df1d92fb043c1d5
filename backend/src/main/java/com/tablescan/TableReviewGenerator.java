package com.tablescan;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the review document a human uses to correct a recognised table. Empty cells are
 * flagged for review.
 */
public class TableReviewGenerator {

    private static final Gson gson = new GsonBuilder().setPrettyPrinting().create();

    public static String toReviewJson(String imageId, Table table) {
        return gson.toJson(toReviewData(imageId, table));
    }

    public static Map<String, Object> toReviewData(String imageId, Table table) {
        Map<String, Object> output = new LinkedHashMap<>();
        int emptyCells = 0;
        int fieldsNeedingReview = 0;

        List<List<Map<String, Object>>> rows = new ArrayList<>();
        for (List<Cell> row : table.getRows()) {
            List<Map<String, Object>> rowData = new ArrayList<>();
            for (Cell cell : row) {
                String issue = issueFor(cell);
                boolean needsReview = issue != null;
                rowData.add(createFieldObject(cell, needsReview, issue));

                if (cell.isEmpty()) emptyCells++;
                if (needsReview) fieldsNeedingReview++;
            }
            rows.add(rowData);
        }

        output.put("imageId", imageId);
        output.put("rowCount", table.getRowCount());
        output.put("columnCount", table.getColumnCount());
        output.put("rows", rows);
        output.put("emptyCells", emptyCells);
        output.put("fieldsNeedingReview", fieldsNeedingReview);
        return output;
    }

    private static Map<String, Object> createFieldObject(Cell cell, boolean needsReview, String issue) {
        Map<String, Object> field = new LinkedHashMap<>();
        field.put("row", cell.row);
        field.put("column", cell.column);
        field.put("value", cell.text);
        field.put("isEmpty", cell.isEmpty());
        field.put("needsReview", needsReview);
        field.put("issue", issue != null ? issue : "");
        return field;
    }

    private static String issueFor(Cell cell) {
        if (!cell.isEmpty()) return null;
        return cell.image == null ? "No text region detected" : "No text recognised";
    }
}
