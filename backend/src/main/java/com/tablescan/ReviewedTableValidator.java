package com.tablescan;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks a corrected table coming back from review in the flat file format.
 */
public class ReviewedTableValidator {

    private static final Logger log = LoggerFactory.getLogger(ReviewedTableValidator.class);

    public static class ValidationResult {
        public boolean isValid;
        public List<String> errors;
        public List<String> warnings;
        public Table table;

        public ValidationResult() {
            this.errors = new ArrayList<>();
            this.warnings = new ArrayList<>();
            this.isValid = true;
        }
    }

    public static ValidationResult validate(String flatText) {
        ValidationResult result = new ValidationResult();

        Table table;
        try {
            table = TableFileFormat.read(flatText);
        } catch (IrregularGridException e) {
            result.errors.add(String.format("Row %d has %d cells, expected %d",
                    e.getRow() + 1, e.getActualColumns(), e.getExpectedColumns()));
            result.isValid = false;
            return result;
        }

        if (table.isEmpty()) {
            result.errors.add("No rows found in reviewed table");
            result.isValid = false;
            return result;
        }

        int totalCells = table.getRowCount() * table.getColumnCount();
        int filledCells = 0;
        for (List<Cell> row : table.getRows()) {
            for (Cell cell : row) {
                if (!cell.isEmpty()) filledCells++;
            }
        }
        int emptyCells = totalCells - filledCells;

        // warnings, not errors
        if (filledCells == 0) {
            result.warnings.add("No cell has a value - is this correct?");
        } else if (emptyCells > totalCells * 0.95) {
            result.warnings.add("Less than 5% of cells filled - is this correct?");
        }

        result.table = table;
        result.isValid = result.errors.isEmpty();
        log.info("Validated reviewed table {}x{}: {} filled, {} empty, {} warnings",
                table.getRowCount(), table.getColumnCount(), filledCells, emptyCells, result.warnings.size());
        return result;
    }
}
