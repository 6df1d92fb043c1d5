package com.tablescan;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Flat text form of a table: one line per row, cells separated by {@code |}, UTF-8, lines
 * ending in {@code \n}. Inside a cell {@code \} and {@code |} are escaped with a backslash
 * and line breaks are folded to single spaces.
 */
public final class TableFileFormat {

    public static final char DELIMITER = '|';
    private static final char ESCAPE = '\\';

    private TableFileFormat() {
    }

    public static String write(Table table) {
        StringBuilder out = new StringBuilder();
        for (List<Cell> row : table.getRows()) {
            for (int c = 0; c < row.size(); c++) {
                if (c > 0) out.append(DELIMITER);
                out.append(escape(foldLineBreaks(row.get(c).text)));
            }
            out.append('\n');
        }
        return out.toString();
    }

    public static void write(Table table, Path path) throws IOException {
        Files.writeString(path, write(table), StandardCharsets.UTF_8);
    }

    /**
     * @throws IrregularGridException when a row's cell count differs from the first row's
     */
    public static Table read(String content) throws IrregularGridException {
        List<List<String>> rows = new ArrayList<>();
        if (content == null || content.isEmpty()) return Table.empty();

        String[] lines = content.split("\n", -1);
        int lineCount = lines[lines.length - 1].isEmpty() ? lines.length - 1 : lines.length;
        for (int i = 0; i < lineCount; i++) {
            String line = lines[i];
            if (line.endsWith("\r")) line = line.substring(0, line.length() - 1);
            List<String> cells = splitRow(line);
            if (!rows.isEmpty() && cells.size() != rows.get(0).size()) {
                throw new IrregularGridException(null, i, cells.size(), rows.get(0).size());
            }
            rows.add(cells);
        }
        return Table.ofTexts(rows);
    }

    public static Table read(Path path) throws IOException, IrregularGridException {
        return read(Files.readString(path, StandardCharsets.UTF_8));
    }

    /** Collapses every line break and the whitespace around it into one space, then trims. */
    public static String foldLineBreaks(String text) {
        if (text == null) return "";
        return text.replaceAll("\\s*\\R\\s*", " ").trim();
    }

    static String escape(String text) {
        StringBuilder out = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (ch == ESCAPE || ch == DELIMITER) out.append(ESCAPE);
            out.append(ch);
        }
        return out.toString();
    }

    static List<String> splitRow(String line) {
        List<String> cells = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (int i = 0; i < line.length(); i++) {
            char ch = line.charAt(i);
            if (ch == ESCAPE && i + 1 < line.length()) {
                current.append(line.charAt(++i));
            } else if (ch == DELIMITER) {
                cells.add(current.toString());
                current.setLength(0);
            } else {
                current.append(ch);
            }
        }
        cells.add(current.toString());
        return cells;
    }
}
