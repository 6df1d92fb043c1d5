package com.tablescan;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TableFileFormatTest {

    @TempDir
    Path tempDir;

    @Test
    void write_escapesDelimiterAndBackslash() {
        Table table = Table.ofTexts(List.of(List.of("a", "b|c"), List.of("d\\e", "")));

        assertEquals("a|b\\|c\nd\\\\e|\n", TableFileFormat.write(table));
    }

    @Test
    void read_undoesWrite() throws Exception {
        Table table = Table.ofTexts(List.of(List.of("Name", "Qty|Unit", "C:\\temp"), List.of("", "ü", "x")));

        assertEquals(table.toTexts(), TableFileFormat.read(TableFileFormat.write(table)).toTexts());
    }

    @Test
    void read_undoesWriteOfAssembledTableWithPaddedCell() throws Exception {
        Table assembled = Table.assemble(List.of(
                new Cell(1, 0, null, "d"),
                new Cell(0, 1, null, "c"),
                new Cell(0, 0, null, "a|b")), 1, "scan.png");

        Table read = TableFileFormat.read(TableFileFormat.write(assembled));

        assertEquals(2, read.getRowCount());
        assertEquals(2, read.getColumnCount());
        assertEquals(List.of(List.of("a|b", "c"), List.of("d", "")), read.toTexts());
        assertTrue(read.getCell(1, 1).isEmpty());
        for (int r = 0; r < 2; r++) {
            for (int c = 0; c < 2; c++) {
                assertEquals(r, read.getCell(r, c).row);
                assertEquals(c, read.getCell(r, c).column);
            }
        }
    }

    @Test
    void write_foldsLineBreaksInsideCells() {
        Table table = Table.ofTexts(List.of(List.of("two\n lines", "crlf\r\nhere")));

        assertEquals("two lines|crlf here\n", TableFileFormat.write(table));
    }

    @Test
    void read_irregularRow_throws() {
        IrregularGridException e = assertThrows(IrregularGridException.class, () -> TableFileFormat.read("a|b\nc\n"));

        assertEquals(1, e.getRow());
        assertEquals(1, e.getActualColumns());
        assertEquals(2, e.getExpectedColumns());
    }

    @Test
    void read_acceptsCarriageReturnsAndMissingFinalNewline() throws Exception {
        assertEquals(List.of(List.of("a", "b"), List.of("c", "d")), TableFileFormat.read("a|b\r\nc|d").toTexts());
    }

    @Test
    void read_emptyLineInSingleColumnTable_isEmptyCell() throws Exception {
        Table table = TableFileFormat.read("x\n\ny\n");

        assertEquals(3, table.getRowCount());
        assertEquals(1, table.getColumnCount());
        assertTrue(table.getCell(1, 0).isEmpty());
    }

    @Test
    void read_emptyContent_isEmptyTable() throws Exception {
        assertTrue(TableFileFormat.read("").isEmpty());
        assertTrue(TableFileFormat.read((String) null).isEmpty());
    }

    @Test
    void writeAndReadPath_useUtf8() throws Exception {
        Path file = tempDir.resolve("table.txt");
        Table table = Table.ofTexts(List.of(List.of("Größe", "€")));

        TableFileFormat.write(table, file);

        assertEquals("Größe|€\n", Files.readString(file, StandardCharsets.UTF_8));
        assertEquals(table.toTexts(), TableFileFormat.read(file).toTexts());
    }

    @Test
    void foldLineBreaks_collapsesSurroundingWhitespace() {
        assertEquals("line one line two", TableFileFormat.foldLineBreaks("  line one \n\n  line two "));
        assertEquals("", TableFileFormat.foldLineBreaks(null));
    }
}
