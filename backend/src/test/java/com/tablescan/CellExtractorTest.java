package com.tablescan;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.awt.Color;
import java.awt.Point;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

class CellExtractorTest {

    private static final Map<Integer, String> NAMES = Map.of(
            Color.RED.getRGB(), "red",
            Color.GREEN.getRGB(), "green",
            Color.BLUE.getRGB(), "blue",
            Color.MAGENTA.getRGB(), "magenta");

    /** Names the colour under the centre of the slice. */
    private static final TextRecognizer BY_COLOUR =
            image -> NAMES.getOrDefault(image.getRGB(image.getWidth() / 2, image.getHeight() / 2), "?");

    private final BufferedImage textImage = SyntheticImages.binary(400, 200);
    private final BufferedImage tableImage = SyntheticImages.whitePhoto(400, 200);

    private void text(int x, int y, Color color) {
        SyntheticImages.set(textImage, x, y, SyntheticImages.TEXT_WIDTH, SyntheticImages.TEXT_HEIGHT);
        SyntheticImages.fill(tableImage, x, y, SyntheticImages.TEXT_WIDTH, SyntheticImages.TEXT_HEIGHT, color);
    }

    private void twoByTwo() {
        text(50, 40, Color.RED);
        text(250, 40, Color.GREEN);
        text(50, 140, Color.BLUE);
        text(250, 140, Color.MAGENTA);
    }

    @Test
    void extractCells_twoByTwo_recognisesEachSliceOfTheColourTable() throws Exception {
        twoByTwo();

        Table table = new CellExtractor(new TableScanProperties.Cells(), BY_COLOUR).extractCells(textImage, tableImage);

        assertEquals(List.of(List.of("red", "green"), List.of("blue", "magenta")), table.toTexts());
        Cell first = table.getCell(0, 0);
        assertEquals(62, first.image.getWidth());
        assertEquals(24, first.image.getHeight());
    }

    @Test
    void detectTextBoxes_mergesGlyphsIntoDilatedBlobs() {
        twoByTwo();

        List<TextBox> boxes = new CellExtractor(new TableScanProperties.Cells(), BY_COLOUR).detectTextBoxes(textImage, null);

        assertEquals(4, boxes.size());
        assertEquals(new BoundingBox(36, 35, 58, 20), boxes.get(0).box);
        assertEquals(1, boxes.get(3).row);
        assertEquals(1, boxes.get(3).column);
    }

    @Test
    void extractCells_failingRecognition_leavesEmptyCell() throws Exception {
        twoByTwo();
        TextRecognizer flaky = image -> {
            if (image.getRGB(image.getWidth() / 2, image.getHeight() / 2) == Color.GREEN.getRGB()) {
                throw new IOException("quota exceeded");
            }
            return BY_COLOUR.recognize(image);
        };

        Table table = new CellExtractor(new TableScanProperties.Cells(), flaky).extractCells(textImage, tableImage);

        assertEquals("", table.getText(0, 1));
        assertNotNull(table.getCell(0, 1).image);
        assertEquals("magenta", table.getText(1, 1));
    }

    @Test
    void extractCells_blankOrNullRecognition_isEmptyText() throws Exception {
        twoByTwo();

        Table table = new CellExtractor(new TableScanProperties.Cells(), image -> null).extractCells(textImage, tableImage);

        assertEquals(2, table.getRowCount());
        assertTrue(table.getCell(1, 0).isEmpty());
    }

    @Test
    void extractCells_foldsMultiLineText() throws Exception {
        text(50, 40, Color.RED);

        Table table = new CellExtractor(new TableScanProperties.Cells(), image -> "line one\n  line two\n")
                .extractCells(textImage, tableImage);

        assertEquals("line one line two", table.getText(0, 0));
    }

    @Test
    void extractCells_rowMissingOneCell_isPadded() throws Exception {
        text(20, 40, Color.RED);
        text(150, 40, Color.GREEN);
        text(280, 40, Color.BLUE);
        text(20, 140, Color.MAGENTA);
        text(150, 140, Color.RED);

        Table table = new CellExtractor(new TableScanProperties.Cells(), BY_COLOUR).extractCells(textImage, tableImage, "scan");

        assertEquals(3, table.getColumnCount());
        assertTrue(table.getCell(1, 2).isEmpty());
        assertNull(table.getCell(1, 2).image);
    }

    @Test
    void extractCells_rowMissingTwoCells_throwsIrregularGrid() {
        text(20, 40, Color.RED);
        text(150, 40, Color.GREEN);
        text(280, 40, Color.BLUE);
        text(20, 140, Color.MAGENTA);

        IrregularGridException e = assertThrows(IrregularGridException.class,
                () -> new CellExtractor(new TableScanProperties.Cells(), BY_COLOUR).extractCells(textImage, tableImage, "scan"));

        assertEquals(1, e.getRow());
        assertEquals("scan", e.getImageId());
    }

    @Test
    void extractCells_noText_returnsEmptyTableWithoutRecognition() throws Exception {
        AtomicInteger calls = new AtomicInteger();

        Table table = new CellExtractor(new TableScanProperties.Cells(), image -> {
            calls.incrementAndGet();
            return "x";
        }).extractCells(textImage, tableImage);

        assertTrue(table.isEmpty());
        assertEquals(0, calls.get());
    }

    @Test
    void extractCells_onThreadPool_keepsCellOrder() throws Exception {
        twoByTwo();
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            Table table = new CellExtractor(new TableScanProperties.Cells(), BY_COLOUR, executor, DebugImageSink.NONE)
                    .extractCells(textImage, tableImage);

            assertEquals(List.of(List.of("red", "green"), List.of("blue", "magenta")), table.toTexts());
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void extractCells_mismatchedImages_throws() {
        assertThrows(IllegalArgumentException.class, () -> new CellExtractor(new TableScanProperties.Cells(), BY_COLOUR)
                .extractCells(textImage, SyntheticImages.whitePhoto(10, 10)));
    }

    @Test
    void filterBoxes_dropsTinyHugeAndFlatBoxes() {
        CellExtractor extractor = new CellExtractor(new TableScanProperties.Cells(), BY_COLOUR);
        List<Contour> contours = new ArrayList<>();
        contours.add(contour(new BoundingBox(0, 0, 20, 20)));
        contours.add(contour(new BoundingBox(30, 0, 20, 20)));
        contours.add(contour(new BoundingBox(60, 0, 20, 20)));
        contours.add(contour(new BoundingBox(0, 50, 100, 4)));    // line residue
        contours.add(contour(new BoundingBox(0, 60, 5, 5)));      // speck
        contours.add(contour(new BoundingBox(0, 0, 100, 60)));    // spans most of the image

        List<BoundingBox> kept = extractor.filterBoxes(contours, 100 * 100);

        assertEquals(3, kept.size());
        for (BoundingBox box : kept) {
            assertEquals(20, box.height);
        }
    }

    @Test
    void constructor_rejectsNegativeMargin() {
        TableScanProperties.Cells settings = new TableScanProperties.Cells();
        settings.setCellMargin(-1);

        assertThrows(IllegalArgumentException.class, () -> new CellExtractor(settings, BY_COLOUR));
    }

    private static Contour contour(BoundingBox box) {
        return new Contour(List.of(new Point(box.x, box.y)), box, box.area(), box.area());
    }
}
