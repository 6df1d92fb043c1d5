package com.tablescan;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Turns the text-only image into a table: text blobs become boxes, boxes get grid
 * positions, and every box is cut out of the located colour table and recognised.
 *
 * <p>Recognition of the cells runs on the supplied executor. A cell whose recognition fails
 * is kept with empty text.
 */
public class CellExtractor {

    private static final Logger log = LoggerFactory.getLogger(CellExtractor.class);

    private final TableScanProperties.Cells settings;
    private final List<StructuringElement> textDilation;
    private final TextBoxOrderer orderer;
    private final TextRecognizer recognizer;
    private final Executor recognitionExecutor;
    private final DebugImageSink debug;

    /** Recognises cells one after another on the calling thread. */
    public CellExtractor(TableScanProperties.Cells settings, TextRecognizer recognizer) {
        this(settings, recognizer, Runnable::run, DebugImageSink.NONE);
    }

    public CellExtractor(TableScanProperties.Cells settings, TextRecognizer recognizer,
                         Executor recognitionExecutor, DebugImageSink debug) {
        if (settings.getMinBoxArea() < 0 || settings.getCellMargin() < 0 || settings.getMaxPaddedCellsPerRow() < 0) {
            throw new IllegalArgumentException("min-box-area, cell-margin and max-padded-cells-per-row cannot be negative");
        }
        if (settings.getMaxBoxAreaRatio() <= 0 || settings.getMaxBoxAreaRatio() > 1) {
            throw new IllegalArgumentException("max-box-area-ratio must be within (0, 1]: " + settings.getMaxBoxAreaRatio());
        }
        this.settings = settings;
        List<StructuringElement> elements = new ArrayList<>();
        for (TableScanProperties.KernelSpec kernel : settings.getTextDilation()) {
            elements.add(kernel.toElement());
        }
        this.textDilation = elements;
        this.orderer = TextBoxOrderer.from(settings);
        this.recognizer = recognizer;
        this.recognitionExecutor = recognitionExecutor;
        this.debug = debug;
    }

    public Table extractCells(BufferedImage textImage, BufferedImage tableImage) throws IrregularGridException {
        return extractCells(textImage, tableImage, null);
    }

    /**
     * @param textImage  binary text-only image from the structure remover
     * @param tableImage located colour table the cells are sliced from; same size as {@code textImage}
     */
    public Table extractCells(BufferedImage textImage, BufferedImage tableImage, String imageId) throws IrregularGridException {
        ImageProcessor.requireSameSize(textImage, tableImage);

        List<TextBox> boxes = detectTextBoxes(textImage, imageId);
        if (boxes.isEmpty()) {
            log.warn("No text found in {}, returning an empty table", label(imageId));
            return Table.empty();
        }

        List<CompletableFuture<Cell>> pending = new ArrayList<>(boxes.size());
        for (TextBox textBox : boxes) {
            BoundingBox slice = textBox.box.expand(settings.getCellMargin(), tableImage.getWidth(), tableImage.getHeight());
            BufferedImage cellImage = ImageProcessor.crop(tableImage, slice);
            pending.add(CompletableFuture.supplyAsync(
                    () -> new Cell(textBox.row, textBox.column, cellImage, recognizeSafely(cellImage, textBox, imageId)),
                    recognitionExecutor));
        }

        List<Cell> cells = new ArrayList<>(pending.size());
        for (CompletableFuture<Cell> future : pending) {
            cells.add(future.join());
        }

        Table table = Table.assemble(cells, settings.getMaxPaddedCellsPerRow(), imageId);
        long empty = cells.stream().filter(Cell::isEmpty).count();
        log.info("Extracted {} table from {}: {} cells recognised, {} empty",
                table.getRowCount() + "x" + table.getColumnCount(), label(imageId), cells.size() - empty, empty);
        return table;
    }

    /** Blob detection, filtering and ordering, without recognition. */
    public List<TextBox> detectTextBoxes(BufferedImage textImage, String imageId) {
        BufferedImage blobs = textImage;
        for (StructuringElement element : textDilation) {
            blobs = Morphology.dilate(blobs, element);
        }
        debug.publish(imageId, "cells_blobs", blobs);

        List<BoundingBox> candidates = filterBoxes(ContourFinder.findContours(blobs),
                (double) textImage.getWidth() * textImage.getHeight());
        List<TextBox> ordered = orderer.order(candidates);
        for (TextBox box : ordered) {
            log.debug("Text box {}", box);
        }
        return ordered;
    }

    List<BoundingBox> filterBoxes(List<Contour> contours, double imageArea) {
        double maxArea = settings.getMaxBoxAreaRatio() * imageArea;
        List<BoundingBox> sized = new ArrayList<>();
        for (Contour contour : contours) {
            BoundingBox box = contour.getBoundingBox();
            if (box.area() < settings.getMinBoxArea()) {
                log.debug("Dropping {}: below minimum area {}", box, settings.getMinBoxArea());
            } else if (box.area() > maxArea) {
                log.debug("Dropping {}: spans more than {} of the image", box, settings.getMaxBoxAreaRatio());
            } else {
                sized.add(box);
            }
        }
        if (sized.isEmpty() || settings.getMinHeightToMeanRatio() <= 0) return sized;

        double meanHeight = sized.stream().mapToInt(b -> b.height).average().orElse(0);
        double minHeight = meanHeight * settings.getMinHeightToMeanRatio();
        List<BoundingBox> kept = new ArrayList<>(sized.size());
        for (BoundingBox box : sized) {
            if (box.height < minHeight) {
                log.debug("Dropping {}: lower than {} px (mean height {})", box, Math.round(minHeight), Math.round(meanHeight));
            } else {
                kept.add(box);
            }
        }
        return kept;
    }

    private String recognizeSafely(BufferedImage cellImage, TextBox textBox, String imageId) {
        try {
            String text = recognizer.recognize(cellImage);
            if (text == null || text.isBlank()) {
                log.warn("No text recognised in {} cell {},{}", label(imageId), textBox.row, textBox.column);
                return "";
            }
            return TableFileFormat.foldLineBreaks(text);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Recognition interrupted in {} cell {},{}", label(imageId), textBox.row, textBox.column);
            return "";
        } catch (Exception e) {
            log.warn("Recognition failed in {} cell {},{}: {}", label(imageId), textBox.row, textBox.column, e.getMessage());
            return "";
        }
    }

    private static String label(String imageId) {
        return imageId == null ? "table" : imageId;
    }
}
