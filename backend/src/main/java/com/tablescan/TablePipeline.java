package com.tablescan;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Photo in, table out: locate, remove structure, extract cells.
 *
 * <p>One image runs synchronously on the calling thread. {@link #submit} and
 * {@link #processBatch} run each image as its own task on the image executor. A failed
 * image never yields a partial table.
 */
public class TablePipeline {

    private static final Logger log = LoggerFactory.getLogger(TablePipeline.class);

    @FunctionalInterface
    public interface ProgressListener {

        ProgressListener NONE = (fraction, message) -> { };

        void onProgress(double fraction, String message);
    }

    /** Outcome for one image of a batch: a table or the reason there is none. */
    public static final class PipelineResult {

        public final String imageId;
        public final Table table;
        public final Exception failure;

        private PipelineResult(String imageId, Table table, Exception failure) {
            this.imageId = imageId;
            this.table = table;
            this.failure = failure;
        }

        public static PipelineResult success(String imageId, Table table) {
            return new PipelineResult(imageId, table, null);
        }

        public static PipelineResult failure(String imageId, Exception failure) {
            return new PipelineResult(imageId, null, failure);
        }

        public boolean isSuccess() {
            return failure == null;
        }

        @Override
        public String toString() {
            return imageId + ": " + (isSuccess() ? table : failure.getMessage());
        }
    }

    private final TableLocator locator;
    private final StructureRemover structureRemover;
    private final CellExtractor cellExtractor;
    private final Executor imageExecutor;

    public TablePipeline(TableLocator locator, StructureRemover structureRemover, CellExtractor cellExtractor,
                         Executor imageExecutor) {
        this.locator = locator;
        this.structureRemover = structureRemover;
        this.cellExtractor = cellExtractor;
        this.imageExecutor = imageExecutor;
    }

    public Table process(String imageId, BufferedImage photo) throws TableExtractionException {
        return process(imageId, photo, ProgressListener.NONE);
    }

    public Table process(String imageId, BufferedImage photo, ProgressListener listener) throws TableExtractionException {
        long start = System.currentTimeMillis();
        try {
            listener.onProgress(0.1, "Locating table...");
            LocatedTable located = locator.locate(photo, imageId);

            listener.onProgress(0.35, "Removing grid lines and icons...");
            BufferedImage text = structureRemover.removeStructure(located.image, imageId);

            listener.onProgress(0.6, "Recognising cells...");
            Table table = cellExtractor.extractCells(text, located.image, imageId);

            listener.onProgress(1.0, "Completed! Ready for review.");
            log.info("Processed {} in {} ms: {}", imageId, System.currentTimeMillis() - start, table);
            return table;
        } catch (TableExtractionException e) {
            e.forImage(imageId);
            log.warn("Giving up on {} at {}: {}", imageId, e.getStage(), e.getMessage());
            throw e;
        }
    }

    /**
     * Runs one image on the image executor. The future fails with a
     * {@link CompletionException} whose cause is the {@link TableExtractionException}.
     */
    public CompletableFuture<Table> submit(String imageId, BufferedImage photo, ProgressListener listener) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return process(imageId, photo, listener);
            } catch (TableExtractionException e) {
                throw new CompletionException(e);
            }
        }, imageExecutor);
    }

    /** One result per image, in the iteration order of {@code photos}. */
    public Map<String, PipelineResult> processBatch(Map<String, BufferedImage> photos) {
        Map<String, CompletableFuture<Table>> pending = new LinkedHashMap<>();
        for (Map.Entry<String, BufferedImage> entry : photos.entrySet()) {
            pending.put(entry.getKey(), submit(entry.getKey(), entry.getValue(), ProgressListener.NONE));
        }

        Map<String, PipelineResult> results = new LinkedHashMap<>();
        int failed = 0;
        for (Map.Entry<String, CompletableFuture<Table>> entry : pending.entrySet()) {
            try {
                results.put(entry.getKey(), PipelineResult.success(entry.getKey(), entry.getValue().join()));
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                Exception failure = cause instanceof Exception ? (Exception) cause : new RuntimeException(cause);
                if (!(failure instanceof TableExtractionException)) {
                    log.error("Unexpected failure processing {}", entry.getKey(), failure);
                }
                results.put(entry.getKey(), PipelineResult.failure(entry.getKey(), failure));
                failed++;
            }
        }
        log.info("Batch of {} images done, {} failed", photos.size(), failed);
        return results;
    }
}
