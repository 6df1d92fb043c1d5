package com.tablescan;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

@RestController
@RequestMapping("/api")
@CrossOrigin(
        origins = "*",
        allowedHeaders = "*",
        methods = {RequestMethod.GET, RequestMethod.POST, RequestMethod.OPTIONS}
)
public class TableScanApi {

    private static final Logger log = LoggerFactory.getLogger(TableScanApi.class);

    private static final MediaType TEXT_UTF8 = new MediaType("text", "plain", StandardCharsets.UTF_8);
    private static final double MAX_PENDING_PROGRESS = 0.95;

    /** Progress of one asynchronous request. */
    static class Session {
        volatile double progress;
        volatile String message = "Processing...";
        volatile String result;
        volatile TableExtractionException failure;
        volatile String error;
    }

    private final TablePipeline pipeline;
    private final Map<String, Session> sessions = new ConcurrentHashMap<>();

    public TableScanApi(TablePipeline pipeline) {
        this.pipeline = pipeline;
    }

    @GetMapping("/health")
    public ResponseEntity<?> healthCheck() {
        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "message", "Table Scan API is running",
                "version", "1.0.0"
        ));
    }

    @PostMapping("/table/process")
    public ResponseEntity<?> processTable(@RequestParam("image") MultipartFile imageFile,
                                          @RequestParam(value = "format", defaultValue = "json") String format) {
        String imageId = imageIdFor(imageFile);
        log.info("Received image {} ({} bytes)", imageId, imageFile.getSize());

        BufferedImage photo;
        try {
            photo = PhotoLoader.load(imageFile.getBytes());
        } catch (IOException e) {
            log.warn("Rejecting {}: {}", imageId, e.getMessage());
            return ResponseEntity.badRequest().body(Map.of(
                    "success", false,
                    "error", "Could not read image: " + e.getMessage()
            ));
        }

        try {
            Table table = pipeline.process(imageId, photo);
            return render(imageId, table, format);
        } catch (TableExtractionException e) {
            return failure(e);
        }
    }

    @PostMapping("/table/process-with-progress")
    public ResponseEntity<?> processTableWithProgress(@RequestParam("image") MultipartFile imageFile) {
        String sessionId = UUID.randomUUID().toString();

        // decode before returning: the upload is gone once the request completes
        BufferedImage photo;
        try {
            photo = PhotoLoader.load(imageFile.getBytes());
        } catch (IOException e) {
            log.warn("Rejecting upload for session {}: {}", sessionId, e.getMessage());
            return ResponseEntity.badRequest().body(Map.of(
                    "success", false,
                    "error", "Could not read image: " + e.getMessage()
            ));
        }

        Session session = new Session();
        sessions.put(sessionId, session);
        updateProgress(sessionId, session, 0.05, "Image received...");

        // only a stored result may report completion
        pipeline.submit(sessionId, photo, (fraction, message) ->
                        updateProgress(sessionId, session, Math.min(fraction, MAX_PENDING_PROGRESS), message))
                .whenComplete((table, throwable) -> {
                    if (throwable == null) {
                        session.result = TableReviewGenerator.toReviewJson(sessionId, table);
                        updateProgress(sessionId, session, 1.0, "Completed! Ready for review.");
                        return;
                    }
                    Throwable cause = throwable instanceof CompletionException && throwable.getCause() != null
                            ? throwable.getCause() : throwable;
                    if (cause instanceof TableExtractionException) {
                        session.failure = (TableExtractionException) cause;
                    } else {
                        log.error("Background processing failed for session {}", sessionId, cause);
                    }
                    session.error = cause.getMessage();
                    updateProgress(sessionId, session, 0.0, "Error: " + cause.getMessage());
                });

        return ResponseEntity.ok(Map.of("sessionId", sessionId));
    }

    @GetMapping("/table/progress/{sessionId}")
    public ResponseEntity<?> getProgress(@PathVariable String sessionId) {
        Session session = sessions.get(sessionId);
        if (session == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(Map.of(
                "progress", session.progress,
                "message", session.message
        ));
    }

    @GetMapping("/table/result/{sessionId}")
    public ResponseEntity<?> getResult(@PathVariable String sessionId) {
        Session session = sessions.get(sessionId);
        if (session == null || (session.result == null && session.error == null)) {
            return ResponseEntity.notFound().build();
        }
        sessions.remove(sessionId);

        if (session.failure != null) {
            return failure(session.failure);
        }
        if (session.error != null) {
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of(
                    "success", false,
                    "error", session.error
            ));
        }
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_JSON)
                .body(session.result);
    }

    @PostMapping(value = "/table/submit", consumes = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<?> submitTable(@RequestBody String reviewedTable) {
        log.info("Received reviewed table ({} chars)", reviewedTable.length());
        ReviewedTableValidator.ValidationResult validation = ReviewedTableValidator.validate(reviewedTable);

        if (!validation.isValid) {
            return ResponseEntity.badRequest().body(Map.of(
                    "success", false,
                    "errors", validation.errors,
                    "warnings", validation.warnings
            ));
        }

        return ResponseEntity.ok(Map.of(
                "success", true,
                "message", "Table validated successfully",
                "rows", validation.table.getRowCount(),
                "columns", validation.table.getColumnCount(),
                "warnings", validation.warnings
        ));
    }

    private ResponseEntity<?> render(String imageId, Table table, String format) {
        if ("text".equalsIgnoreCase(format)) {
            return ResponseEntity.ok()
                    .contentType(TEXT_UTF8)
                    .body(TableFileFormat.write(table));
        }
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_JSON)
                .body(TableReviewGenerator.toReviewJson(imageId, table));
    }

    private ResponseEntity<?> failure(TableExtractionException e) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("error", e.getMessage());
        body.put("stage", e.getStage().name());
        body.put("imageId", e.getImageId());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(body);
    }

    private void updateProgress(String sessionId, Session session, double progress, String message) {
        session.progress = progress;
        session.message = message;
        log.debug("Session {}: {}% - {}", sessionId, Math.round(progress * 100), message);
    }

    private static String imageIdFor(MultipartFile file) {
        String name = file.getOriginalFilename();
        return name == null || name.isBlank() ? UUID.randomUUID().toString() : name;
    }
}
