package com.ttennebkram.enhancer.ingest;

import com.google.gson.JsonObject;
import com.ttennebkram.enhancer.config.IngestConfig;
import com.ttennebkram.enhancer.processing.EnhancementException;
import com.ttennebkram.enhancer.processing.ImageEnhancer;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Runs one upload through the chain: store original, detect labels, caption, enhance,
 * store enhanced copy, persist the record, answer with a JSON payload.
 *
 * Only a missing/invalid request, a failed original upload or a failed record write end the
 * request with an error status. Label, caption and enhancement failures are recorded in the
 * results and the request still succeeds.
 */
public class ImageIngestionService {

    private static final Logger LOG = Logger.getLogger(ImageIngestionService.class.getName());

    static final String ENHANCED_FILE_TYPE = "image/jpeg";
    static final String ENHANCED_SUFFIX = "_enhanced.jpg";
    static final String STATUS_COMPLETED = "completed";

    private final ImageEnhancer enhancer;
    private final ObjectStore objectStore;
    private final LabelDetector labelDetector;
    private final CaptionGenerator captionGenerator;
    private final RecordStore recordStore;
    private final IngestConfig config;
    private final Executor enhancementExecutor;
    private final Clock clock;
    private final Supplier<String> idGenerator;

    /**
     * Service that enhances on the calling thread, with UTC timestamps and random UUID ids.
     */
    public ImageIngestionService(ImageEnhancer enhancer, ObjectStore objectStore, LabelDetector labelDetector,
                                 CaptionGenerator captionGenerator, RecordStore recordStore, IngestConfig config) {
        this(enhancer, objectStore, labelDetector, captionGenerator, recordStore, config,
            Runnable::run, Clock.systemUTC(), () -> UUID.randomUUID().toString());
    }

    /**
     * @param enhancementExecutor runs the enhancement while labels and caption are requested;
     *                            {@code Runnable::run} keeps everything on the calling thread
     */
    public ImageIngestionService(ImageEnhancer enhancer, ObjectStore objectStore, LabelDetector labelDetector,
                                 CaptionGenerator captionGenerator, RecordStore recordStore, IngestConfig config,
                                 Executor enhancementExecutor, Clock clock, Supplier<String> idGenerator) {
        this.enhancer = Objects.requireNonNull(enhancer, "enhancer");
        this.objectStore = Objects.requireNonNull(objectStore, "objectStore");
        this.labelDetector = Objects.requireNonNull(labelDetector, "labelDetector");
        this.captionGenerator = Objects.requireNonNull(captionGenerator, "captionGenerator");
        this.recordStore = Objects.requireNonNull(recordStore, "recordStore");
        this.config = Objects.requireNonNull(config, "config");
        this.enhancementExecutor = Objects.requireNonNull(enhancementExecutor, "enhancementExecutor");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
    }

    /**
     * Entry point for a raw JSON request body.
     */
    public IngestResponse handle(String body) {
        IngestRequest request;
        try {
            request = IngestRequest.fromJson(body);
        } catch (IllegalArgumentException e) {
            return IngestResponse.error(400, e.getMessage());
        }
        return process(request);
    }

    public IngestResponse process(IngestRequest request) {
        try {
            return processRequest(request);
        } catch (RuntimeException e) {
            LOG.log(Level.SEVERE, "Unexpected failure processing " + request.getFileName(), e);
            return IngestResponse.error(500, "Internal server error", String.valueOf(e.getMessage()));
        }
    }

    private IngestResponse processRequest(IngestRequest request) {
        if (request.getImage() == null || request.getImage().isBlank()) {
            return IngestResponse.error(400, "Image data not found in the event");
        }
        if (request.getFileName() == null || request.getFileName().isBlank()) {
            return IngestResponse.error(400, "File name not found in the event");
        }

        byte[] imageBytes;
        try {
            imageBytes = request.decodeImage();
        } catch (IllegalArgumentException e) {
            return IngestResponse.error(400, "Failed to decode image: " + e.getMessage());
        }
        if (imageBytes.length == 0) {
            return IngestResponse.error(400, "Failed to decode image: payload is empty");
        }

        String fileName = request.getFileName();
        String originalBucket = config.getOriginalBucket();

        // Every later stage reads the stored original, so this one is fatal
        String originalUrl;
        try {
            objectStore.put(originalBucket, fileName, imageBytes, request.getFileType());
            originalUrl = objectStore.sign(originalBucket, fileName, config.getOriginalUrlTtlSeconds());
        } catch (ObjectStoreException e) {
            LOG.log(Level.WARNING, "Original upload failed for " + fileName, e);
            if (e.getKind() == ObjectStoreException.Kind.NOT_FOUND) {
                return IngestResponse.error(500, "Bucket " + originalBucket + " does not exist");
            }
            return IngestResponse.error(500, "Upload failed: " + e.getMessage());
        }

        // Enhancement only needs the original bytes
        CompletableFuture<byte[]> enhancement = startEnhancement(imageBytes);

        ProcessingResults results = new ProcessingResults(fileName, now());
        results.setUrl(originalUrl);
        detectLabels(results, originalBucket, fileName);
        generateCaption(results);
        storeEnhanced(results, enhancement, enhancedFileName(fileName));

        EnhancedImage enhanced = results.getEnhanced();
        results.setSummary(new ProcessingSummary(
            results.getLabels().size(), !results.getErrors().isEmpty(), enhanced != null));

        ImageRecord record = ImageRecord.builder(idGenerator.get())
            .userId(config.getUserId())
            .fileName(fileName)
            .fileType(request.getFileType())
            .url(originalUrl)
            .enhancedFileName(enhanced != null ? enhanced.getFileName() : null)
            .enhancedFileType(enhanced != null ? ENHANCED_FILE_TYPE : null)
            .enhancedUrl(enhanced != null ? enhanced.getUrl() : null)
            .labels(labelNames(results.getLabels()))
            .labelDetails(results.getLabels())
            .description(results.getCaption())
            .status(STATUS_COMPLETED)
            .createdAt(now())
            .processedAt(results.getProcessedAt())
            .processingSummary(results.getSummary())
            .build();

        ImageRecord stored;
        try {
            recordStore.put(record);
            stored = recordStore.get(record.getProcessId()).orElse(record);
        } catch (RecordStoreException e) {
            LOG.log(Level.WARNING, "Record write failed for " + record.getProcessId(), e);
            return IngestResponse.error(500, "Internal server error", "Record store failed: " + e.getMessage());
        }

        LOG.info(String.format("Processed %s as %s: %d labels, %d errors, enhanced=%s",
            fileName, record.getProcessId(), results.getLabels().size(), results.getErrors().size(), enhanced != null));

        JsonObject body = new JsonObject();
        body.addProperty("message", "Image processed successfully");
        body.addProperty("fileName", fileName);
        body.addProperty("processId", record.getProcessId());
        body.add("results", IngestResponse.GSON.toJsonTree(results));
        body.add("record", IngestResponse.GSON.toJsonTree(stored));
        return IngestResponse.ok(body);
    }

    /**
     * All stored records, in the listing format of the gallery endpoint.
     */
    public IngestResponse listRecords() {
        JsonObject body = new JsonObject();
        try {
            List<ImageRecord> items = recordStore.findAll();
            body.addProperty("success", true);
            body.addProperty("count", items.size());
            body.add("items", IngestResponse.GSON.toJsonTree(items));
            return IngestResponse.okJson(body);
        } catch (RecordStoreException e) {
            LOG.log(Level.WARNING, "Record listing failed", e);
            body.addProperty("success", false);
            body.addProperty("error", "Record store error: " + e.getMessage());
            return IngestResponse.withBody(400, body);
        } catch (RuntimeException e) {
            LOG.log(Level.SEVERE, "Record listing failed", e);
            body.addProperty("success", false);
            body.addProperty("error", "Internal error: " + e.getMessage());
            return IngestResponse.withBody(500, body);
        }
    }

    private CompletableFuture<byte[]> startEnhancement(byte[] imageBytes) {
        try {
            return CompletableFuture.supplyAsync(() -> {
                try {
                    return enhancer.enhance(imageBytes);
                } catch (EnhancementException e) {
                    throw new CompletionException(e);
                }
            }, enhancementExecutor);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private void detectLabels(ProcessingResults results, String bucket, String fileName) {
        try {
            results.setLabels(labelDetector.detect(bucket, fileName, config.getMaxLabels(), config.getMinConfidence()));
        } catch (LabelDetectionException | RuntimeException e) {
            recordFailure(results, "Label detection failed: " + e.getMessage(), e);
        }
    }

    private void generateCaption(ProcessingResults results) {
        try {
            CaptionRequest request = CaptionRequest.forLabels(labelNames(results.getLabels()), config);
            results.setCaption(CaptionRequest.extractCaption(captionGenerator.generate(request)));
        } catch (CaptionException | RuntimeException e) {
            recordFailure(results, "Description generation failed: " + e.getMessage(), e);
        }
    }

    private void storeEnhanced(ProcessingResults results, CompletableFuture<byte[]> enhancement, String enhancedName) {
        byte[] enhancedBytes;
        try {
            enhancedBytes = enhancement.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            recordFailure(results, "Image enhancement failed: " + cause.getMessage(), cause);
            return;
        }

        String bucket = config.getEnhancedBucket();
        try {
            objectStore.put(bucket, enhancedName, enhancedBytes, ENHANCED_FILE_TYPE);
            String url = objectStore.sign(bucket, enhancedName, config.getEnhancedUrlTtlSeconds());
            results.setEnhanced(new EnhancedImage(enhancedName, bucket, url, now()));
        } catch (ObjectStoreException e) {
            recordFailure(results, "Image enhancement failed: " + e.getMessage(), e);
        }
    }

    private void recordFailure(ProcessingResults results, String error, Throwable cause) {
        LOG.log(Level.WARNING, results.getFileName() + ": " + error, cause);
        results.addError(error);
    }

    /**
     * photo.png becomes photo_enhanced.jpg; the output is always JPEG.
     */
    static String enhancedFileName(String fileName) {
        int dot = fileName.lastIndexOf('.');
        String base = dot > fileName.lastIndexOf('/') ? fileName.substring(0, dot) : fileName;
        return base + ENHANCED_SUFFIX;
    }

    private static List<String> labelNames(List<DetectedLabel> labels) {
        return labels.stream().map(DetectedLabel::getName).collect(Collectors.toList());
    }

    private String now() {
        return Instant.now(clock).toString();
    }
}
