package com.ttennebkram.enhancer.config;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Settings of the ingestion chain: bucket names, URL lifetimes, label detection thresholds
 * and caption model parameters.
 *
 * Fields are bound directly by Gson; keys missing from the JSON keep the values assigned here.
 */
public final class IngestConfig {

    public static final String DEFAULT_RESOURCE = "/ingest.json";

    private static final Gson GSON = new GsonBuilder()
        .setFieldNamingPolicy(FieldNamingPolicy.IDENTITY)
        .setPrettyPrinting()
        .create();

    private String originalBucket = "pictures-rekog-bucket";
    private String enhancedBucket = "enhanced-pictures-rekog-bucket";
    private long originalUrlTtlSeconds = 24 * 3600;
    private long enhancedUrlTtlSeconds = 12 * 3600;
    private int maxLabels = 10;
    private double minConfidence = 75.0;
    private String userId = "anonymous";

    private String captionModelId = "us.deepseek.r1-v1:0";
    private int captionMaxTokens = 1024;
    private double captionTemperature = 0.7;
    private double captionTopP = 0.9;
    private String captionSystemPrompt =
        "You receive labels detected in photos of natural landscapes and write a description of the image "
        + "between 7 and 12 words, for example 'Beautiful clear sky near the river'. "
        + "No long paragraphs, no encyclopedic text.";

    public static IngestConfig defaults() {
        return new IngestConfig();
    }

    /**
     * Load from the bundled classpath resource, or the defaults when it is absent.
     */
    public static IngestConfig loadDefault() throws IOException {
        try (InputStream in = IngestConfig.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                return defaults();
            }
            return read(new InputStreamReader(in, StandardCharsets.UTF_8));
        }
    }

    public static IngestConfig load(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader);
        }
    }

    public static IngestConfig read(Reader reader) throws IOException {
        IngestConfig config;
        try {
            config = GSON.fromJson(reader, IngestConfig.class);
        } catch (JsonParseException e) {
            throw new IOException("Invalid ingest configuration: " + e.getMessage(), e);
        }
        if (config == null) {
            return defaults();
        }
        config.validate();
        return config;
    }

    private void validate() throws IOException {
        if (originalBucket == null || originalBucket.isBlank() || enhancedBucket == null || enhancedBucket.isBlank()) {
            throw new IOException("Bucket names must not be empty");
        }
        if (originalUrlTtlSeconds <= 0 || enhancedUrlTtlSeconds <= 0) {
            throw new IOException("URL lifetimes must be positive");
        }
        if (maxLabels < 1) {
            throw new IOException("maxLabels must be at least 1");
        }
    }

    public String toJson() {
        return GSON.toJson(this);
    }

    public String getOriginalBucket() { return originalBucket; }
    public String getEnhancedBucket() { return enhancedBucket; }
    public long getOriginalUrlTtlSeconds() { return originalUrlTtlSeconds; }
    public long getEnhancedUrlTtlSeconds() { return enhancedUrlTtlSeconds; }
    public int getMaxLabels() { return maxLabels; }
    public double getMinConfidence() { return minConfidence; }
    public String getUserId() { return userId; }
    public String getCaptionModelId() { return captionModelId; }
    public int getCaptionMaxTokens() { return captionMaxTokens; }
    public double getCaptionTemperature() { return captionTemperature; }
    public double getCaptionTopP() { return captionTopP; }
    public String getCaptionSystemPrompt() { return captionSystemPrompt; }
}
