package com.ttennebkram.enhancer.config;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.ttennebkram.enhancer.model.EnhancementAlgorithm;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable configuration for the ImageEnhancer.
 *
 * JSON layout:
 * <pre>
 * {
 *   "algorithm": "ToneMapDrago",
 *   "maxDimension": 12000,
 *   "processors": {
 *     "ContrastGamma": { "clipLimit": 2.0, "tileSize": 8, "gamma": 0.8, "jpegQuality": 95 },
 *     "ToneMapDrago":  { "gamma": 1.0, "saturation": 0.7, "bias": 0.85 }
 *   }
 * }
 * </pre>
 * Missing keys fall back to the defaults; missing processor blocks keep the processor's own defaults.
 */
public final class EnhancerConfig {

    public static final String DEFAULT_RESOURCE = "/enhancer.json";
    public static final String DEFAULT_ALGORITHM = EnhancementAlgorithm.TONE_MAP_DRAGO.getId();
    public static final int DEFAULT_MAX_DIMENSION = 12000;

    private final String algorithm;
    private final int maxDimension;
    private final Map<String, JsonObject> processorProperties;

    private EnhancerConfig(String algorithm, int maxDimension, Map<String, JsonObject> processorProperties) {
        if (maxDimension < 1) {
            throw new IllegalArgumentException("maxDimension must be positive: " + maxDimension);
        }
        this.algorithm = algorithm;
        this.maxDimension = maxDimension;
        Map<String, JsonObject> copy = new LinkedHashMap<>();
        processorProperties.forEach((id, props) -> copy.put(id, props.deepCopy()));
        this.processorProperties = Collections.unmodifiableMap(copy);
    }

    public static EnhancerConfig defaults() {
        return new EnhancerConfig(DEFAULT_ALGORITHM, DEFAULT_MAX_DIMENSION, Collections.emptyMap());
    }

    /**
     * Load from the bundled classpath resource, or the defaults when it is absent.
     */
    public static EnhancerConfig loadDefault() throws IOException {
        try (InputStream in = EnhancerConfig.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                return defaults();
            }
            return read(new InputStreamReader(in, StandardCharsets.UTF_8));
        }
    }

    public static EnhancerConfig load(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader);
        }
    }

    public static EnhancerConfig read(Reader reader) throws IOException {
        try {
            JsonElement root = JsonParser.parseReader(reader);
            if (!root.isJsonObject()) {
                throw new IOException("Enhancer configuration must be a JSON object");
            }
            return fromJson(root.getAsJsonObject());
        } catch (JsonParseException | IllegalStateException | IllegalArgumentException | UnsupportedOperationException e) {
            throw new IOException("Invalid enhancer configuration: " + e.getMessage(), e);
        }
    }

    public static EnhancerConfig fromJson(JsonObject json) {
        String algorithm = json.has("algorithm") ? json.get("algorithm").getAsString() : DEFAULT_ALGORITHM;
        int maxDimension = json.has("maxDimension") ? json.get("maxDimension").getAsInt() : DEFAULT_MAX_DIMENSION;

        Map<String, JsonObject> processors = new LinkedHashMap<>();
        if (json.has("processors")) {
            for (Map.Entry<String, JsonElement> entry : json.getAsJsonObject("processors").entrySet()) {
                processors.put(entry.getKey(), entry.getValue().getAsJsonObject());
            }
        }
        return new EnhancerConfig(algorithm, maxDimension, processors);
    }

    public JsonObject toJson() {
        JsonObject json = new JsonObject();
        json.addProperty("algorithm", algorithm);
        json.addProperty("maxDimension", maxDimension);
        JsonObject processors = new JsonObject();
        processorProperties.forEach((id, props) -> processors.add(id, props.deepCopy()));
        json.add("processors", processors);
        return json;
    }

    public EnhancerConfig withAlgorithm(String newAlgorithm) {
        return new EnhancerConfig(newAlgorithm, maxDimension, processorProperties);
    }

    public EnhancerConfig withAlgorithm(EnhancementAlgorithm newAlgorithm) {
        return withAlgorithm(newAlgorithm.getId());
    }

    public EnhancerConfig withMaxDimension(int newMaxDimension) {
        return new EnhancerConfig(algorithm, newMaxDimension, processorProperties);
    }

    public EnhancerConfig withProcessorProperties(String algorithmId, JsonObject properties) {
        Map<String, JsonObject> copy = new LinkedHashMap<>(processorProperties);
        copy.put(algorithmId, properties);
        return new EnhancerConfig(algorithm, maxDimension, copy);
    }

    /** Algorithm id used when the caller does not select one. Not validated here. */
    public String getAlgorithm() {
        return algorithm;
    }

    public int getMaxDimension() {
        return maxDimension;
    }

    /**
     * Properties for one processor, or null when the configuration leaves it at its defaults.
     */
    public JsonObject getProcessorProperties(String algorithmId) {
        JsonObject props = processorProperties.get(algorithmId);
        return props == null ? null : props.deepCopy();
    }

    @Override
    public String toString() {
        return "EnhancerConfig" + toJson();
    }
}
