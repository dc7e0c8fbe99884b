package com.ttennebkram.enhancer.processors;

import com.google.gson.JsonObject;
import org.opencv.core.CvType;
import org.opencv.core.Mat;

/**
 * Abstract base class for enhancement processors.
 * Provides common functionality and helper methods.
 */
public abstract class EnhancementProcessorBase implements EnhancementProcessor {

    /**
     * Standard null/empty/format check for input validation.
     * Processors only accept 8-bit 3-channel images.
     */
    protected boolean isInvalidInput(Mat input) {
        return input == null || input.empty() || input.type() != CvType.CV_8UC3;
    }

    /**
     * Helper to safely get an int from JSON.
     */
    protected int getJsonInt(JsonObject json, String key, int defaultValue) {
        if (json != null && json.has(key)) {
            return json.get(key).getAsInt();
        }
        return defaultValue;
    }

    /**
     * Helper to safely get a double from JSON.
     */
    protected double getJsonDouble(JsonObject json, String key, double defaultValue) {
        if (json != null && json.has(key)) {
            return json.get(key).getAsDouble();
        }
        return defaultValue;
    }

    @Override
    public String toString() {
        JsonObject json = new JsonObject();
        serializeProperties(json);
        return getAlgorithmId() + json;
    }
}
