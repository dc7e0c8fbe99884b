package com.ttennebkram.enhancer.processors;

import com.google.gson.JsonObject;
import com.ttennebkram.enhancer.processing.ImageProcessor;
import org.opencv.core.Mat;

/**
 * Interface for self-contained enhancement processors.
 * Each processor encapsulates:
 * - Processing logic (OpenCV operations)
 * - Its JPEG encoder settings
 * - Serialization/deserialization of its parameters (JSON)
 *
 * Parameters are loaded once, before the processor is shared; process() must not
 * modify processor state so one instance can serve concurrent calls.
 */
public interface EnhancementProcessor {

    /**
     * Get the algorithm id (e.g., "ContrastGamma").
     * Must match the id declared in {@link EnhancementProcessorInfo}.
     */
    String getAlgorithmId();

    /**
     * Get a description of this processor, including the OpenCV calls it makes.
     */
    String getDescription();

    /**
     * Enhance a decoded image.
     *
     * @param input 8-bit, 3-channel BGR Mat (do not modify or release)
     * @return 8-bit, 3-channel BGR Mat of the same size (caller will release)
     */
    Mat process(Mat input);

    /**
     * Create an ImageProcessor lambda wrapping process().
     */
    default ImageProcessor createImageProcessor() {
        return this::process;
    }

    /**
     * Imgcodecs.imencode() flags for this processor's output, as key/value pairs.
     * An empty array means encoder defaults.
     */
    default int[] getEncodeParams() {
        return new int[0];
    }

    /**
     * Serialize processor-specific parameters to JSON.
     *
     * @param json The JSON object to add parameters to
     */
    void serializeProperties(JsonObject json);

    /**
     * Deserialize processor-specific parameters from JSON.
     * Missing keys keep their defaults.
     *
     * @param json The JSON object to read parameters from
     */
    void deserializeProperties(JsonObject json);
}
