package com.ttennebkram.enhancer.ingest;

import java.util.List;

/**
 * Vision service that labels an image already stored in the object store.
 */
public interface LabelDetector {

    /**
     * @param maxLabels upper bound on returned labels
     * @param minConfidence lowest confidence (0-100) a label needs to be returned
     */
    List<DetectedLabel> detect(String bucket, String key, int maxLabels, double minConfidence)
        throws LabelDetectionException;
}
