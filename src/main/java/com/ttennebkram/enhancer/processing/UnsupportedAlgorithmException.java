package com.ttennebkram.enhancer.processing;

/**
 * The requested algorithm id does not match any registered processor.
 */
public class UnsupportedAlgorithmException extends EnhancementException {

    private final String algorithmId;

    public UnsupportedAlgorithmException(String algorithmId) {
        super("Unsupported enhancement algorithm: " + algorithmId);
        this.algorithmId = algorithmId;
    }

    public String getAlgorithmId() {
        return algorithmId;
    }
}
