package com.ttennebkram.enhancer.ingest;

public class LabelDetectionException extends Exception {

    public LabelDetectionException(String message) {
        super(message);
    }

    public LabelDetectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
