package com.ttennebkram.enhancer.processing;

/**
 * Base class for failures of a single enhance call.
 * All subclasses are terminal: the transform is deterministic, so retrying with the
 * same input cannot succeed.
 */
public class EnhancementException extends Exception {

    public EnhancementException(String message) {
        super(message);
    }

    public EnhancementException(String message, Throwable cause) {
        super(message, cause);
    }
}
