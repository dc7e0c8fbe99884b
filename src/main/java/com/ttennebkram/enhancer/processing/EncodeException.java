package com.ttennebkram.enhancer.processing;

/**
 * The enhanced image could not be serialized back to JPEG.
 */
public class EncodeException extends EnhancementException {

    public EncodeException(String message) {
        super(message);
    }

    public EncodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
