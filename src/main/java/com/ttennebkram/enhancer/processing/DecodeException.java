package com.ttennebkram.enhancer.processing;

/**
 * The input bytes could not be parsed as a supported image.
 */
public class DecodeException extends EnhancementException {

    public DecodeException(String message) {
        super(message);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
