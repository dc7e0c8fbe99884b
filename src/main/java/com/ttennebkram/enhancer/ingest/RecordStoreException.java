package com.ttennebkram.enhancer.ingest;

public class RecordStoreException extends Exception {

    public RecordStoreException(String message) {
        super(message);
    }

    public RecordStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
