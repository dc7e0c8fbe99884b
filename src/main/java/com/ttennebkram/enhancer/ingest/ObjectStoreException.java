package com.ttennebkram.enhancer.ingest;

/**
 * Failure of an object storage call.
 */
public class ObjectStoreException extends Exception {

    public enum Kind {
        /** The bucket or key does not exist. */
        NOT_FOUND,
        /** Network, throttling or service error; the call may succeed later. */
        TRANSIENT
    }

    private final Kind kind;
    private final String bucket;

    public ObjectStoreException(Kind kind, String bucket, String message) {
        super(message);
        this.kind = kind;
        this.bucket = bucket;
    }

    public ObjectStoreException(Kind kind, String bucket, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.bucket = bucket;
    }

    public Kind getKind() {
        return kind;
    }

    public String getBucket() {
        return bucket;
    }
}
