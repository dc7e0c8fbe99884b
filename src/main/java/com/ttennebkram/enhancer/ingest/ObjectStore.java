package com.ttennebkram.enhancer.ingest;

/**
 * Object storage for original and enhanced images.
 */
public interface ObjectStore {

    /**
     * Store bytes under bucket/key, replacing any existing object.
     *
     * @return a stable reference (URL) to the stored object
     */
    String put(String bucket, String key, byte[] bytes, String contentType) throws ObjectStoreException;

    /**
     * Create a time-limited URL that allows reading bucket/key.
     */
    String sign(String bucket, String key, long ttlSeconds) throws ObjectStoreException;
}
