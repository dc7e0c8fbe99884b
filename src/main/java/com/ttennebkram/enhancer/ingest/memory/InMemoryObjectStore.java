package com.ttennebkram.enhancer.ingest.memory;

import com.ttennebkram.enhancer.ingest.ObjectStore;
import com.ttennebkram.enhancer.ingest.ObjectStoreException;

import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Object store kept in process memory. Buckets must be created before use.
 * URLs use the {@code memory://bucket/key} scheme; signed URLs carry an expiry epoch second.
 */
public class InMemoryObjectStore implements ObjectStore {

    /**
     * One stored object.
     */
    public static final class StoredObject {
        private final byte[] bytes;
        private final String contentType;

        StoredObject(byte[] bytes, String contentType) {
            this.bytes = bytes;
            this.contentType = contentType;
        }

        public byte[] getBytes() {
            return Arrays.copyOf(bytes, bytes.length);
        }

        public String getContentType() {
            return contentType;
        }
    }

    private final Map<String, Map<String, StoredObject>> buckets = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryObjectStore() {
        this(Clock.systemUTC());
    }

    public InMemoryObjectStore(Clock clock) {
        this.clock = clock;
    }

    public InMemoryObjectStore createBucket(String bucket) {
        buckets.computeIfAbsent(bucket, b -> new ConcurrentHashMap<>());
        return this;
    }

    @Override
    public String put(String bucket, String key, byte[] bytes, String contentType) throws ObjectStoreException {
        if (bytes == null) {
            throw new ObjectStoreException(ObjectStoreException.Kind.TRANSIENT, bucket, "No content for " + key);
        }
        bucketFor(bucket).put(key, new StoredObject(Arrays.copyOf(bytes, bytes.length), contentType));
        return url(bucket, key);
    }

    @Override
    public String sign(String bucket, String key, long ttlSeconds) throws ObjectStoreException {
        if (!bucketFor(bucket).containsKey(key)) {
            throw new ObjectStoreException(ObjectStoreException.Kind.NOT_FOUND, bucket, "No such key: " + key);
        }
        long expires = Instant.now(clock).getEpochSecond() + ttlSeconds;
        return url(bucket, key) + "?expires=" + expires;
    }

    public Optional<StoredObject> get(String bucket, String key) {
        Map<String, StoredObject> objects = buckets.get(bucket);
        return objects == null ? Optional.empty() : Optional.ofNullable(objects.get(key));
    }

    public Set<String> keys(String bucket) {
        Map<String, StoredObject> objects = buckets.get(bucket);
        return objects == null ? Collections.emptySet() : Collections.unmodifiableSet(objects.keySet());
    }

    private Map<String, StoredObject> bucketFor(String bucket) throws ObjectStoreException {
        Map<String, StoredObject> objects = buckets.get(bucket);
        if (objects == null) {
            throw new ObjectStoreException(ObjectStoreException.Kind.NOT_FOUND, bucket, "No such bucket: " + bucket);
        }
        return objects;
    }

    private static String url(String bucket, String key) {
        return "memory://" + bucket + "/" + key;
    }
}
