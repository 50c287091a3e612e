package com.ryuqq.promotion.adapter.inmemory.object;

import com.ryuqq.promotion.core.spi.ObjectStore;
import com.ryuqq.promotion.core.spi.StoreException;

import java.util.Arrays;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link ObjectStore} SPI.
 *
 * <p>Buckets are created on first write. Byte arrays are copied on the way in and out.</p>
 *
 * @author Promotion Team
 * @since 1.0.0
 */
public class InMemoryObjectStore implements ObjectStore {

    private final ConcurrentHashMap<String, Map<String, byte[]>> buckets = new ConcurrentHashMap<>();

    @Override
    public byte[] get(String bucket, String key) {
        requireName(bucket, "bucket");
        requireName(key, "key");
        Map<String, byte[]> objects = buckets.get(bucket);
        byte[] data = objects == null ? null : objects.get(key);
        if (data == null) {
            throw new StoreException("Object not found: " + bucket + "/" + key);
        }
        return Arrays.copyOf(data, data.length);
    }

    @Override
    public void put(String bucket, String key, byte[] data) {
        requireName(bucket, "bucket");
        requireName(key, "key");
        if (data == null) {
            throw new IllegalArgumentException("data cannot be null");
        }
        buckets.computeIfAbsent(bucket, b -> new ConcurrentHashMap<>())
            .put(key, Arrays.copyOf(data, data.length));
    }

    /**
     * Whether an object exists.
     */
    public boolean exists(String bucket, String key) {
        Map<String, byte[]> objects = buckets.get(bucket);
        return objects != null && objects.containsKey(key);
    }

    /**
     * Number of objects in a bucket.
     */
    public int objectCount(String bucket) {
        Map<String, byte[]> objects = buckets.get(bucket);
        return objects == null ? 0 : objects.size();
    }

    private static void requireName(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " cannot be null or blank");
        }
    }
}
