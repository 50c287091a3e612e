package com.ryuqq.promotion.testkit.contract;

import com.ryuqq.promotion.core.spi.ObjectStore;
import com.ryuqq.promotion.core.spi.StoreException;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiConsumer;

/**
 * {@link ObjectStore} decorator that simulates storage outages for selected object keys.
 *
 * <p>Reads and writes of keys registered with {@link #failReadsOf(String)} or
 * {@link #failWritesOf(String)} throw {@link StoreException}; everything else is delegated.
 * A read hook runs before every delegated read, which lets tests act while a copy is in flight.</p>
 *
 * @author Promotion Team
 * @since 1.0.0
 */
public class FaultInjectingObjectStore implements ObjectStore {

    private static final BiConsumer<String, String> NO_HOOK = (bucket, key) -> { };

    private final ObjectStore delegate;
    private final Set<String> failingReads = ConcurrentHashMap.newKeySet();
    private final Set<String> failingWrites = ConcurrentHashMap.newKeySet();
    private volatile BiConsumer<String, String> beforeRead = NO_HOOK;

    public FaultInjectingObjectStore(ObjectStore delegate) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        this.delegate = delegate;
    }

    public void failReadsOf(String key) {
        failingReads.add(key);
    }

    public void failWritesOf(String key) {
        failingWrites.add(key);
    }

    /**
     * Registers a callback invoked with (bucket, key) before each read.
     *
     * @param hook callback, or null to remove it
     */
    public void beforeRead(BiConsumer<String, String> hook) {
        this.beforeRead = hook == null ? NO_HOOK : hook;
    }

    public void reset() {
        failingReads.clear();
        failingWrites.clear();
        beforeRead = NO_HOOK;
    }

    @Override
    public byte[] get(String bucket, String key) {
        beforeRead.accept(bucket, key);
        if (failingReads.contains(key)) {
            throw new StoreException("Simulated outage reading " + bucket + "/" + key);
        }
        return delegate.get(bucket, key);
    }

    @Override
    public void put(String bucket, String key, byte[] data) {
        if (failingWrites.contains(key)) {
            throw new StoreException("Simulated outage writing " + bucket + "/" + key);
        }
        delegate.put(bucket, key, data);
    }
}
