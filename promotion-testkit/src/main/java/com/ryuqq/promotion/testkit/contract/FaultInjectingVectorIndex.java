package com.ryuqq.promotion.testkit.contract;

import com.ryuqq.promotion.core.model.ItemId;
import com.ryuqq.promotion.core.spi.StoreException;
import com.ryuqq.promotion.core.spi.VectorIndex;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link VectorIndex} decorator that can be switched into an unavailable state.
 *
 * @author Promotion Team
 * @since 1.0.0
 */
public class FaultInjectingVectorIndex implements VectorIndex {

    private final VectorIndex delegate;
    private final AtomicInteger failedCalls = new AtomicInteger();
    private volatile boolean unavailable;

    public FaultInjectingVectorIndex(VectorIndex delegate) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        this.delegate = delegate;
    }

    public void setUnavailable(boolean unavailable) {
        this.unavailable = unavailable;
    }

    /**
     * Number of copy calls rejected while unavailable.
     */
    public int getFailedCalls() {
        return failedCalls.get();
    }

    @Override
    public int copyPoints(List<ItemId> ids, String sourceCollection, String targetCollection) {
        if (unavailable) {
            failedCalls.incrementAndGet();
            throw new StoreException("Simulated vector index outage: " + sourceCollection + " → " + targetCollection);
        }
        return delegate.copyPoints(ids, sourceCollection, targetCollection);
    }
}
