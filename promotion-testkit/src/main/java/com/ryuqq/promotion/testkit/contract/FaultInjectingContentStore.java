package com.ryuqq.promotion.testkit.contract;

import com.ryuqq.promotion.core.model.ContentKind;
import com.ryuqq.promotion.core.model.Environment;
import com.ryuqq.promotion.core.model.ItemId;
import com.ryuqq.promotion.core.model.PromotableItem;
import com.ryuqq.promotion.core.spi.ContentStore;
import com.ryuqq.promotion.core.spi.EligibilityFilter;
import com.ryuqq.promotion.core.spi.StoreException;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * {@link ContentStore} decorator that simulates relational store failures.
 *
 * <p>Supported faults:</p>
 * <ul>
 *   <li>Eligibility query failure (setup-phase failure of Execute)</li>
 *   <li>Insert failure for promoted copies of selected source items</li>
 *   <li>Slow insert that ignores interrupts and still commits (blocking driver call)</li>
 *   <li>Update failure (source bookkeeping after a successful copy)</li>
 *   <li>Delete failure for selected ids (rollback)</li>
 * </ul>
 *
 * @author Promotion Team
 * @since 1.0.0
 */
public class FaultInjectingContentStore implements ContentStore {

    private final ContentStore delegate;
    private final Set<ItemId> failingInsertSources = ConcurrentHashMap.newKeySet();
    private final Set<ItemId> failingDeletes = ConcurrentHashMap.newKeySet();
    private final Map<ItemId, Long> slowInsertMillis = new ConcurrentHashMap<>();
    private volatile boolean failEligibleQuery;
    private volatile boolean failUpdates;

    public FaultInjectingContentStore(ContentStore delegate) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        this.delegate = delegate;
    }

    public void setFailEligibleQuery(boolean failEligibleQuery) {
        this.failEligibleQuery = failEligibleQuery;
    }

    public void setFailUpdates(boolean failUpdates) {
        this.failUpdates = failUpdates;
    }

    /**
     * Makes the insert of any promoted copy of the given source item fail.
     *
     * @param sourceId source item id
     */
    public void failInsertOfCopyOf(ItemId sourceId) {
        failingInsertSources.add(sourceId);
    }

    /**
     * Makes the insert of any promoted copy of the given source item spin for the given time before
     * committing. The spin does not react to interrupts.
     *
     * @param sourceId source item id
     * @param millis time spent before the insert commits
     */
    public void slowInsertOfCopyOf(ItemId sourceId, long millis) {
        slowInsertMillis.put(sourceId, millis);
    }

    public void failDeleteOf(ItemId id) {
        failingDeletes.add(id);
    }

    @Override
    public List<PromotableItem> findEligible(ContentKind kind, Environment environment, EligibilityFilter filter) {
        if (failEligibleQuery) {
            throw new StoreException("Simulated database outage");
        }
        return delegate.findEligible(kind, environment, filter);
    }

    @Override
    public List<PromotableItem> findAll(ContentKind kind, Environment environment) {
        return delegate.findAll(kind, environment);
    }

    @Override
    public Optional<PromotableItem> findById(ItemId id) {
        return delegate.findById(id);
    }

    @Override
    public void insert(PromotableItem item) {
        if (item != null && item.getSourceIdOrNull() != null && failingInsertSources.contains(item.getSourceIdOrNull())) {
            throw new StoreException("Simulated insert failure for copy of " + item.getSourceIdOrNull());
        }
        Long delay = item == null || item.getSourceIdOrNull() == null ? null : slowInsertMillis.get(item.getSourceIdOrNull());
        if (delay != null) {
            long end = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(delay);
            while (System.nanoTime() < end) {
                Thread.onSpinWait();
            }
        }
        delegate.insert(item);
    }

    @Override
    public void update(PromotableItem item) {
        if (failUpdates) {
            throw new StoreException("Simulated update failure for " + (item == null ? null : item.getId()));
        }
        delegate.update(item);
    }

    @Override
    public boolean delete(ItemId id) {
        if (failingDeletes.contains(id)) {
            throw new StoreException("Simulated delete failure for " + id);
        }
        return delegate.delete(id);
    }
}
