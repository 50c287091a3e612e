package com.ryuqq.promotion.adapter.inmemory.content;

import com.ryuqq.promotion.core.model.ContentKind;
import com.ryuqq.promotion.core.model.Environment;
import com.ryuqq.promotion.core.model.ItemId;
import com.ryuqq.promotion.core.model.PromotableItem;
import com.ryuqq.promotion.core.spi.ContentStore;
import com.ryuqq.promotion.core.spi.EligibilityFilter;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * In-memory implementation of {@link ContentStore} SPI for testing and reference purposes.
 *
 * <p>Items of every kind and environment share one id space, as rows in one database would.
 * Stored state is isolated from callers: every write stores a {@link PromotableItem#snapshot()}
 * and every read returns one, so mutating a returned item has no effect until {@link #update}.</p>
 *
 * <p><strong>Ordering:</strong> queries return items in insertion order.</p>
 *
 * <p><strong>Timestamps:</strong> {@code createdAt} is set on insert and {@code updatedAt}
 * on insert and update, from the injected {@link Clock}.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Coarse-grained locking (all methods synchronized)</li>
 *   <li>Data lost on process restart</li>
 * </ul>
 *
 * @author Promotion Team
 * @since 1.0.0
 */
public class InMemoryContentStore implements ContentStore {

    private final Map<ItemId, PromotableItem> items = new LinkedHashMap<>();
    private final Clock clock;

    /**
     * Creates a store using the system UTC clock.
     */
    public InMemoryContentStore() {
        this(Clock.systemUTC());
    }

    /**
     * Creates a store using the given clock for timestamps.
     *
     * @param clock clock for createdAt / updatedAt
     */
    public InMemoryContentStore(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
    }

    @Override
    public synchronized List<PromotableItem> findEligible(ContentKind kind, Environment environment,
                                                          EligibilityFilter filter) {
        if (kind == null || environment == null || filter == null) {
            throw new IllegalArgumentException("kind, environment and filter cannot be null");
        }
        return select(item -> item.kind() == kind && filter.matches(item, environment));
    }

    @Override
    public synchronized List<PromotableItem> findAll(ContentKind kind, Environment environment) {
        if (kind == null || environment == null) {
            throw new IllegalArgumentException("kind and environment cannot be null");
        }
        return select(item -> item.kind() == kind && item.getEnvironment() == environment);
    }

    @Override
    public synchronized Optional<PromotableItem> findById(ItemId id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        PromotableItem item = items.get(id);
        return item == null ? Optional.empty() : Optional.of(item.snapshot());
    }

    /**
     * {@inheritDoc}
     *
     * <p>The caller's object is not modified; the stored snapshot receives the timestamps.</p>
     */
    @Override
    public synchronized void insert(PromotableItem item) {
        if (item == null) {
            throw new IllegalArgumentException("item cannot be null");
        }
        if (items.containsKey(item.getId())) {
            throw new IllegalStateException("Item already exists: " + item.getId());
        }
        PromotableItem stored = item.snapshot();
        stored.recordCreated(clock.instant());
        items.put(stored.getId(), stored);
    }

    @Override
    public synchronized void update(PromotableItem item) {
        if (item == null) {
            throw new IllegalArgumentException("item cannot be null");
        }
        PromotableItem existing = items.get(item.getId());
        if (existing == null) {
            throw new IllegalStateException("Item not found: " + item.getId());
        }
        PromotableItem stored = item.snapshot();
        if (stored.getCreatedAtOrNull() == null) {
            stored.recordCreated(existing.getCreatedAtOrNull());
        }
        stored.recordUpdated(clock.instant());
        items.put(stored.getId(), stored);
    }

    @Override
    public synchronized boolean delete(ItemId id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        return items.remove(id) != null;
    }

    /**
     * Number of stored items across all kinds and environments.
     */
    public synchronized int size() {
        return items.size();
    }

    /**
     * Number of stored items of a kind in an environment.
     */
    public synchronized int count(ContentKind kind, Environment environment) {
        return findAll(kind, environment).size();
    }

    /**
     * Removes all items.
     */
    public synchronized void clear() {
        items.clear();
    }

    private List<PromotableItem> select(Predicate<PromotableItem> predicate) {
        List<PromotableItem> result = new ArrayList<>();
        for (PromotableItem item : items.values()) {
            if (predicate.test(item)) {
                result.add(item.snapshot());
            }
        }
        return result;
    }
}
