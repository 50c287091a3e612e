package com.ryuqq.promotion.adapter.inmemory.record;

import com.ryuqq.promotion.core.model.PromotionId;
import com.ryuqq.promotion.core.model.PromotionRecord;
import com.ryuqq.promotion.core.spi.PromotionRecordStore;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of {@link PromotionRecordStore} SPI.
 *
 * <p>Keeps the latest snapshot per promotion plus every saved snapshot in order, so the full
 * state history of a promotion can be inspected. Records are never deleted.</p>
 *
 * @author Promotion Team
 * @since 1.0.0
 */
public class InMemoryPromotionRecordStore implements PromotionRecordStore {

    private final ConcurrentHashMap<PromotionId, PromotionRecord> latest = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<PromotionId, List<PromotionRecord>> history = new ConcurrentHashMap<>();

    @Override
    public Optional<PromotionRecord> findById(PromotionId id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        return Optional.ofNullable(latest.get(id));
    }

    @Override
    public void save(PromotionRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        latest.put(record.getId(), record);
        history.computeIfAbsent(record.getId(), id -> new CopyOnWriteArrayList<>()).add(record);
    }

    /**
     * {@inheritDoc}
     *
     * <p>Ordered by startedAt, most recent first.</p>
     */
    @Override
    public List<PromotionRecord> findRecent(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive (current: " + limit + ")");
        }
        List<PromotionRecord> records = new ArrayList<>(latest.values());
        records.sort(Comparator.comparing(PromotionRecord::getStartedAt).reversed());
        return records.size() <= limit ? records : new ArrayList<>(records.subList(0, limit));
    }

    /**
     * Every snapshot saved for a promotion, oldest first.
     *
     * @param id promotion id
     * @return saved snapshots (empty if unknown)
     */
    public List<PromotionRecord> history(PromotionId id) {
        List<PromotionRecord> snapshots = history.get(id);
        return snapshots == null ? List.of() : List.copyOf(snapshots);
    }

    /**
     * Number of promotions stored.
     */
    public int size() {
        return latest.size();
    }
}
