package com.ryuqq.promotion.adapter.inmemory.vector;

import com.ryuqq.promotion.core.model.ItemId;
import com.ryuqq.promotion.core.spi.VectorIndex;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link VectorIndex} SPI.
 *
 * <p>Collections map point ids to float vectors. Copying keeps the point id, so a promoted
 * item's vectors in the target collection are keyed by the source item id.</p>
 *
 * @author Promotion Team
 * @since 1.0.0
 */
public class InMemoryVectorIndex implements VectorIndex {

    private final ConcurrentHashMap<String, Map<ItemId, float[]>> collections = new ConcurrentHashMap<>();

    /**
     * Adds or replaces a point.
     *
     * @param collection environment-qualified collection name
     * @param id point id
     * @param vector embedding
     */
    public void upsert(String collection, ItemId id, float[] vector) {
        if (collection == null || collection.isBlank()) {
            throw new IllegalArgumentException("collection cannot be null or blank");
        }
        if (id == null || vector == null) {
            throw new IllegalArgumentException("id and vector cannot be null");
        }
        collection(collection).put(id, vector.clone());
    }

    @Override
    public int copyPoints(List<ItemId> ids, String sourceCollection, String targetCollection) {
        if (ids == null) {
            throw new IllegalArgumentException("ids cannot be null");
        }
        if (sourceCollection == null || targetCollection == null) {
            throw new IllegalArgumentException("sourceCollection and targetCollection cannot be null");
        }
        Map<ItemId, float[]> source = collections.get(sourceCollection);
        if (source == null) {
            return 0;
        }
        Map<ItemId, float[]> target = collection(targetCollection);
        int copied = 0;
        for (ItemId id : ids) {
            float[] vector = source.get(id);
            if (vector != null) {
                target.put(id, vector.clone());
                copied++;
            }
        }
        return copied;
    }

    public boolean contains(String collection, ItemId id) {
        Map<ItemId, float[]> points = collections.get(collection);
        return points != null && points.containsKey(id);
    }

    public int pointCount(String collection) {
        Map<ItemId, float[]> points = collections.get(collection);
        return points == null ? 0 : points.size();
    }

    private Map<ItemId, float[]> collection(String name) {
        return collections.computeIfAbsent(name, n -> new ConcurrentHashMap<>());
    }
}
