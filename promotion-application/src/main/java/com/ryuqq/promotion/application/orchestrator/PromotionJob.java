package com.ryuqq.promotion.application.orchestrator;

import com.ryuqq.promotion.core.model.ItemId;
import com.ryuqq.promotion.core.model.PromotedItem;
import com.ryuqq.promotion.core.model.PromotionId;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 단일 Execute 호출의 결과 집계기.
 *
 * <p>Execute를 수행하는 스레드만 접근합니다 (thread-safe하지 않음).</p>
 *
 * @author Promotion Team
 * @since 1.0.0
 */
final class PromotionJob {

    private final PromotionId promotionId;
    private final List<PromotedItem> promoted = new ArrayList<>();
    private final Map<String, String> errors = new LinkedHashMap<>();
    private int successCount;
    private int errorCount;

    PromotionJob(PromotionId promotionId) {
        this.promotionId = promotionId;
    }

    void recordSuccess(ItemId sourceId, ItemId newId) {
        successCount++;
        promoted.add(new PromotedItem(sourceId, newId));
    }

    void recordFailure(ItemId sourceId, String message) {
        errorCount++;
        errors.put(sourceId.getValue(), message);
    }

    PromotionId promotionId() {
        return promotionId;
    }

    int successCount() {
        return successCount;
    }

    int errorCount() {
        return errorCount;
    }

    int totalProcessed() {
        return successCount + errorCount;
    }

    List<PromotedItem> promoted() {
        return promoted;
    }

    List<ItemId> createdIds() {
        List<ItemId> created = new ArrayList<>(promoted.size());
        for (PromotedItem item : promoted) {
            created.add(item.newId());
        }
        return created;
    }

    Map<String, String> errors() {
        return errors;
    }
}
