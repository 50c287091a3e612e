package com.ryuqq.promotion.core.outcome;

import com.ryuqq.promotion.core.model.ItemId;
import com.ryuqq.promotion.core.model.PromotableItem;

/**
 * 복사 성공.
 *
 * @param sourceId 원본 항목 ID
 * @param newItem 대상 환경에 저장된 새 항목
 *
 * @author Promotion Team
 * @since 1.0.0
 */
public record Copied(
    ItemId sourceId,
    PromotableItem newItem
) implements CopyOutcome {

    public Copied {
        if (sourceId == null) {
            throw new IllegalArgumentException("sourceId cannot be null");
        }
        if (newItem == null) {
            throw new IllegalArgumentException("newItem cannot be null");
        }
    }

    public ItemId newId() {
        return newItem.getId();
    }
}
