package com.ryuqq.promotion.core.model;

/**
 * 승격된 항목 한 쌍 (원본 ID → 대상 환경에 새로 생성된 ID).
 *
 * @param sourceId 원본 환경의 항목 ID
 * @param newId 대상 환경에 생성된 항목 ID
 *
 * @author Promotion Team
 * @since 1.0.0
 */
public record PromotedItem(ItemId sourceId, ItemId newId) {

    public PromotedItem {
        if (sourceId == null) {
            throw new IllegalArgumentException("sourceId cannot be null");
        }
        if (newId == null) {
            throw new IllegalArgumentException("newId cannot be null");
        }
    }
}
