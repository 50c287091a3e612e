package com.ryuqq.promotion.core.model;

/**
 * 항목 단위 승격 상태.
 *
 * <p>업스트림 검수(moderation) 워크플로가 APPROVED를 부여하며,
 * 승격 엔진은 APPROVED 항목만 선택하고 복사 후 PROMOTED로 표시합니다.</p>
 *
 * @author Promotion Team
 * @since 1.0.0
 */
public enum PromotionStatus {
    DRAFT,
    APPROVED,
    PROMOTED,
    DEPRECATED
}
