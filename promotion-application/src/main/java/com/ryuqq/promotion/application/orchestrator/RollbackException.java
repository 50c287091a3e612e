package com.ryuqq.promotion.application.orchestrator;

import com.ryuqq.promotion.core.model.PromotionId;

/**
 * 롤백할 수 없는 승격에 대한 Rollback 요청.
 *
 * @author Promotion Team
 * @since 1.0.0
 */
public class RollbackException extends RuntimeException {

    private final PromotionId promotionId;

    public RollbackException(PromotionId promotionId, String message) {
        super(message);
        this.promotionId = promotionId;
    }

    public PromotionId getPromotionId() {
        return promotionId;
    }
}
