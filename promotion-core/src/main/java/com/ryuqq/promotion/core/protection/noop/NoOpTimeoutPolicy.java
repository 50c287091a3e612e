package com.ryuqq.promotion.core.protection.noop;

import com.ryuqq.promotion.core.model.ContentKind;
import com.ryuqq.promotion.core.model.ItemId;
import com.ryuqq.promotion.core.protection.TimeoutPolicy;

/**
 * Timeout Policy NoOp 구현.
 *
 * <p>타임아웃을 적용하지 않습니다 (0 반환).</p>
 *
 * @author Promotion Team
 * @since 1.0.0
 */
public final class NoOpTimeoutPolicy implements TimeoutPolicy {

    @Override
    public long getPerItemTimeoutMs(ContentKind kind) {
        return 0;
    }

    @Override
    public void recordTimeout(ItemId itemId, long elapsedMs) {
        // NoOp
    }
}
