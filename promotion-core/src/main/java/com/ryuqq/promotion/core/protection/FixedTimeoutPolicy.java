package com.ryuqq.promotion.core.protection;

import com.ryuqq.promotion.core.model.ContentKind;
import com.ryuqq.promotion.core.model.ItemId;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 모든 콘텐츠 종류에 같은 타임아웃을 적용하는 Timeout Policy.
 *
 * @author Promotion Team
 * @since 1.0.0
 */
public final class FixedTimeoutPolicy implements TimeoutPolicy {

    private final long perItemTimeoutMs;
    private final AtomicLong timeoutCount = new AtomicLong();

    /**
     * 생성자.
     *
     * @param perItemTimeoutMs 항목당 타임아웃 (밀리초, 0 = 타임아웃 없음)
     * @throws IllegalArgumentException 음수인 경우
     */
    public FixedTimeoutPolicy(long perItemTimeoutMs) {
        if (perItemTimeoutMs < 0) {
            throw new IllegalArgumentException("perItemTimeoutMs cannot be negative (current: " + perItemTimeoutMs + ")");
        }
        this.perItemTimeoutMs = perItemTimeoutMs;
    }

    @Override
    public long getPerItemTimeoutMs(ContentKind kind) {
        return perItemTimeoutMs;
    }

    @Override
    public void recordTimeout(ItemId itemId, long elapsedMs) {
        timeoutCount.incrementAndGet();
    }

    /**
     * 지금까지 기록된 타임아웃 건수.
     *
     * @return 타임아웃 건수
     */
    public long getTimeoutCount() {
        return timeoutCount.get();
    }
}
