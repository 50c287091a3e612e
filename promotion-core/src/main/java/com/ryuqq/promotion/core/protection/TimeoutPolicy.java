package com.ryuqq.promotion.core.protection;

import com.ryuqq.promotion.core.model.ContentKind;
import com.ryuqq.promotion.core.model.ItemId;

/**
 * 항목 단위 복사 Timeout Policy SPI.
 *
 * <p>페이로드 전송처럼 오래 걸릴 수 있는 항목 복사에 상한을 둡니다.
 * 타임아웃은 작업 전체 중단이 아닌 일반 항목 단위 오류(TIMEOUT)로 기록됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * long timeout = policy.getPerItemTimeoutMs(item.kind());
 * if (timeout > 0) {
 *     try {
 *         return future.get(timeout, TimeUnit.MILLISECONDS);
 *     } catch (TimeoutException e) {
 *         policy.recordTimeout(item.getId(), timeout);
 *         return CopyFailed.of(item.getId(), CopyStage.TIMEOUT, "...");
 *     }
 * }
 * }</pre>
 *
 * @author Promotion Team
 * @since 1.0.0
 */
public interface TimeoutPolicy {

    /**
     * 항목당 타임아웃 시간 조회.
     *
     * @param kind 콘텐츠 종류
     * @return 타임아웃 시간 (밀리초), 0은 타임아웃 없음을 의미
     */
    long getPerItemTimeoutMs(ContentKind kind);

    /**
     * 타임아웃 발생 기록.
     *
     * @param itemId 타임아웃된 항목 ID
     * @param elapsedMs 경과 시간 (밀리초)
     */
    void recordTimeout(ItemId itemId, long elapsedMs);
}
