package com.ryuqq.promotion.application.config;

import com.ryuqq.promotion.core.validation.PathValidator;
import com.ryuqq.promotion.core.validation.PromotionPath;

import java.time.Duration;
import java.util.List;

/**
 * 환경 승격 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>enabled: 승격 기능 활성화 여부 (기본 true)</li>
 *   <li>allowedPaths: 허용된 승격 경로, 순서 유지 (기본 dev→stage, stage→prod, dev→prod)</li>
 *   <li>maxItemsPerBatch: 병렬 복사 시 동시 처리 항목 상한 (기본 10)</li>
 *   <li>rollbackWindow: 롤백 권장 기간 (기본 72시간, 경과 시 경고만 기록)</li>
 *   <li>perItemTimeoutMs: 항목당 복사 타임아웃 (기본 0 = 타임아웃 없음)</li>
 * </ul>
 *
 * @author Promotion Team
 * @since 1.0.0
 * @param enabled 승격 기능 활성화 여부
 * @param allowedPaths 허용된 승격 경로
 * @param maxItemsPerBatch 동시 처리 항목 상한 (1 이상)
 * @param rollbackWindow 롤백 권장 기간 (양수)
 * @param perItemTimeoutMs 항목당 타임아웃 (밀리초, 0 이상)
 */
public record PromotionConfig(
    boolean enabled,
    List<PromotionPath> allowedPaths,
    int maxItemsPerBatch,
    Duration rollbackWindow,
    long perItemTimeoutMs
) {

    /**
     * 기본 설정 생성자.
     */
    public PromotionConfig() {
        this(true, PromotionPath.defaults(), 10, Duration.ofHours(72), 0);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public PromotionConfig {
        if (allowedPaths == null) {
            throw new IllegalArgumentException("allowedPaths cannot be null");
        }
        if (maxItemsPerBatch <= 0) {
            throw new IllegalArgumentException(
                "maxItemsPerBatch must be positive (current: " + maxItemsPerBatch + ")"
            );
        }
        if (rollbackWindow == null || rollbackWindow.isNegative() || rollbackWindow.isZero()) {
            throw new IllegalArgumentException(
                "rollbackWindow must be positive (current: " + rollbackWindow + ")"
            );
        }
        if (perItemTimeoutMs < 0) {
            throw new IllegalArgumentException(
                "perItemTimeoutMs cannot be negative (current: " + perItemTimeoutMs + ")"
            );
        }
        allowedPaths = List.copyOf(allowedPaths);
    }

    /**
     * 설정 기반 PathValidator 생성.
     *
     * @return PathValidator
     */
    public PathValidator pathValidator() {
        return new PathValidator(enabled, allowedPaths);
    }

    public PromotionConfig withEnabled(boolean enabled) {
        return new PromotionConfig(enabled, allowedPaths, maxItemsPerBatch, rollbackWindow, perItemTimeoutMs);
    }

    public PromotionConfig withAllowedPaths(List<PromotionPath> allowedPaths) {
        return new PromotionConfig(enabled, allowedPaths, maxItemsPerBatch, rollbackWindow, perItemTimeoutMs);
    }

    public PromotionConfig withMaxItemsPerBatch(int maxItemsPerBatch) {
        return new PromotionConfig(enabled, allowedPaths, maxItemsPerBatch, rollbackWindow, perItemTimeoutMs);
    }

    public PromotionConfig withRollbackWindow(Duration rollbackWindow) {
        return new PromotionConfig(enabled, allowedPaths, maxItemsPerBatch, rollbackWindow, perItemTimeoutMs);
    }

    public PromotionConfig withPerItemTimeoutMs(long perItemTimeoutMs) {
        return new PromotionConfig(enabled, allowedPaths, maxItemsPerBatch, rollbackWindow, perItemTimeoutMs);
    }
}
