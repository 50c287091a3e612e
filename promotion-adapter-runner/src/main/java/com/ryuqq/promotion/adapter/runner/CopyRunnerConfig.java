package com.ryuqq.promotion.adapter.runner;

/**
 * BoundedParallelCopyRunner 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>concurrency: 워커 스레드 수 (기본 4)</li>
 *   <li>shutdownTimeoutMs: shutdown 시 진행 중인 복사 완료 대기 시간 (기본 60000ms)</li>
 * </ul>
 *
 * <p>실제 풀 폭은 {@code min(concurrency, maxItemsPerBatch)}입니다.</p>
 *
 * @author Promotion Team
 * @since 1.0.0
 * @param concurrency 워커 스레드 수 (1 이상이어야 함)
 * @param shutdownTimeoutMs shutdown 대기 시간 (밀리초, 양수여야 함)
 */
public record CopyRunnerConfig(
    int concurrency,
    long shutdownTimeoutMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: concurrency=4, shutdownTimeoutMs=60000ms</p>
     */
    public CopyRunnerConfig() {
        this(4, 60000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public CopyRunnerConfig {
        if (concurrency <= 0) {
            throw new IllegalArgumentException(
                "concurrency must be positive (current: " + concurrency + ")"
            );
        }
        if (shutdownTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "shutdownTimeoutMs must be positive (current: " + shutdownTimeoutMs + ")"
            );
        }
    }

    /**
     * 배치 상한을 적용한 실제 워커 수.
     *
     * @param maxItemsPerBatch 동시 처리 항목 상한
     * @return min(concurrency, maxItemsPerBatch)
     */
    public int effectiveWidth(int maxItemsPerBatch) {
        if (maxItemsPerBatch <= 0) {
            throw new IllegalArgumentException(
                "maxItemsPerBatch must be positive (current: " + maxItemsPerBatch + ")"
            );
        }
        return Math.min(concurrency, maxItemsPerBatch);
    }

    public CopyRunnerConfig withConcurrency(int concurrency) {
        return new CopyRunnerConfig(concurrency, shutdownTimeoutMs);
    }

    public CopyRunnerConfig withShutdownTimeoutMs(long shutdownTimeoutMs) {
        return new CopyRunnerConfig(concurrency, shutdownTimeoutMs);
    }
}
