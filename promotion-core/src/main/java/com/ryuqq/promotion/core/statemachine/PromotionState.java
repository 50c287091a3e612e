package com.ryuqq.promotion.core.statemachine;

/**
 * PromotionRecord의 생명주기 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>PENDING → IN_PROGRESS (실행 시작)</li>
 *   <li>IN_PROGRESS → SUCCESS / PARTIAL_SUCCESS / FAILED (실행 종료)</li>
 *   <li>SUCCESS / PARTIAL_SUCCESS → ROLLED_BACK (명시적 롤백 호출만)</li>
 * </ul>
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * PENDING
 *    │
 *    ▼ (실행 시작)
 * IN_PROGRESS
 *    │
 *    ├─► SUCCESS ─────────┐
 *    │                    ├─► ROLLED_BACK (rollback)
 *    ├─► PARTIAL_SUCCESS ─┘
 *    │
 *    └─► FAILED
 *
 * 금지된 전이:
 * - FAILED → ROLLED_BACK ❌ (성공 항목 0건)
 * - ROLLED_BACK → * ❌
 * - PENDING → FAILED ❌ (검증 실패도 IN_PROGRESS를 거침)
 * </pre>
 *
 * @author Promotion Team
 * @since 1.0.0
 */
public enum PromotionState {

    /**
     * 기록 생성됨 (아직 실행 시작 안 됨).
     */
    PENDING,

    /**
     * 항목 복사 진행 중.
     */
    IN_PROGRESS,

    /**
     * 모든 항목 성공 (대상 0건 포함).
     */
    SUCCESS,

    /**
     * 일부 성공, 일부 실패. 자동 재시도 없음.
     */
    PARTIAL_SUCCESS,

    /**
     * 성공 항목 0건 (검증 실패 또는 전 항목 실패).
     */
    FAILED,

    /**
     * 롤백 완료.
     */
    ROLLED_BACK;

    /**
     * 실행이 끝난 상태인지 확인.
     *
     * @return SUCCESS, PARTIAL_SUCCESS, FAILED, ROLLED_BACK인 경우 true
     */
    public boolean isTerminal() {
        return this != PENDING && this != IN_PROGRESS;
    }

    /**
     * 롤백 가능한 상태인지 확인.
     *
     * @return SUCCESS 또는 PARTIAL_SUCCESS인 경우 true
     */
    public boolean isRollbackable() {
        return this == SUCCESS || this == PARTIAL_SUCCESS;
    }

    /**
     * 항목 처리 결과로 최종 상태 결정.
     *
     * <ul>
     *   <li>errorCount == 0 → SUCCESS (대상 0건 포함)</li>
     *   <li>successCount &gt; 0 &amp;&amp; errorCount &gt; 0 → PARTIAL_SUCCESS</li>
     *   <li>successCount == 0 &amp;&amp; errorCount &gt; 0 → FAILED</li>
     * </ul>
     *
     * @param successCount 성공 건수
     * @param errorCount 실패 건수
     * @return 최종 상태
     * @throws IllegalArgumentException 음수인 경우
     */
    public static PromotionState settle(int successCount, int errorCount) {
        if (successCount < 0 || errorCount < 0) {
            throw new IllegalArgumentException(
                "counts cannot be negative (success: " + successCount + ", error: " + errorCount + ")");
        }
        if (errorCount == 0) {
            return SUCCESS;
        }
        return successCount > 0 ? PARTIAL_SUCCESS : FAILED;
    }
}
