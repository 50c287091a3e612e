package com.ryuqq.promotion.core.statemachine;

/**
 * 상태 전이 검증 및 실행.
 *
 * <p>PromotionRecord 자체는 수동적인 값이며, 전이 규칙은 Orchestrator가
 * 이 클래스를 통해서만 강제합니다.</p>
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>PENDING → IN_PROGRESS</li>
 *   <li>IN_PROGRESS → SUCCESS | PARTIAL_SUCCESS | FAILED</li>
 *   <li>SUCCESS | PARTIAL_SUCCESS → ROLLED_BACK</li>
 * </ul>
 *
 * @author Promotion Team
 * @since 1.0.0
 */
public final class StateTransition {

    // Utility class - prevent instantiation
    private StateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(PromotionState from, PromotionState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        boolean valid = switch (from) {
            case PENDING -> to == PromotionState.IN_PROGRESS;
            case IN_PROGRESS -> to == PromotionState.SUCCESS
                || to == PromotionState.PARTIAL_SUCCESS
                || to == PromotionState.FAILED;
            case SUCCESS, PARTIAL_SUCCESS -> to == PromotionState.ROLLED_BACK;
            case FAILED, ROLLED_BACK -> false;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static PromotionState transition(PromotionState current, PromotionState next) {
        validate(current, next);
        return next;
    }
}
