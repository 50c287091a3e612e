package com.ryuqq.promotion.core.statemachine;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static com.ryuqq.promotion.core.statemachine.PromotionState.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * StateTransition / PromotionState 테스트.
 *
 * <ul>
 *   <li>PENDING → IN_PROGRESS → {SUCCESS, PARTIAL_SUCCESS, FAILED}</li>
 *   <li>{SUCCESS, PARTIAL_SUCCESS} → ROLLED_BACK</li>
 *   <li>FAILED, ROLLED_BACK에서는 어떤 전이도 불가</li>
 * </ul>
 *
 * @author Promotion Team
 * @since 1.0.0
 */
class StateTransitionTest {

    // ========== 정상 전이 테스트 ==========

    @Test
    void validate_PendingToInProgress_Succeeds() {
        assertDoesNotThrow(() -> StateTransition.validate(PENDING, IN_PROGRESS));
    }

    @Test
    void validate_InProgressToEveryOutcome_Succeeds() {
        assertDoesNotThrow(() -> StateTransition.validate(IN_PROGRESS, SUCCESS));
        assertDoesNotThrow(() -> StateTransition.validate(IN_PROGRESS, PARTIAL_SUCCESS));
        assertDoesNotThrow(() -> StateTransition.validate(IN_PROGRESS, FAILED));
    }

    @Test
    void transition_SuccessfulPromotionThenRollback_Succeeds() {
        // Given
        PromotionState state = PENDING;

        // When
        state = StateTransition.transition(state, IN_PROGRESS);
        state = StateTransition.transition(state, PARTIAL_SUCCESS);
        state = StateTransition.transition(state, ROLLED_BACK);

        // Then
        assertEquals(ROLLED_BACK, state);
        assertTrue(state.isTerminal());
    }

    // ========== 불법 전이 테스트 ==========

    @Test
    void validate_PendingToFailed_ThrowsException() {
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> StateTransition.validate(PENDING, FAILED)
        );
        assertTrue(exception.getMessage().contains("PENDING"));
        assertTrue(exception.getMessage().contains("FAILED"));
    }

    @Test
    void validate_FailedToRolledBack_ThrowsException() {
        assertThrows(IllegalStateException.class, () -> StateTransition.validate(FAILED, ROLLED_BACK));
    }

    @ParameterizedTest
    @EnumSource(PromotionState.class)
    void validate_FromRolledBack_AlwaysThrows(PromotionState next) {
        assertThrows(IllegalStateException.class, () -> StateTransition.validate(ROLLED_BACK, next));
    }

    @Test
    void validate_NullState_ThrowsIllegalArgument() {
        assertThrows(IllegalArgumentException.class, () -> StateTransition.validate(null, SUCCESS));
        assertThrows(IllegalArgumentException.class, () -> StateTransition.validate(PENDING, null));
    }

    // ========== settle / 분류 ==========

    @Test
    void settle_ClassifiesByCounts() {
        assertEquals(SUCCESS, PromotionState.settle(3, 0));
        assertEquals(SUCCESS, PromotionState.settle(0, 0));
        assertEquals(PARTIAL_SUCCESS, PromotionState.settle(2, 1));
        assertEquals(FAILED, PromotionState.settle(0, 4));
    }

    @Test
    void settle_NegativeCount_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> PromotionState.settle(-1, 0));
    }

    @Test
    void isRollbackable_OnlyForSuccessOutcomes() {
        assertTrue(SUCCESS.isRollbackable());
        assertTrue(PARTIAL_SUCCESS.isRollbackable());
        assertFalse(FAILED.isRollbackable());
        assertFalse(ROLLED_BACK.isRollbackable());
        assertFalse(IN_PROGRESS.isTerminal());
    }
}
