package com.ryuqq.promotion.core.protection.noop;

import com.ryuqq.promotion.core.model.ContentKind;
import com.ryuqq.promotion.core.model.ItemId;
import com.ryuqq.promotion.core.protection.FixedTimeoutPolicy;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * NoOpTimeoutPolicy / FixedTimeoutPolicy 테스트.
 *
 * @author Promotion Team
 * @since 1.0.0
 */
class NoOpTimeoutPolicyTest {

    @Test
    void noOp_ReturnsZeroTimeout() {
        // Given
        NoOpTimeoutPolicy policy = new NoOpTimeoutPolicy();

        // When & Then
        assertEquals(0, policy.getPerItemTimeoutMs(ContentKind.AUDIO_RESOURCE));
        assertDoesNotThrow(() -> policy.recordTimeout(ItemId.of("a"), 10));
    }

    @Test
    void fixed_AppliesSameTimeoutAndCountsTimeouts() {
        // Given
        FixedTimeoutPolicy policy = new FixedTimeoutPolicy(500);

        // When
        policy.recordTimeout(ItemId.of("a"), 500);
        policy.recordTimeout(ItemId.of("b"), 501);

        // Then
        assertEquals(500, policy.getPerItemTimeoutMs(ContentKind.DOCUMENT));
        assertEquals(2, policy.getTimeoutCount());
    }

    @Test
    void fixed_NegativeTimeout_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new FixedTimeoutPolicy(-1));
    }
}
