package com.ryuqq.promotion.core.model;

import com.ryuqq.promotion.core.statemachine.PromotionState;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * PromotionRecord 테스트.
 *
 * @author Promotion Team
 * @since 1.0.0
 */
class PromotionRecordTest {

    private static final Instant STARTED = Instant.parse("2026-01-10T09:00:00Z");

    @Test
    void pending_record_has_rollback_enabled_and_no_items() {
        // when
        PromotionRecord record = PromotionRecord.pending(
            PromotionId.of("p-1"), ContentKind.AUDIO_RESOURCE, "dev", "stage",
            ActorId.of("alice"), "release 42", STARTED);

        // then
        assertThat(record.getStatus()).isEqualTo(PromotionState.PENDING);
        assertThat(record.getPromotionType()).isEqualTo("audio_resources");
        assertThat(record.canRollback()).isTrue();
        assertThat(record.getItemsPromoted()).isEmpty();
        assertThat(record.getRollbackData()).isEmpty();
        assertThat(record.getCompletedAtOrNull()).isNull();
        assertThat(record.getReasonOrNull()).isEqualTo("release 42");
    }

    @Test
    void toBuilder_creates_independent_snapshot() {
        PromotionRecord pending = PromotionRecord.pending(
            PromotionId.of("p-1"), ContentKind.CONFIG, "dev", "stage", ActorId.of("alice"), null, STARTED);

        // when
        PromotionRecord finished = pending.toBuilder()
            .status(PromotionState.SUCCESS)
            .itemsPromoted(List.of(new PromotedItem(ItemId.of("a"), ItemId.of("b"))))
            .rollbackData(List.of(ItemId.of("b")))
            .successCount(1)
            .errors(Map.of())
            .completedAt(STARTED.plusSeconds(5))
            .durationSeconds(5)
            .build();

        // then
        assertThat(pending.getStatus()).isEqualTo(PromotionState.PENDING);
        assertThat(finished.getPromotedCount()).isEqualTo(1);
        assertThat(finished.getRollbackData()).containsExactly(ItemId.of("b"));
        assertThat(finished.getDurationSeconds()).isEqualTo(5);
    }

    @Test
    void collections_are_read_only() {
        PromotionRecord record = PromotionRecord.pending(
            PromotionId.of("p-1"), ContentKind.CONFIG, "dev", "stage", ActorId.of("alice"), null, STARTED);

        assertThatThrownBy(() -> record.getErrors().put("x", "y"))
            .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> record.getRollbackData().add(ItemId.of("x")))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void missing_required_fields_are_rejected() {
        assertThatThrownBy(() -> new PromotionRecord.Builder().id(PromotionId.of("p-1")).build())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("promotionType");
    }

    @Test
    void negative_duration_is_rejected() {
        assertThatThrownBy(() -> new PromotionRecord.Builder().durationSeconds(-1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("cannot be negative");
    }
}
