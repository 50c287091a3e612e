package com.ryuqq.promotion.adapter.inmemory.record;

import com.ryuqq.promotion.core.model.ActorId;
import com.ryuqq.promotion.core.model.ContentKind;
import com.ryuqq.promotion.core.model.PromotionId;
import com.ryuqq.promotion.core.model.PromotionRecord;
import com.ryuqq.promotion.core.statemachine.PromotionState;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link InMemoryPromotionRecordStore}.
 *
 * @author Promotion Team
 * @since 1.0.0
 */
class InMemoryPromotionRecordStoreTest {

    private final InMemoryPromotionRecordStore store = new InMemoryPromotionRecordStore();

    private static PromotionRecord pending(String id, Instant startedAt) {
        return PromotionRecord.pending(PromotionId.of(id), ContentKind.DOCUMENT, "dev", "stage",
            ActorId.of("alice"), null, startedAt);
    }

    @Test
    void save_keeps_latest_snapshot_and_full_history() {
        // given
        PromotionRecord pending = pending("p-1", Instant.parse("2026-01-01T00:00:00Z"));
        PromotionRecord inProgress = pending.toBuilder().status(PromotionState.IN_PROGRESS).build();

        // when
        store.save(pending);
        store.save(inProgress);

        // then
        assertThat(store.findById(PromotionId.of("p-1")))
            .map(PromotionRecord::getStatus)
            .contains(PromotionState.IN_PROGRESS);
        assertThat(store.history(PromotionId.of("p-1")))
            .extracting(PromotionRecord::getStatus)
            .containsExactly(PromotionState.PENDING, PromotionState.IN_PROGRESS);
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void findRecent_orders_by_start_time_descending() {
        store.save(pending("old", Instant.parse("2026-01-01T00:00:00Z")));
        store.save(pending("new", Instant.parse("2026-01-03T00:00:00Z")));
        store.save(pending("mid", Instant.parse("2026-01-02T00:00:00Z")));

        assertThat(store.findRecent(2))
            .extracting(record -> record.getId().getValue())
            .containsExactly("new", "mid");
    }

    @Test
    void unknown_id_is_empty() {
        assertThat(store.findById(PromotionId.of("nope"))).isEmpty();
        assertThat(store.history(PromotionId.of("nope"))).isEmpty();
    }
}
