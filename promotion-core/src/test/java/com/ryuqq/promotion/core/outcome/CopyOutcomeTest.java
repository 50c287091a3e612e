package com.ryuqq.promotion.core.outcome;

import com.ryuqq.promotion.core.model.ConfigEntry;
import com.ryuqq.promotion.core.model.Environment;
import com.ryuqq.promotion.core.model.ItemId;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * CopyOutcome (Copied / CopyFailed) 테스트.
 *
 * @author Promotion Team
 * @since 1.0.0
 */
class CopyOutcomeTest {

    @Test
    void copied_exposes_new_id() {
        ConfigEntry newItem = new ConfigEntry(ItemId.of("cfg-2"), Environment.STAGE, "k", "v");

        CopyOutcome outcome = new Copied(ItemId.of("cfg-1"), newItem);

        assertThat(outcome.isCopied()).isTrue();
        assertThat(outcome.isFailed()).isFalse();
        assertThat(((Copied) outcome).newId()).isEqualTo(ItemId.of("cfg-2"));
    }

    @Test
    void failed_describes_stage_and_message() {
        CopyFailed failed = CopyFailed.of(ItemId.of("a-1"), CopyStage.PAYLOAD, "bucket unavailable");

        assertThat(failed.isFailed()).isTrue();
        assertThat(failed.describe()).isEqualTo("[PAYLOAD] bucket unavailable");
    }

    @Test
    void blank_message_becomes_unknown_error() {
        CopyFailed failed = CopyFailed.of(ItemId.of("a-1"), CopyStage.UNEXPECTED, " ");

        assertThat(failed.message()).isEqualTo("unknown error");
    }

    @Test
    void pattern_matching_over_sealed_outcome() {
        CopyOutcome outcome = CopyFailed.of(ItemId.of("a-1"), CopyStage.TIMEOUT, "took too long");

        String label;
        if (outcome instanceof Copied copied) {
            label = "copied " + copied.newId();
        } else if (outcome instanceof CopyFailed failed) {
            label = failed.stage().name();
        } else {
            label = "?";
        }

        assertThat(label).isEqualTo("TIMEOUT");
    }

    @Test
    void null_source_id_is_rejected() {
        assertThatThrownBy(() -> CopyFailed.of(null, CopyStage.RECORD, "x"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
