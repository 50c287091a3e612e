package com.ryuqq.promotion.application.copy;

import com.ryuqq.promotion.core.model.ConfigEntry;
import com.ryuqq.promotion.core.model.Environment;
import com.ryuqq.promotion.core.model.ItemId;
import com.ryuqq.promotion.core.model.PromotableItem;
import com.ryuqq.promotion.core.outcome.Copied;
import com.ryuqq.promotion.core.outcome.CopyFailed;
import com.ryuqq.promotion.core.outcome.CopyOutcome;
import com.ryuqq.promotion.core.outcome.CopyStage;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * SequentialCopyRunner 테스트.
 *
 * @author Promotion Team
 * @since 1.0.0
 */
class SequentialCopyRunnerTest {

    private final SequentialCopyRunner runner = new SequentialCopyRunner();

    private static List<PromotableItem> items(String... ids) {
        List<PromotableItem> items = new ArrayList<>();
        for (String id : ids) {
            items.add(new ConfigEntry(ItemId.of(id), Environment.DEV, "key-" + id, "v"));
        }
        return items;
    }

    private static CopyOutcome copied(PromotableItem item) {
        return new Copied(item.getId(), new ConfigEntry(ItemId.of(item.getId().getValue() + "-new"),
            Environment.STAGE, "k", "v"));
    }

    @Test
    void delivers_one_outcome_per_item_in_order_on_calling_thread() {
        // given
        List<CopyOutcome> outcomes = new ArrayList<>();
        List<Thread> sinkThreads = new ArrayList<>();

        // when
        runner.run(items("a", "b", "c"), SequentialCopyRunnerTest::copied, new AbortSignal(), outcome -> {
            outcomes.add(outcome);
            sinkThreads.add(Thread.currentThread());
        });

        // then
        assertThat(outcomes).extracting(CopyOutcome::sourceId)
            .containsExactly(ItemId.of("a"), ItemId.of("b"), ItemId.of("c"));
        assertThat(sinkThreads).containsOnly(Thread.currentThread());
    }

    @Test
    void failure_of_one_item_does_not_stop_others() {
        List<CopyOutcome> outcomes = new ArrayList<>();

        runner.run(items("a", "b", "c"), item -> {
            if (item.getId().equals(ItemId.of("b"))) {
                throw new IllegalStateException("boom");
            }
            return copied(item);
        }, new AbortSignal(), outcomes::add);

        assertThat(outcomes).hasSize(3);
        assertThat(outcomes.get(1)).isInstanceOf(CopyFailed.class);
        assertThat(((CopyFailed) outcomes.get(1)).stage()).isEqualTo(CopyStage.UNEXPECTED);
        assertThat(outcomes.get(2).isCopied()).isTrue();
    }

    @Test
    void abort_skips_items_not_yet_started() {
        // given
        AbortSignal signal = new AbortSignal();
        List<CopyOutcome> outcomes = new ArrayList<>();

        // when: 첫 항목 처리 중 중단 요청
        runner.run(items("a", "b", "c"), item -> {
            signal.abort("operator stop");
            return copied(item);
        }, signal, outcomes::add);

        // then
        assertThat(outcomes.get(0).isCopied()).isTrue();
        assertThat(outcomes.subList(1, 3)).allSatisfy(outcome -> {
            assertThat(outcome).isInstanceOf(CopyFailed.class);
            assertThat(((CopyFailed) outcome).stage()).isEqualTo(CopyStage.ABORTED);
            assertThat(((CopyFailed) outcome).message()).contains("operator stop");
        });
    }

    @Test
    void abort_signal_keeps_first_reason() {
        AbortSignal signal = new AbortSignal();

        assertThat(signal.abort(null)).isTrue();
        assertThat(signal.abort("second")).isFalse();
        assertThat(signal.getReasonOrNull()).isEqualTo("aborted by operator");
    }
}
