package com.ryuqq.promotion.application.copy;

import com.ryuqq.promotion.core.model.PromotableItem;
import com.ryuqq.promotion.core.outcome.CopyFailed;
import com.ryuqq.promotion.core.outcome.CopyOutcome;
import com.ryuqq.promotion.core.outcome.CopyStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Consumer;

/**
 * 호출 스레드에서 항목을 하나씩 복사하는 기본 Runner.
 *
 * <p>항목당 타임아웃은 적용하지 않습니다. 타임아웃이 필요하면 병렬 Runner를 사용합니다.</p>
 *
 * @author Promotion Team
 * @since 1.0.0
 */
public final class SequentialCopyRunner implements CopyRunner {

    private static final Logger log = LoggerFactory.getLogger(SequentialCopyRunner.class);

    @Override
    public void run(List<PromotableItem> items, CopyTask task, AbortSignal abortSignal, Consumer<CopyOutcome> sink) {
        if (items == null || task == null || abortSignal == null || sink == null) {
            throw new IllegalArgumentException("items, task, abortSignal and sink cannot be null");
        }
        for (PromotableItem item : items) {
            if (abortSignal.isAborted()) {
                sink.accept(CopyFailed.of(item.getId(), CopyStage.ABORTED,
                    "Promotion aborted before item started: " + abortSignal.getReasonOrNull()));
                continue;
            }
            sink.accept(copyOne(item, task));
        }
    }

    private CopyOutcome copyOne(PromotableItem item, CopyTask task) {
        try {
            CopyOutcome outcome = task.copy(item);
            if (outcome == null) {
                return CopyFailed.of(item.getId(), CopyStage.UNEXPECTED, "copy task returned no outcome");
            }
            return outcome;
        } catch (RuntimeException e) {
            log.error("Unexpected error while copying item {}: {}", item.getId(), e.getMessage(), e);
            return CopyFailed.of(item.getId(), CopyStage.UNEXPECTED, e.getMessage());
        }
    }
}
