package com.ryuqq.promotion.application.copy;

import com.ryuqq.promotion.core.model.PromotableItem;
import com.ryuqq.promotion.core.outcome.CopyOutcome;

import java.util.List;
import java.util.function.Consumer;

/**
 * 항목 복사 실행 전략.
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>각 항목마다 정확히 하나의 결과를 sink에 전달합니다.</li>
 *   <li>sink는 항상 run()을 호출한 스레드에서 순차 호출됩니다 (집계 직렬화).</li>
 *   <li>한 항목의 실패가 다른 항목을 취소하지 않습니다.</li>
 *   <li>abort 신호 이후 시작되지 않은 항목은 {@code CopyStage.ABORTED}로 보고됩니다.</li>
 *   <li>task가 던진 예외는 {@code CopyStage.UNEXPECTED} 실패로 변환됩니다.</li>
 * </ul>
 *
 * @author Promotion Team
 * @since 1.0.0
 */
public interface CopyRunner {

    /**
     * 항목 목록 복사 실행.
     *
     * @param items 복사할 항목
     * @param task 항목 복사 작업
     * @param abortSignal 운영자 중단 신호
     * @param sink 결과 수신자 (호출 스레드에서 실행)
     */
    void run(List<PromotableItem> items, CopyTask task, AbortSignal abortSignal, Consumer<CopyOutcome> sink);
}
