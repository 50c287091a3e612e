package com.ryuqq.promotion.application.copy;

import com.ryuqq.promotion.core.model.PromotableItem;
import com.ryuqq.promotion.core.outcome.Copied;
import com.ryuqq.promotion.core.outcome.CopyOutcome;

/**
 * 항목 하나를 복사하는 작업.
 *
 * @author Promotion Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface CopyTask {

    /**
     * 항목 복사.
     *
     * @param item 원본 항목
     * @return 복사 결과
     */
    CopyOutcome copy(PromotableItem item);

    /**
     * 이미 실패로 보고된 항목의 늦은 복사 결과 되돌리기.
     *
     * <p>Runner가 타임아웃을 보고한 뒤에 복사가 끝난 경우 호출됩니다. 이 결과는 집계되지 않으므로
     * 대상 레코드를 남기면 안 됩니다.</p>
     *
     * @param copied 늦게 완료된 복사 결과
     */
    default void discard(Copied copied) {
    }
}
