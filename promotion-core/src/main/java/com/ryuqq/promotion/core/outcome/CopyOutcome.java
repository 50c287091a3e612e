package com.ryuqq.promotion.core.outcome;

import com.ryuqq.promotion.core.model.ItemId;

/**
 * 항목 단위 복사 결과.
 *
 * <ul>
 *   <li>{@link Copied}: 대상 환경에 레코드까지 저장 완료</li>
 *   <li>{@link CopyFailed}: 실패 단계와 메시지를 포함한 항목 단위 오류</li>
 * </ul>
 *
 * <p>항목 단위 오류는 예외로 전파되지 않고 이 값으로 집계됩니다.</p>
 *
 * <p><strong>Pattern Matching 예시:</strong></p>
 * <pre>
 * switch (outcome) {
 *     case Copied copied -&gt; job.recordSuccess(copied);
 *     case CopyFailed failed -&gt; job.recordFailure(failed);
 * }
 * </pre>
 *
 * @author Promotion Team
 * @since 1.0.0
 */
public sealed interface CopyOutcome permits Copied, CopyFailed {

    /**
     * 복사 대상이었던 원본 항목 ID.
     *
     * @return 원본 항목 ID
     */
    ItemId sourceId();

    default boolean isCopied() {
        return this instanceof Copied;
    }

    default boolean isFailed() {
        return this instanceof CopyFailed;
    }
}
