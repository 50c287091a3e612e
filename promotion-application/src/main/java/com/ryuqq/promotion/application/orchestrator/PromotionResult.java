package com.ryuqq.promotion.application.orchestrator;

import com.ryuqq.promotion.core.model.ActorId;
import com.ryuqq.promotion.core.model.ItemId;
import com.ryuqq.promotion.core.model.PromotedItem;
import com.ryuqq.promotion.core.model.PromotionId;
import com.ryuqq.promotion.core.model.PromotionRecord;
import com.ryuqq.promotion.core.statemachine.PromotionState;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Execute 결과.
 *
 * <p>저장된 PromotionRecord의 값을 그대로 담습니다. 전체 실패와 부분 실패는 카운트로 구분합니다:</p>
 * <ul>
 *   <li>처리 항목 없음: {@code totalProcessed() == 0}</li>
 *   <li>부분 실패: {@code errorCount > 0 && successCount > 0}</li>
 * </ul>
 *
 * @author Promotion Team
 * @since 1.0.0
 */
public record PromotionResult(
    PromotionId promotionId,
    String promotionType,
    String sourceEnvironment,
    String targetEnvironment,
    PromotionState status,
    Instant startedAt,
    Instant completedAt,
    long durationSeconds,
    int successCount,
    int errorCount,
    Map<String, String> errors,
    List<PromotedItem> itemsPromoted,
    List<ItemId> createdIds,
    ActorId promotedBy,
    String reasonOrNull,
    boolean canRollback
) {

    public PromotionResult {
        // 기록과 같은 오류 순서 유지
        errors = errors == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(errors));
        itemsPromoted = itemsPromoted == null ? List.of() : List.copyOf(itemsPromoted);
        createdIds = createdIds == null ? List.of() : List.copyOf(createdIds);
    }

    /**
     * 저장된 기록에서 결과 생성.
     */
    public static PromotionResult from(PromotionRecord record) {
        return new PromotionResult(
            record.getId(),
            record.getPromotionType(),
            record.getSourceEnvironment(),
            record.getTargetEnvironment(),
            record.getStatus(),
            record.getStartedAt(),
            record.getCompletedAtOrNull(),
            record.getDurationSeconds(),
            record.getSuccessCount(),
            record.getErrorCount(),
            record.getErrors(),
            record.getItemsPromoted(),
            record.getRollbackData(),
            record.getPromotedBy(),
            record.getReasonOrNull(),
            record.canRollback()
        );
    }

    public int totalProcessed() {
        return successCount + errorCount;
    }

    public boolean isPartialFailure() {
        return successCount > 0 && errorCount > 0;
    }

    /**
     * 실행 단계 전체 실패 메시지.
     *
     * @return general_error 값 (없으면 null)
     */
    public String getGeneralErrorOrNull() {
        return errors.get(PromotionRecord.GENERAL_ERROR_KEY);
    }
}
