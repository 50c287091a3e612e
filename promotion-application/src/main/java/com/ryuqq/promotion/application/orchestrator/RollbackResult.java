package com.ryuqq.promotion.application.orchestrator;

import com.ryuqq.promotion.core.model.ItemId;
import com.ryuqq.promotion.core.model.PromotionId;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Rollback 결과.
 *
 * <p>failures에 담긴 항목은 삭제되지 않았지만 기록은 이미 ROLLED_BACK으로 확정된 상태입니다.</p>
 *
 * @param promotionId 승격 ID
 * @param deletedIds 삭제된 항목
 * @param failures 삭제 실패 항목 (항목 ID → 사유)
 * @param rolledBackAt 롤백 시각
 * @author Promotion Team
 * @since 1.0.0
 */
public record RollbackResult(
    PromotionId promotionId,
    List<ItemId> deletedIds,
    Map<ItemId, String> failures,
    Instant rolledBackAt
) {

    public RollbackResult {
        deletedIds = deletedIds == null ? List.of() : List.copyOf(deletedIds);
        failures = failures == null ? Map.of() : Map.copyOf(failures);
    }

    public boolean isComplete() {
        return failures.isEmpty();
    }
}
