package com.ryuqq.promotion.core.spi;

import com.ryuqq.promotion.core.model.Environment;
import com.ryuqq.promotion.core.model.ItemId;
import com.ryuqq.promotion.core.model.PromotableItem;

import java.util.Collection;
import java.util.Set;

/**
 * 적격 항목 조회 필터.
 *
 * <p>itemIds가 비어 있으면 모든 적격 항목, 비어 있지 않으면 적격 항목과 ID 집합의 교집합입니다.
 * Preview와 Execute는 같은 필터를 사용합니다.</p>
 *
 * @param itemIds 대상 ID 집합 (빈 집합 = 전체)
 *
 * @author Promotion Team
 * @since 1.0.0
 */
public record EligibilityFilter(Set<ItemId> itemIds) {

    private static final EligibilityFilter ALL = new EligibilityFilter(Set.of());

    public EligibilityFilter {
        itemIds = itemIds == null ? Set.of() : Set.copyOf(itemIds);
    }

    public static EligibilityFilter all() {
        return ALL;
    }

    /**
     * ID 집합 필터 생성.
     *
     * @param itemIds ID 목록 (null 또는 빈 목록이면 전체)
     * @return 필터
     */
    public static EligibilityFilter ofIds(Collection<ItemId> itemIds) {
        if (itemIds == null || itemIds.isEmpty()) {
            return ALL;
        }
        return new EligibilityFilter(Set.copyOf(itemIds));
    }

    public boolean restrictsIds() {
        return !itemIds.isEmpty();
    }

    /**
     * 적격 조건 평가 (저장소 구현체가 사용할 수 있는 메모리 내 술어).
     *
     * @param item 항목
     * @param source 원본 환경
     * @return 적격이고 ID 필터를 통과하면 true
     */
    public boolean matches(PromotableItem item, Environment source) {
        if (!item.isEligibleFor(source)) {
            return false;
        }
        return itemIds.isEmpty() || itemIds.contains(item.getId());
    }
}
