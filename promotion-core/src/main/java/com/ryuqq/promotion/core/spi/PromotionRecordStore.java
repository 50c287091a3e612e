package com.ryuqq.promotion.core.spi;

import com.ryuqq.promotion.core.model.PromotionId;
import com.ryuqq.promotion.core.model.PromotionRecord;

import java.util.List;
import java.util.Optional;

/**
 * 승격 감사 기록 저장소 SPI.
 *
 * <p>기록은 append-only입니다: 삭제 연산이 없으며, {@link #save}는 같은 ID의 최신 스냅샷으로 덮어씁니다.</p>
 *
 * @author Promotion Team
 * @since 1.0.0
 */
public interface PromotionRecordStore {

    /**
     * 기록 조회.
     *
     * @param id 승격 ID
     * @return 기록 (없으면 empty)
     */
    Optional<PromotionRecord> findById(PromotionId id);

    /**
     * 기록 저장 (생성 또는 최신 스냅샷으로 갱신).
     *
     * @param record 저장할 기록
     * @throws StoreException 저장 실패
     */
    void save(PromotionRecord record);

    /**
     * 최근 기록 조회 (startedAt 내림차순).
     *
     * @param limit 최대 건수 (1 이상)
     * @return 기록 목록
     * @throws IllegalArgumentException limit이 양수가 아닌 경우
     */
    List<PromotionRecord> findRecent(int limit);
}
