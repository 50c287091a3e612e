package com.ryuqq.promotion.core.spi;

import com.ryuqq.promotion.core.model.ItemId;

import java.util.List;

/**
 * 벡터 유사도 인덱스 SPI.
 *
 * <p>컬렉션명 규칙: {@code {baseCollectionName}_{environment}} ({@link StoreNames#collectionName}).</p>
 *
 * @author Promotion Team
 * @since 1.0.0
 */
public interface VectorIndex {

    /**
     * 포인트 복사 (벡터 + 페이로드).
     *
     * @param ids 포인트 ID 목록 (항목 ID)
     * @param sourceCollection 원본 컬렉션
     * @param targetCollection 대상 컬렉션
     * @return 복사된 포인트 수 (원본에 없으면 0)
     * @throws StoreException 인덱스 장애
     */
    int copyPoints(List<ItemId> ids, String sourceCollection, String targetCollection);
}
