package com.ryuqq.promotion.core.model;

/**
 * 벡터 인덱스에 항목 ID로 키잉된 포인트를 가진 항목.
 *
 * <p>벡터는 재생성 가능하므로 복사 실패가 항목 실패로 이어지지 않습니다.</p>
 *
 * @author Promotion Team
 * @since 1.0.0
 */
public interface HasVectorPoints {

    /**
     * 기본 컬렉션명 (환경 접미사 제외, 예: "knowledge").
     *
     * @return 기본 컬렉션명
     */
    String vectorCollection();
}
