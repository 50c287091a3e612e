package com.ryuqq.promotion.core.spi;

import com.ryuqq.promotion.core.model.ContentKind;
import com.ryuqq.promotion.core.model.Environment;
import com.ryuqq.promotion.core.model.ItemId;
import com.ryuqq.promotion.core.model.PromotableItem;

import java.util.List;
import java.util.Optional;

/**
 * 관계형 콘텐츠 저장소 SPI.
 *
 * <p>승격 엔진은 쿼리 실행을 직접 다루지 않고 이 인터페이스의 타입 지정 연산만 사용합니다.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: 모든 메서드는 여러 스레드에서 호출 가능해야 함</li>
 *   <li>인프라 장애는 {@link StoreException}으로 알림</li>
 *   <li>반환된 항목을 변경해도 저장 상태에 반영되지 않아야 함 ({@link #update}로만 반영)</li>
 * </ul>
 *
 * @author Promotion Team
 * @since 1.0.0
 */
public interface ContentStore {

    /**
     * 승격 적격 항목 조회.
     *
     * <p><strong>Query Example:</strong></p>
     * <pre>
     * SELECT * FROM {kind}
     * WHERE environment = ?
     *   AND is_promotable = true
     *   AND promotion_status = 'approved'
     *   AND is_test_data = false
     *   [AND id IN (?)]
     * </pre>
     *
     * @param kind 콘텐츠 종류
     * @param environment 원본 환경
     * @param filter ID 필터
     * @return 적격 항목 목록 (빈 목록 가능)
     * @throws StoreException 조회 자체가 불가능한 경우
     */
    List<PromotableItem> findEligible(ContentKind kind, Environment environment, EligibilityFilter filter);

    /**
     * 종류/환경의 전체 항목 조회 (테스트 데이터 스캔용).
     *
     * @param kind 콘텐츠 종류
     * @param environment 환경
     * @return 항목 목록
     */
    List<PromotableItem> findAll(ContentKind kind, Environment environment);

    /**
     * ID로 항목 조회.
     *
     * @param id 항목 ID
     * @return 항목 (없으면 empty)
     */
    Optional<PromotableItem> findById(ItemId id);

    /**
     * 새 항목 저장.
     *
     * @param item 저장할 항목
     * @throws IllegalStateException 동일 ID가 이미 존재하는 경우
     * @throws StoreException 저장 실패
     */
    void insert(PromotableItem item);

    /**
     * 기존 항목 갱신.
     *
     * @param item 갱신할 항목
     * @throws IllegalStateException 항목이 존재하지 않는 경우
     * @throws StoreException 저장 실패
     */
    void update(PromotableItem item);

    /**
     * 항목 삭제.
     *
     * @param id 항목 ID
     * @return 삭제했으면 true, 이미 없으면 false
     * @throws StoreException 삭제 실패
     */
    boolean delete(ItemId id);
}
