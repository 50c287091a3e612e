package com.ryuqq.promotion.application.orchestrator;

import com.ryuqq.promotion.application.preview.PromotionPreview;
import com.ryuqq.promotion.core.model.ActorId;
import com.ryuqq.promotion.core.model.ContentKind;
import com.ryuqq.promotion.core.model.ItemId;
import com.ryuqq.promotion.core.model.PromotionId;
import com.ryuqq.promotion.core.model.PromotionRecord;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * 환경 승격 조정자.
 *
 * <p>Preview → Execute → (선택) Rollback 흐름을 담당합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * PromotionPreview preview = orchestrator.preview(ContentKind.AUDIO_RESOURCE, "dev", "stage", null);
 * if (preview.isValid()) {
 *     PromotionResult result = orchestrator.execute(
 *         ExecuteRequest.of(ContentKind.AUDIO_RESOURCE, "dev", "stage", ActorId.of("alice"))
 *             .withReason("release 42"));
 *
 *     if (result.isPartialFailure()) {
 *         // result.errors() 확인
 *     }
 * }
 * </pre>
 *
 * @author Promotion Team
 * @since 1.0.0
 */
public interface PromotionOrchestrator {

    /**
     * 승격 미리보기 (읽기 전용).
     *
     * @param kind 콘텐츠 종류
     * @param source 원본 환경
     * @param target 대상 환경
     * @param itemIds 대상 항목 ID (null 또는 빈 값이면 전체)
     * @return 미리보기
     */
    PromotionPreview preview(ContentKind kind, String source, String target, Collection<ItemId> itemIds);

    /**
     * 승격 실행.
     *
     * <p><strong>동작 방식:</strong></p>
     * <ol>
     *   <li>PENDING 기록 저장</li>
     *   <li>IN_PROGRESS 전이</li>
     *   <li>미리보기 재계산, 유효하지 않으면 FAILED (항목 변경 없음)</li>
     *   <li>적격 항목을 하나씩 복사, 성공 즉시 원본 항목을 승격 완료로 표시</li>
     *   <li>SUCCESS / PARTIAL_SUCCESS / FAILED 확정 및 롤백 데이터 저장</li>
     * </ol>
     *
     * <p>예상 가능한 실패는 예외가 아닌 결과로 반환합니다.</p>
     *
     * @param request 실행 요청
     * @return 실행 결과
     */
    PromotionResult execute(ExecuteRequest request);

    /**
     * 승격 롤백 (대상 환경에 생성된 항목 삭제).
     *
     * @param promotionId 승격 ID
     * @param actor 실행자
     * @return 롤백 결과 (개별 삭제 실패 포함)
     * @throws RollbackException 기록이 없거나 롤백할 수 없는 상태인 경우
     */
    RollbackResult rollback(PromotionId promotionId, ActorId actor);

    /**
     * 승격 기록 조회.
     */
    Optional<PromotionRecord> findPromotion(PromotionId promotionId);

    /**
     * 최근 승격 기록 조회 (시작 시각 내림차순).
     */
    List<PromotionRecord> recentPromotions(int limit);

    /**
     * 실행 중인 승격 ID 목록.
     */
    List<PromotionId> runningPromotions();

    /**
     * 실행 중인 승격 중단 요청.
     *
     * <p>진행 중인 항목은 끝까지 처리되고, 시작하지 않은 항목은 ABORTED 오류로 기록됩니다.</p>
     *
     * @param promotionId 승격 ID
     * @param reason 중단 사유
     * @return 실행 중인 승격에 신호를 보낸 경우 true
     */
    boolean abort(PromotionId promotionId, String reason);
}
