package com.ryuqq.promotion.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 환경 간 승격이 가능한 콘텐츠 항목의 공통 기반.
 *
 * <p>콘텐츠 필드는 하위 클래스({@link Document}, {@link AudioResource}, {@link ConfigEntry})가
 * 보유하고, 이 클래스는 환경 격리 및 승격 관련 bookkeeping 필드만 관리합니다.
 * 항목 종류별 특수 처리는 capability 인터페이스({@link HasPayload}, {@link HasVectorPoints},
 * {@link HasSize}) 구현 여부로 판단합니다.</p>
 *
 * <p><strong>승격 적격 조건 (불변식):</strong></p>
 * <pre>
 * isPromotable &amp;&amp; promotionStatus == APPROVED &amp;&amp; !isTestData &amp;&amp; environment == source
 * </pre>
 *
 * <p><strong>스레드 안전성:</strong> 이 객체는 thread-safe하지 않습니다.
 * 한 번의 승격 실행 안에서는 Orchestrator만 원본 항목을 변경합니다.</p>
 *
 * @author Promotion Team
 * @since 1.0.0
 */
public abstract class PromotableItem {

    private final ItemId id;
    private Environment environment;

    private boolean promotable;
    private PromotionStatus promotionStatus = PromotionStatus.DRAFT;
    private boolean testData;
    private String testDataReason;

    private ItemId sourceId;
    private Environment sourceEnvironment;
    private final List<Environment> promotedToEnvironments = new ArrayList<>();
    private Instant promotedAt;
    private ActorId promotedBy;

    private Instant createdAt;
    private Instant updatedAt;

    /**
     * 생성자.
     *
     * @param id 항목 ID
     * @param environment 항목이 속한 환경
     * @throws IllegalArgumentException id 또는 environment가 null인 경우
     */
    protected PromotableItem(ItemId id, Environment environment) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (environment == null) {
            throw new IllegalArgumentException("environment cannot be null");
        }
        this.id = id;
        this.environment = environment;
    }

    /**
     * 콘텐츠 종류.
     *
     * @return 콘텐츠 종류
     */
    public abstract ContentKind kind();

    /**
     * 사람이 읽을 수 있는 이름 (파일명, 제목, 설정 키 등).
     *
     * @return 표시 이름 (null 가능)
     */
    public abstract String displayName();

    /**
     * 텍스트 필드 목록 (필드명 → 값). 테스트 데이터 탐지에 사용됩니다.
     *
     * @return 필드명 순서를 유지하는 맵
     */
    public abstract Map<String, String> textFields();

    /**
     * 콘텐츠 필드만 복사한 새 인스턴스 생성.
     *
     * <p>bookkeeping 필드는 호출자가 채웁니다.</p>
     *
     * @param newId 새 인스턴스의 ID
     * @param environment 새 인스턴스의 환경
     * @return 콘텐츠 필드가 복사된 새 인스턴스
     */
    protected abstract PromotableItem copyContent(ItemId newId, Environment environment);

    /**
     * 대상 환경용 승격 사본 생성.
     *
     * <p>식별자와 타임스탬프를 제외한 모든 필드를 복사한 뒤, 승격 필드를 설정합니다:</p>
     * <ul>
     *   <li>environment = target</li>
     *   <li>sourceId / sourceEnvironment = 원본 ID / 원본 환경</li>
     *   <li>promotionStatus = PROMOTED, promotedAt, promotedBy</li>
     * </ul>
     *
     * @param newId 새 항목 ID
     * @param target 대상 환경
     * @param actor 실행자
     * @param promotedAt 승격 시각
     * @return 대상 환경용 새 항목 (아직 저장되지 않음)
     */
    public final PromotableItem promotedCopy(ItemId newId, Environment target, ActorId actor, Instant promotedAt) {
        if (newId == null || target == null || actor == null || promotedAt == null) {
            throw new IllegalArgumentException("newId, target, actor and promotedAt cannot be null");
        }
        PromotableItem copy = copyContent(newId, target);
        copy.promotable = this.promotable;
        copy.testData = this.testData;
        copy.testDataReason = this.testDataReason;
        copy.promotedToEnvironments.addAll(this.promotedToEnvironments);

        copy.sourceId = this.id;
        copy.sourceEnvironment = this.environment;
        copy.promotionStatus = PromotionStatus.PROMOTED;
        copy.promotedAt = promotedAt;
        copy.promotedBy = actor;
        return copy;
    }

    /**
     * 식별자와 타임스탬프까지 포함한 완전한 사본.
     *
     * <p>저장소 어댑터가 저장 상태를 호출자 객체와 분리할 때 사용합니다.</p>
     *
     * @return 동일 상태의 새 인스턴스
     */
    public final PromotableItem snapshot() {
        PromotableItem copy = copyContent(this.id, this.environment);
        copy.promotable = this.promotable;
        copy.promotionStatus = this.promotionStatus;
        copy.testData = this.testData;
        copy.testDataReason = this.testDataReason;
        copy.sourceId = this.sourceId;
        copy.sourceEnvironment = this.sourceEnvironment;
        copy.promotedToEnvironments.addAll(this.promotedToEnvironments);
        copy.promotedAt = this.promotedAt;
        copy.promotedBy = this.promotedBy;
        copy.createdAt = this.createdAt;
        copy.updatedAt = this.updatedAt;
        return copy;
    }

    /**
     * 지정한 원본 환경에서 승격 적격인지 확인.
     *
     * @param source 원본 환경
     * @return 적격 여부
     */
    public boolean isEligibleFor(Environment source) {
        return canBePromoted() && environment == source;
    }

    /**
     * 환경과 무관하게 승격 가능한 상태인지 확인.
     *
     * @return isPromotable &amp;&amp; APPROVED &amp;&amp; !isTestData
     */
    public boolean canBePromoted() {
        return promotable && promotionStatus == PromotionStatus.APPROVED && !testData;
    }

    /**
     * 다른 환경에서 승격되어 생성된 항목인지 확인.
     */
    public boolean isPromotedItem() {
        return sourceId != null;
    }

    public boolean isProduction() {
        return environment == Environment.PROD;
    }

    public boolean isDevelopment() {
        return environment == Environment.DEV;
    }

    public boolean isStaging() {
        return environment == Environment.STAGE;
    }

    /**
     * 테스트 데이터로 표시.
     *
     * <p>테스트 데이터는 승격할 수 없으므로 isPromotable도 false로 변경됩니다.</p>
     *
     * @param reason 표시 사유 (null이면 "Manually marked")
     */
    public void markAsTestData(String reason) {
        this.testData = true;
        this.testDataReason = (reason == null || reason.isBlank()) ? "Manually marked" : reason;
        this.promotable = false;
    }

    /**
     * 승격 승인.
     *
     * @throws IllegalStateException 테스트 데이터인 경우
     */
    public void approveForPromotion() {
        if (testData) {
            throw new IllegalStateException("Test data cannot be approved for promotion: " + id);
        }
        this.promotable = true;
        this.promotionStatus = PromotionStatus.APPROVED;
    }

    /**
     * 원본 항목을 승격 완료로 표시.
     *
     * <p>대상 환경은 승격 이력에 한 번만 추가됩니다.</p>
     *
     * @param target 대상 환경
     * @param actor 실행자
     * @param at 승격 시각
     */
    public void markAsPromoted(Environment target, ActorId actor, Instant at) {
        if (target == null || actor == null || at == null) {
            throw new IllegalArgumentException("target, actor and at cannot be null");
        }
        this.promotionStatus = PromotionStatus.PROMOTED;
        this.promotedAt = at;
        this.promotedBy = actor;
        if (!promotedToEnvironments.contains(target)) {
            promotedToEnvironments.add(target);
        }
    }

    /**
     * 저장소가 최초 저장 시각을 기록.
     *
     * @param at 저장 시각
     */
    public void recordCreated(Instant at) {
        this.createdAt = at;
        this.updatedAt = at;
    }

    /**
     * 저장소가 갱신 시각을 기록.
     *
     * @param at 갱신 시각
     */
    public void recordUpdated(Instant at) {
        this.updatedAt = at;
    }

    public ItemId getId() {
        return id;
    }

    public Environment getEnvironment() {
        return environment;
    }

    public boolean isPromotable() {
        return promotable;
    }

    public void setPromotable(boolean promotable) {
        this.promotable = promotable;
    }

    public PromotionStatus getPromotionStatus() {
        return promotionStatus;
    }

    public void setPromotionStatus(PromotionStatus promotionStatus) {
        if (promotionStatus == null) {
            throw new IllegalArgumentException("promotionStatus cannot be null");
        }
        this.promotionStatus = promotionStatus;
    }

    public boolean isTestData() {
        return testData;
    }

    public String getTestDataReasonOrNull() {
        return testDataReason;
    }

    public ItemId getSourceIdOrNull() {
        return sourceId;
    }

    public Environment getSourceEnvironmentOrNull() {
        return sourceEnvironment;
    }

    /**
     * 승격 이력 (대상 환경 목록, 추가 순서 유지).
     *
     * @return 읽기 전용 목록
     */
    public List<Environment> getPromotedToEnvironments() {
        return Collections.unmodifiableList(promotedToEnvironments);
    }

    public Instant getPromotedAtOrNull() {
        return promotedAt;
    }

    public ActorId getPromotedByOrNull() {
        return promotedBy;
    }

    public Instant getCreatedAtOrNull() {
        return createdAt;
    }

    public Instant getUpdatedAtOrNull() {
        return updatedAt;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{id=" + id + ", environment=" + environment
            + ", status=" + promotionStatus + ", promotable=" + promotable + ", testData=" + testData + "}";
    }
}
