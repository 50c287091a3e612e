package com.ryuqq.promotion.core.model;

import com.ryuqq.promotion.core.statemachine.PromotionState;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 환경 승격 감사(audit) 기록.
 *
 * <p>Execute 시작 시 PENDING 상태로 생성되고, 이후 상태 전이마다 새 스냅샷이 저장됩니다.
 * 기록은 삭제되지 않으며(append-only) 감사 이력을 구성합니다.</p>
 *
 * <p><strong>불변성:</strong> 인스턴스는 불변이며, 변경은 {@link #toBuilder()}로 새 스냅샷을 만들어 수행합니다.
 * 상태 전이의 합법성은 Orchestrator가 검증합니다.</p>
 *
 * <p>sourceEnvironment/targetEnvironment는 운영자가 요청한 원문 값을 그대로 기록합니다.
 * 허용되지 않은 환경 값으로 요청한 실패 기록도 감사 대상이기 때문입니다.</p>
 *
 * @author Promotion Team
 * @since 1.0.0
 */
public final class PromotionRecord {

    /**
     * 실행 단계 전체 실패(항목 단위가 아닌 실패) 메시지의 errors 키.
     */
    public static final String GENERAL_ERROR_KEY = "general_error";

    private final PromotionId id;
    private final String promotionType;
    private final String sourceEnvironment;
    private final String targetEnvironment;
    private final List<PromotedItem> itemsPromoted;
    private final PromotionState status;
    private final Instant startedAt;
    private final Instant completedAt;
    private final long durationSeconds;
    private final int successCount;
    private final int errorCount;
    private final Map<String, String> errors;
    private final ActorId promotedBy;
    private final String reason;
    private final boolean canRollback;
    private final List<ItemId> rollbackData;
    private final Instant rolledBackAt;
    private final ActorId rolledBackBy;

    private PromotionRecord(Builder builder) {
        if (builder.id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (builder.promotionType == null || builder.promotionType.isBlank()) {
            throw new IllegalArgumentException("promotionType cannot be null or blank");
        }
        if (builder.status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (builder.startedAt == null) {
            throw new IllegalArgumentException("startedAt cannot be null");
        }
        if (builder.promotedBy == null) {
            throw new IllegalArgumentException("promotedBy cannot be null");
        }
        this.id = builder.id;
        this.promotionType = builder.promotionType;
        this.sourceEnvironment = builder.sourceEnvironment;
        this.targetEnvironment = builder.targetEnvironment;
        this.itemsPromoted = List.copyOf(builder.itemsPromoted);
        this.status = builder.status;
        this.startedAt = builder.startedAt;
        this.completedAt = builder.completedAt;
        this.durationSeconds = builder.durationSeconds;
        this.successCount = builder.successCount;
        this.errorCount = builder.errorCount;
        this.errors = Collections.unmodifiableMap(new LinkedHashMap<>(builder.errors));
        this.promotedBy = builder.promotedBy;
        this.reason = builder.reason;
        this.canRollback = builder.canRollback;
        this.rollbackData = List.copyOf(builder.rollbackData);
        this.rolledBackAt = builder.rolledBackAt;
        this.rolledBackBy = builder.rolledBackBy;
    }

    /**
     * PENDING 상태의 새 기록 생성.
     *
     * @param id 승격 ID
     * @param kind 콘텐츠 종류 (promotionType 태그)
     * @param sourceEnvironment 요청된 원본 환경
     * @param targetEnvironment 요청된 대상 환경
     * @param promotedBy 실행자
     * @param reason 승격 사유 (null 가능)
     * @param startedAt 시작 시각
     * @return PENDING 기록
     */
    public static PromotionRecord pending(PromotionId id, ContentKind kind, String sourceEnvironment,
                                          String targetEnvironment, ActorId promotedBy, String reason,
                                          Instant startedAt) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        return new Builder()
            .id(id)
            .promotionType(kind.tag())
            .sourceEnvironment(sourceEnvironment)
            .targetEnvironment(targetEnvironment)
            .status(PromotionState.PENDING)
            .startedAt(startedAt)
            .promotedBy(promotedBy)
            .reason(reason)
            .canRollback(true)
            .build();
    }

    /**
     * 현재 값을 복사한 빌더 반환.
     *
     * @return 빌더
     */
    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.id = id;
        builder.promotionType = promotionType;
        builder.sourceEnvironment = sourceEnvironment;
        builder.targetEnvironment = targetEnvironment;
        builder.itemsPromoted = new ArrayList<>(itemsPromoted);
        builder.status = status;
        builder.startedAt = startedAt;
        builder.completedAt = completedAt;
        builder.durationSeconds = durationSeconds;
        builder.successCount = successCount;
        builder.errorCount = errorCount;
        builder.errors = new LinkedHashMap<>(errors);
        builder.promotedBy = promotedBy;
        builder.reason = reason;
        builder.canRollback = canRollback;
        builder.rollbackData = new ArrayList<>(rollbackData);
        builder.rolledBackAt = rolledBackAt;
        builder.rolledBackBy = rolledBackBy;
        return builder;
    }

    public PromotionId getId() {
        return id;
    }

    public String getPromotionType() {
        return promotionType;
    }

    public String getSourceEnvironment() {
        return sourceEnvironment;
    }

    public String getTargetEnvironment() {
        return targetEnvironment;
    }

    public List<PromotedItem> getItemsPromoted() {
        return itemsPromoted;
    }

    public int getPromotedCount() {
        return itemsPromoted.size();
    }

    public PromotionState getStatus() {
        return status;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getCompletedAtOrNull() {
        return completedAt;
    }

    public long getDurationSeconds() {
        return durationSeconds;
    }

    public int getSuccessCount() {
        return successCount;
    }

    public int getErrorCount() {
        return errorCount;
    }

    public Map<String, String> getErrors() {
        return errors;
    }

    public ActorId getPromotedBy() {
        return promotedBy;
    }

    public String getReasonOrNull() {
        return reason;
    }

    public boolean canRollback() {
        return canRollback;
    }

    /**
     * 롤백 데이터 (대상 환경에 새로 생성된 항목 ID 목록).
     *
     * @return 읽기 전용 목록
     */
    public List<ItemId> getRollbackData() {
        return rollbackData;
    }

    public Instant getRolledBackAtOrNull() {
        return rolledBackAt;
    }

    public ActorId getRolledBackByOrNull() {
        return rolledBackBy;
    }

    @Override
    public String toString() {
        return "PromotionRecord{id=" + id.getValue()
            + ", " + sourceEnvironment + "→" + targetEnvironment
            + ", type=" + promotionType
            + ", status=" + status
            + ", success=" + successCount
            + ", error=" + errorCount + "}";
    }

    /**
     * PromotionRecord 빌더.
     */
    public static final class Builder {

        private PromotionId id;
        private String promotionType;
        private String sourceEnvironment;
        private String targetEnvironment;
        private List<PromotedItem> itemsPromoted = new ArrayList<>();
        private PromotionState status;
        private Instant startedAt;
        private Instant completedAt;
        private long durationSeconds;
        private int successCount;
        private int errorCount;
        private Map<String, String> errors = new LinkedHashMap<>();
        private ActorId promotedBy;
        private String reason;
        private boolean canRollback = true;
        private List<ItemId> rollbackData = new ArrayList<>();
        private Instant rolledBackAt;
        private ActorId rolledBackBy;

        public Builder id(PromotionId id) {
            this.id = id;
            return this;
        }

        public Builder promotionType(String promotionType) {
            this.promotionType = promotionType;
            return this;
        }

        public Builder sourceEnvironment(String sourceEnvironment) {
            this.sourceEnvironment = sourceEnvironment;
            return this;
        }

        public Builder targetEnvironment(String targetEnvironment) {
            this.targetEnvironment = targetEnvironment;
            return this;
        }

        public Builder itemsPromoted(List<PromotedItem> itemsPromoted) {
            this.itemsPromoted = new ArrayList<>(itemsPromoted);
            return this;
        }

        public Builder status(PromotionState status) {
            this.status = status;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Builder durationSeconds(long durationSeconds) {
            if (durationSeconds < 0) {
                throw new IllegalArgumentException("durationSeconds cannot be negative (current: " + durationSeconds + ")");
            }
            this.durationSeconds = durationSeconds;
            return this;
        }

        public Builder successCount(int successCount) {
            this.successCount = successCount;
            return this;
        }

        public Builder errorCount(int errorCount) {
            this.errorCount = errorCount;
            return this;
        }

        public Builder errors(Map<String, String> errors) {
            this.errors = new LinkedHashMap<>(errors);
            return this;
        }

        public Builder promotedBy(ActorId promotedBy) {
            this.promotedBy = promotedBy;
            return this;
        }

        public Builder reason(String reason) {
            this.reason = reason;
            return this;
        }

        public Builder canRollback(boolean canRollback) {
            this.canRollback = canRollback;
            return this;
        }

        public Builder rollbackData(List<ItemId> rollbackData) {
            this.rollbackData = new ArrayList<>(rollbackData);
            return this;
        }

        public Builder rolledBackAt(Instant rolledBackAt) {
            this.rolledBackAt = rolledBackAt;
            return this;
        }

        public Builder rolledBackBy(ActorId rolledBackBy) {
            this.rolledBackBy = rolledBackBy;
            return this;
        }

        public PromotionRecord build() {
            return new PromotionRecord(this);
        }
    }
}
