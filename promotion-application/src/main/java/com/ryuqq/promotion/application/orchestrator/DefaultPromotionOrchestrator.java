package com.ryuqq.promotion.application.orchestrator;

import com.ryuqq.promotion.application.config.PromotionConfig;
import com.ryuqq.promotion.application.copy.AbortSignal;
import com.ryuqq.promotion.application.copy.CopyRunner;
import com.ryuqq.promotion.application.copy.CopyTask;
import com.ryuqq.promotion.application.copy.ItemCopier;
import com.ryuqq.promotion.application.copy.SequentialCopyRunner;
import com.ryuqq.promotion.application.preview.PreviewBuilder;
import com.ryuqq.promotion.application.preview.PromotionPreview;
import com.ryuqq.promotion.core.model.ActorId;
import com.ryuqq.promotion.core.model.ContentKind;
import com.ryuqq.promotion.core.model.Environment;
import com.ryuqq.promotion.core.model.ItemId;
import com.ryuqq.promotion.core.model.PromotableItem;
import com.ryuqq.promotion.core.model.PromotionId;
import com.ryuqq.promotion.core.model.PromotionRecord;
import com.ryuqq.promotion.core.outcome.Copied;
import com.ryuqq.promotion.core.outcome.CopyFailed;
import com.ryuqq.promotion.core.outcome.CopyOutcome;
import com.ryuqq.promotion.core.spi.ContentStore;
import com.ryuqq.promotion.core.spi.EligibilityFilter;
import com.ryuqq.promotion.core.spi.PromotionRecordStore;
import com.ryuqq.promotion.core.spi.StoreException;
import com.ryuqq.promotion.core.statemachine.PromotionState;
import com.ryuqq.promotion.core.statemachine.StateTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * PromotionOrchestrator 기본 구현체.
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>같은 (kind, source, target) 조합의 Execute는 직렬화됩니다. 먼저 끝난 실행이 원본 항목을
 *       PROMOTED로 바꾸므로, 뒤따른 실행은 같은 항목을 다시 복사하지 않습니다.</li>
 *   <li>같은 승격에 대한 Rollback도 직렬화됩니다.</li>
 *   <li>항목 결과 집계와 원본 항목 갱신은 Execute를 호출한 스레드에서만 수행됩니다.</li>
 * </ul>
 *
 * <p><strong>롤백 정책:</strong></p>
 * <ul>
 *   <li>rollbackWindow는 권장 기간입니다. 경과 후 요청은 경고를 남기고 수행합니다.</li>
 *   <li>원본 항목의 승격 표시는 되돌리지 않습니다.</li>
 *   <li>벡터 포인트와 대상 버킷의 페이로드는 삭제하지 않습니다.</li>
 * </ul>
 *
 * @author Promotion Team
 * @since 1.0.0
 */
public final class DefaultPromotionOrchestrator implements PromotionOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(DefaultPromotionOrchestrator.class);

    private final ContentStore contentStore;
    private final PromotionRecordStore recordStore;
    private final ItemCopier itemCopier;
    private final CopyRunner copyRunner;
    private final PromotionConfig config;
    private final PreviewBuilder previewBuilder;
    private final Clock clock;

    private final ConcurrentHashMap<String, KeyedLock> locks = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<PromotionId, AbortSignal> running = new ConcurrentHashMap<>();

    /**
     * 생성자 (순차 Runner, 시스템 UTC 시계 사용).
     */
    public DefaultPromotionOrchestrator(ContentStore contentStore, PromotionRecordStore recordStore,
                                        ItemCopier itemCopier, PromotionConfig config) {
        this(contentStore, recordStore, itemCopier, new SequentialCopyRunner(), config, Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param contentStore 콘텐츠 저장소
     * @param recordStore 승격 기록 저장소
     * @param itemCopier 항목 복사기
     * @param copyRunner 복사 실행 전략
     * @param config 승격 설정
     * @param clock 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DefaultPromotionOrchestrator(ContentStore contentStore, PromotionRecordStore recordStore,
                                        ItemCopier itemCopier, CopyRunner copyRunner,
                                        PromotionConfig config, Clock clock) {
        if (contentStore == null) {
            throw new IllegalArgumentException("contentStore cannot be null");
        }
        if (recordStore == null) {
            throw new IllegalArgumentException("recordStore cannot be null");
        }
        if (itemCopier == null) {
            throw new IllegalArgumentException("itemCopier cannot be null");
        }
        if (copyRunner == null) {
            throw new IllegalArgumentException("copyRunner cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.contentStore = contentStore;
        this.recordStore = recordStore;
        this.itemCopier = itemCopier;
        this.copyRunner = copyRunner;
        this.config = config;
        this.previewBuilder = new PreviewBuilder(contentStore, config.pathValidator());
        this.clock = clock;
    }

    @Override
    public PromotionPreview preview(ContentKind kind, String source, String target, Collection<ItemId> itemIds) {
        return previewBuilder.preview(kind, source, target, itemIds);
    }

    @Override
    public PromotionResult execute(ExecuteRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        String lockKey = "execute|" + request.lockKey();
        KeyedLock lock = acquire(lockKey);
        try {
            return executeLocked(request);
        } finally {
            release(lockKey, lock);
        }
    }

    private PromotionResult executeLocked(ExecuteRequest request) {
        // 1. PENDING 기록
        PromotionRecord record = PromotionRecord.pending(
            PromotionId.newId(), request.kind(), request.sourceEnvironment(), request.targetEnvironment(),
            request.actor(), request.reasonOrNull(), clock.instant());
        recordStore.save(record);

        AbortSignal abortSignal = new AbortSignal();
        running.put(record.getId(), abortSignal);
        try {
            // 2. IN_PROGRESS
            record = record.toBuilder()
                .status(StateTransition.transition(record.getStatus(), PromotionState.IN_PROGRESS))
                .build();
            recordStore.save(record);
            log.info("Promotion started: {} {} {}→{} by {}", record.getId().getValue(), request.kind().tag(),
                request.sourceEnvironment(), request.targetEnvironment(), request.actor());

            return runInProgress(record, request, abortSignal);
        } finally {
            running.remove(record.getId());
        }
    }

    private PromotionResult runInProgress(PromotionRecord record, ExecuteRequest request, AbortSignal abortSignal) {
        // 3. 미리보기 재계산
        PromotionPreview preview = previewBuilder.preview(
            request.kind(), request.sourceEnvironment(), request.targetEnvironment(), request.itemIds());
        if (!preview.isValid()) {
            return finishFailed(record, "Promotion validation failed: " + String.join("; ", preview.errors()));
        }
        Environment source = Environment.of(request.sourceEnvironment());
        Environment target = Environment.of(request.targetEnvironment());

        // 4. 적격 항목 조회
        List<PromotableItem> items;
        try {
            items = contentStore.findEligible(request.kind(), source, EligibilityFilter.ofIds(request.itemIds()));
        } catch (StoreException e) {
            log.error("Failed to load eligible items for promotion {}: {}", record.getId().getValue(), e.getMessage(), e);
            return finishFailed(record, "Failed to load eligible items: " + e.getMessage());
        }

        // 5. 항목별 복사 (결과는 이 스레드에서 순차 집계)
        PromotionJob job = new PromotionJob(record.getId());
        Map<ItemId, PromotableItem> sourceItems = new LinkedHashMap<>();
        for (PromotableItem item : items) {
            sourceItems.put(item.getId(), item);
        }
        try {
            copyRunner.run(items, copyTask(target, request.actor()), abortSignal,
                outcome -> accept(job, outcome, sourceItems, target, request.actor()));
        } catch (RuntimeException e) {
            log.error("Promotion {} stopped unexpectedly after {} items: {}",
                record.getId().getValue(), job.totalProcessed(), e.getMessage(), e);
            return finishFailed(record.toBuilder()
                .successCount(job.successCount())
                .errorCount(job.errorCount())
                .itemsPromoted(job.promoted())
                .rollbackData(job.createdIds())
                .build(), "Promotion stopped unexpectedly: " + e.getMessage());
        }

        if (abortSignal.isAborted()) {
            log.warn("Promotion {} was aborted: {}", record.getId().getValue(), abortSignal.getReasonOrNull());
        }

        // 6. 최종 상태 확정
        return complete(record, job);
    }

    private CopyTask copyTask(Environment target, ActorId actor) {
        return new CopyTask() {
            @Override
            public CopyOutcome copy(PromotableItem item) {
                return itemCopier.copy(item, target, actor);
            }

            @Override
            public void discard(Copied copied) {
                itemCopier.discard(copied);
            }
        };
    }

    private void accept(PromotionJob job, CopyOutcome outcome, Map<ItemId, PromotableItem> sourceItems,
                        Environment target, ActorId actor) {
        if (outcome instanceof Copied copied) {
            job.recordSuccess(copied.sourceId(), copied.newId());
            markSourcePromoted(sourceItems.get(copied.sourceId()), target, actor);
        } else if (outcome instanceof CopyFailed failed) {
            job.recordFailure(failed.sourceId(), failed.describe());
            log.error("Item promotion failed: promotion={}, item={}, {}",
                job.promotionId().getValue(), failed.sourceId(), failed.describe());
        }
    }

    private void markSourcePromoted(PromotableItem source, Environment target, ActorId actor) {
        if (source == null) {
            return;
        }
        try {
            source.markAsPromoted(target, actor, clock.instant());
            contentStore.update(source);
        } catch (RuntimeException e) {
            // 복사는 성공했으므로 성공으로 집계, 재실행 시 중복 복사될 수 있음
            log.warn("Item {} was copied but its promotion status could not be updated: {}",
                source.getId(), e.getMessage(), e);
        }
    }

    private PromotionResult complete(PromotionRecord record, PromotionJob job) {
        PromotionState finalState = PromotionState.settle(job.successCount(), job.errorCount());
        Instant completedAt = clock.instant();

        PromotionRecord completed = record.toBuilder()
            .status(StateTransition.transition(record.getStatus(), finalState))
            .completedAt(completedAt)
            .durationSeconds(durationSeconds(record.getStartedAt(), completedAt))
            .successCount(job.successCount())
            .errorCount(job.errorCount())
            .errors(job.errors())
            .itemsPromoted(job.promoted())
            .rollbackData(job.createdIds())
            .canRollback(finalState != PromotionState.FAILED)
            .build();
        recordStore.save(completed);

        log.info("Promotion completed: {} status={}, success={}, error={}, duration={}s",
            completed.getId().getValue(), finalState, job.successCount(), job.errorCount(),
            completed.getDurationSeconds());
        return PromotionResult.from(completed);
    }

    private PromotionResult finishFailed(PromotionRecord record, String message) {
        Instant completedAt = clock.instant();
        Map<String, String> errors = new LinkedHashMap<>(record.getErrors());
        errors.put(PromotionRecord.GENERAL_ERROR_KEY, message);

        PromotionRecord failed = record.toBuilder()
            .status(StateTransition.transition(record.getStatus(), PromotionState.FAILED))
            .completedAt(completedAt)
            .durationSeconds(durationSeconds(record.getStartedAt(), completedAt))
            .errors(errors)
            .canRollback(false)
            .build();
        recordStore.save(failed);

        log.error("Promotion failed: {} {}", failed.getId().getValue(), message);
        return PromotionResult.from(failed);
    }

    @Override
    public RollbackResult rollback(PromotionId promotionId, ActorId actor) {
        if (promotionId == null) {
            throw new IllegalArgumentException("promotionId cannot be null");
        }
        if (actor == null) {
            throw new IllegalArgumentException("actor cannot be null");
        }
        String lockKey = "rollback|" + promotionId.getValue();
        KeyedLock lock = acquire(lockKey);
        try {
            return rollbackLocked(promotionId, actor);
        } finally {
            release(lockKey, lock);
        }
    }

    private RollbackResult rollbackLocked(PromotionId promotionId, ActorId actor) {
        // 1. 롤백 가능 여부 확인
        PromotionRecord record = recordStore.findById(promotionId)
            .orElseThrow(() -> new RollbackException(promotionId, "Promotion not found: " + promotionId.getValue()));
        if (record.getStatus() == PromotionState.ROLLED_BACK) {
            throw new RollbackException(promotionId, "Promotion already rolled back: " + promotionId.getValue());
        }
        if (!record.canRollback()) {
            throw new RollbackException(promotionId, "Promotion cannot be rolled back: " + promotionId.getValue());
        }
        if (!record.getStatus().isRollbackable()) {
            throw new RollbackException(promotionId,
                "Promotion in status " + record.getStatus() + " cannot be rolled back: " + promotionId.getValue());
        }

        Instant now = clock.instant();
        warnIfOutsideWindow(record, now);

        // 2. 생성 항목 삭제 (best-effort)
        List<ItemId> deleted = new ArrayList<>();
        Map<ItemId, String> failures = new LinkedHashMap<>();
        for (ItemId createdId : record.getRollbackData()) {
            try {
                if (contentStore.delete(createdId)) {
                    deleted.add(createdId);
                } else {
                    failures.put(createdId, "Item not found in target environment");
                }
            } catch (RuntimeException e) {
                failures.put(createdId, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
                log.error("Rollback could not delete item {} of promotion {}: {}",
                    createdId, promotionId.getValue(), e.getMessage(), e);
            }
        }

        // 3. ROLLED_BACK 확정
        PromotionRecord rolledBack = record.toBuilder()
            .status(StateTransition.transition(record.getStatus(), PromotionState.ROLLED_BACK))
            .rolledBackAt(now)
            .rolledBackBy(actor)
            .build();
        recordStore.save(rolledBack);

        if (failures.isEmpty()) {
            log.info("Promotion rolled back: {} ({} items deleted) by {}", promotionId.getValue(), deleted.size(), actor);
        } else {
            log.warn("Promotion rolled back with failures: {} ({} deleted, {} failed) by {}",
                promotionId.getValue(), deleted.size(), failures.size(), actor);
        }
        return new RollbackResult(promotionId, deleted, failures, now);
    }

    private void warnIfOutsideWindow(PromotionRecord record, Instant now) {
        Instant completedAt = record.getCompletedAtOrNull();
        if (completedAt != null && now.isAfter(completedAt.plus(config.rollbackWindow()))) {
            log.warn("Rolling back promotion {} outside the rollback window ({} since completion, window {})",
                record.getId().getValue(), Duration.between(completedAt, now), config.rollbackWindow());
        }
    }

    @Override
    public Optional<PromotionRecord> findPromotion(PromotionId promotionId) {
        if (promotionId == null) {
            throw new IllegalArgumentException("promotionId cannot be null");
        }
        return recordStore.findById(promotionId);
    }

    @Override
    public List<PromotionRecord> recentPromotions(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive (current: " + limit + ")");
        }
        return recordStore.findRecent(limit);
    }

    @Override
    public List<PromotionId> runningPromotions() {
        return List.copyOf(running.keySet());
    }

    @Override
    public boolean abort(PromotionId promotionId, String reason) {
        if (promotionId == null) {
            throw new IllegalArgumentException("promotionId cannot be null");
        }
        AbortSignal signal = running.get(promotionId);
        if (signal == null) {
            return false;
        }
        if (signal.abort(reason)) {
            log.info("Abort requested for promotion {}: {}", promotionId.getValue(), signal.getReasonOrNull());
        }
        return true;
    }

    /**
     * 키별 잠금 획득.
     *
     * <p>대기자 수는 compute 안에서만 바뀌며, 마지막 사용자가 해제하면 항목을 제거합니다.</p>
     */
    private KeyedLock acquire(String key) {
        KeyedLock entry = locks.compute(key, (k, existing) -> {
            KeyedLock lock = existing != null ? existing : new KeyedLock();
            lock.users++;
            return lock;
        });
        entry.lock.lock();
        return entry;
    }

    private void release(String key, KeyedLock entry) {
        entry.lock.unlock();
        locks.computeIfPresent(key, (k, existing) -> --existing.users == 0 ? null : existing);
    }

    int heldLockCount() {
        return locks.size();
    }

    private static long durationSeconds(Instant startedAt, Instant completedAt) {
        return Math.max(0, Duration.between(startedAt, completedAt).getSeconds());
    }

    private static final class KeyedLock {

        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}
