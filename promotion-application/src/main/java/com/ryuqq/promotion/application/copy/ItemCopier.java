package com.ryuqq.promotion.application.copy;

import com.ryuqq.promotion.core.model.ActorId;
import com.ryuqq.promotion.core.model.Environment;
import com.ryuqq.promotion.core.model.HasPayload;
import com.ryuqq.promotion.core.model.HasVectorPoints;
import com.ryuqq.promotion.core.model.ItemId;
import com.ryuqq.promotion.core.model.PayloadLocation;
import com.ryuqq.promotion.core.model.PromotableItem;
import com.ryuqq.promotion.core.outcome.Copied;
import com.ryuqq.promotion.core.outcome.CopyFailed;
import com.ryuqq.promotion.core.outcome.CopyOutcome;
import com.ryuqq.promotion.core.outcome.CopyStage;
import com.ryuqq.promotion.core.spi.ContentStore;
import com.ryuqq.promotion.core.spi.ObjectStore;
import com.ryuqq.promotion.core.spi.StoreNames;
import com.ryuqq.promotion.core.spi.VectorIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.function.Supplier;

/**
 * 단일 항목을 대상 환경으로 복사.
 *
 * <p><strong>복사 순서:</strong></p>
 * <ol>
 *   <li>필드 복사 (ID/타임스탬프 제외) 및 승격 필드 설정</li>
 *   <li>{@link HasPayload}: 원본 버킷에서 읽어 대상 버킷에 기록 (레코드 저장 전)</li>
 *   <li>{@link HasVectorPoints}: 벡터 포인트 복사 (실패해도 무시)</li>
 *   <li>레코드 저장</li>
 * </ol>
 *
 * <p>페이로드 복사가 실패하면 레코드를 만들지 않습니다. 레코드가 페이로드 없이 존재하는
 * 상황은 생기지 않지만, 레코드 저장이 실패하면 대상 버킷에 고아 페이로드가 남을 수 있습니다.</p>
 *
 * <p>예상 가능한 실패는 예외가 아닌 {@link CopyFailed}로 반환합니다.</p>
 *
 * @author Promotion Team
 * @since 1.0.0
 */
public final class ItemCopier {

    private static final Logger log = LoggerFactory.getLogger(ItemCopier.class);

    private final ContentStore contentStore;
    private final ObjectStore objectStore;
    private final VectorIndex vectorIndex;
    private final Clock clock;
    private final Supplier<ItemId> idGenerator;

    /**
     * 생성자 (시스템 UTC 시계, UUID ID 사용).
     */
    public ItemCopier(ContentStore contentStore, ObjectStore objectStore, VectorIndex vectorIndex) {
        this(contentStore, objectStore, vectorIndex, Clock.systemUTC(), ItemId::newId);
    }

    /**
     * 생성자.
     *
     * @param contentStore 레코드 저장소
     * @param objectStore 바이너리 객체 저장소
     * @param vectorIndex 벡터 인덱스
     * @param clock 승격 시각 기준 시계
     * @param idGenerator 새 항목 ID 생성기
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ItemCopier(ContentStore contentStore, ObjectStore objectStore, VectorIndex vectorIndex,
                      Clock clock, Supplier<ItemId> idGenerator) {
        if (contentStore == null) {
            throw new IllegalArgumentException("contentStore cannot be null");
        }
        if (objectStore == null) {
            throw new IllegalArgumentException("objectStore cannot be null");
        }
        if (vectorIndex == null) {
            throw new IllegalArgumentException("vectorIndex cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (idGenerator == null) {
            throw new IllegalArgumentException("idGenerator cannot be null");
        }
        this.contentStore = contentStore;
        this.objectStore = objectStore;
        this.vectorIndex = vectorIndex;
        this.clock = clock;
        this.idGenerator = idGenerator;
    }

    /**
     * 항목 복사.
     *
     * @param source 원본 항목
     * @param target 대상 환경
     * @param actor 실행자
     * @return Copied 또는 CopyFailed
     */
    public CopyOutcome copy(PromotableItem source, Environment target, ActorId actor) {
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
        if (actor == null) {
            throw new IllegalArgumentException("actor cannot be null");
        }
        ItemId sourceId = source.getId();
        Environment sourceEnv = source.getEnvironment();

        // 1. 필드 복사 + 승격 필드
        PromotableItem newItem = source.promotedCopy(idGenerator.get(), target, actor, clock.instant());

        // 2. 페이로드 (레코드 저장 전)
        if (source instanceof HasPayload withPayload) {
            CopyFailed failure = copyPayload(sourceId, withPayload.payloadLocation(), sourceEnv, target);
            if (failure != null) {
                return failure;
            }
        }

        // 3. 벡터 포인트 (실패 무시)
        if (source instanceof HasVectorPoints withVectors) {
            copyVectors(sourceId, withVectors.vectorCollection(), sourceEnv, target);
        }

        // 4. 레코드 저장
        if (Thread.currentThread().isInterrupted()) {
            log.warn("Item {} copy interrupted before record insert", sourceId);
            return CopyFailed.of(sourceId, CopyStage.RECORD, "interrupted before record insert");
        }
        try {
            contentStore.insert(newItem);
        } catch (RuntimeException e) {
            log.error("Record insert failed for item {} ({}→{}): {}", sourceId, sourceEnv, target, e.getMessage());
            return CopyFailed.of(sourceId, CopyStage.RECORD, "Record insert failed: " + e.getMessage());
        }

        log.info("Item promoted: {} {} ({}) → {} ({})", source.kind().tag(), sourceId, sourceEnv, newItem.getId(), target);
        return new Copied(sourceId, newItem);
    }

    /**
     * 늦게 완료된 복사로 생긴 대상 레코드 삭제.
     *
     * <p>페이로드와 벡터 포인트는 롤백과 같이 남겨둡니다.</p>
     *
     * @param copied 집계되지 않은 복사 결과
     */
    public void discard(Copied copied) {
        if (copied == null) {
            throw new IllegalArgumentException("copied cannot be null");
        }
        ItemId newId = copied.newId();
        try {
            if (contentStore.delete(newId)) {
                log.warn("Discarded late copy {} of item {}", newId, copied.sourceId());
            } else {
                log.warn("Late copy {} of item {} was not found for discard", newId, copied.sourceId());
            }
        } catch (RuntimeException e) {
            log.error("Could not discard late copy {} of item {}: {}", newId, copied.sourceId(), e.getMessage(), e);
        }
    }

    private CopyFailed copyPayload(ItemId sourceId, PayloadLocation location, Environment sourceEnv, Environment target) {
        String sourceBucket = StoreNames.bucketName(sourceEnv, location.bucket());
        String targetBucket = StoreNames.bucketName(target, location.bucket());
        String key = location.objectKey();
        try {
            byte[] data = objectStore.get(sourceBucket, key);
            if (data == null || data.length == 0) {
                log.error("Payload missing for item {}: {}/{}", sourceId, sourceBucket, key);
                return CopyFailed.of(sourceId, CopyStage.PAYLOAD,
                    "Failed to download file from " + sourceBucket + "/" + key);
            }
            objectStore.put(targetBucket, key, data);
            log.debug("Payload copied: {}/{} → {}/{} ({} bytes)", sourceBucket, key, targetBucket, key, data.length);
            return null;
        } catch (RuntimeException e) {
            log.error("Payload copy failed for item {}: {}/{} → {}/{}: {}",
                sourceId, sourceBucket, key, targetBucket, key, e.getMessage());
            return CopyFailed.of(sourceId, CopyStage.PAYLOAD,
                "Payload copy failed (" + sourceBucket + "/" + key + "): " + e.getMessage());
        }
    }

    private void copyVectors(ItemId sourceId, String baseCollection, Environment sourceEnv, Environment target) {
        String sourceCollection = StoreNames.collectionName(baseCollection, sourceEnv);
        String targetCollection = StoreNames.collectionName(baseCollection, target);
        try {
            int copied = vectorIndex.copyPoints(List.of(sourceId), sourceCollection, targetCollection);
            log.debug("Vector points copied for item {}: {} → {} ({} points)",
                sourceId, sourceCollection, targetCollection, copied);
        } catch (RuntimeException e) {
            log.warn("Vector copy failed for item {} ({} → {}), continuing without vectors: {}",
                sourceId, sourceCollection, targetCollection, e.getMessage());
        }
    }
}
