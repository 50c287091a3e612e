package com.ryuqq.promotion.application.orchestrator;

import com.ryuqq.promotion.core.model.ActorId;
import com.ryuqq.promotion.core.model.ContentKind;
import com.ryuqq.promotion.core.model.ItemId;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * 승격 실행 요청.
 *
 * <p>환경 값은 운영자가 입력한 원문 그대로 전달되며, 검증은 Orchestrator가 수행합니다.
 * itemIds가 비어 있으면 적격 항목 전체가 대상입니다.</p>
 *
 * @param kind 콘텐츠 종류
 * @param sourceEnvironment 원본 환경 (원문)
 * @param targetEnvironment 대상 환경 (원문)
 * @param actor 실행자
 * @param itemIds 대상 항목 ID (빈 값 = 전체)
 * @param reasonOrNull 승격 사유
 * @author Promotion Team
 * @since 1.0.0
 */
public record ExecuteRequest(
    ContentKind kind,
    String sourceEnvironment,
    String targetEnvironment,
    ActorId actor,
    Set<ItemId> itemIds,
    String reasonOrNull
) {

    public ExecuteRequest {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (actor == null) {
            throw new IllegalArgumentException("actor cannot be null");
        }
        itemIds = itemIds == null ? Set.of() : Set.copyOf(itemIds);
    }

    /**
     * 적격 항목 전체를 대상으로 하는 요청.
     */
    public static ExecuteRequest of(ContentKind kind, String source, String target, ActorId actor) {
        return new ExecuteRequest(kind, source, target, actor, Set.of(), null);
    }

    public ExecuteRequest withItemIds(Collection<ItemId> itemIds) {
        return new ExecuteRequest(kind, sourceEnvironment, targetEnvironment, actor,
            itemIds == null ? Set.of() : new LinkedHashSet<>(itemIds), reasonOrNull);
    }

    public ExecuteRequest withReason(String reason) {
        return new ExecuteRequest(kind, sourceEnvironment, targetEnvironment, actor, itemIds, reason);
    }

    /**
     * 동시 실행 직렬화 키 (kind, source, target).
     */
    String lockKey() {
        return kind.tag() + "|" + normalize(sourceEnvironment) + "|" + normalize(targetEnvironment);
    }

    private static String normalize(String environment) {
        return environment == null ? "" : environment.trim().toLowerCase(Locale.ROOT);
    }
}
