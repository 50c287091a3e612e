package com.ryuqq.promotion.core.outcome;

import com.ryuqq.promotion.core.model.ItemId;

/**
 * 항목 단위 복사 실패.
 *
 * <p>배치 전체를 중단시키지 않으며, Orchestrator가 errors 맵에 기록하고 다음 항목으로 진행합니다.</p>
 *
 * @param sourceId 원본 항목 ID
 * @param stage 실패 단계
 * @param message 오류 메시지
 *
 * @author Promotion Team
 * @since 1.0.0
 */
public record CopyFailed(
    ItemId sourceId,
    CopyStage stage,
    String message
) implements CopyOutcome {

    public CopyFailed {
        if (sourceId == null) {
            throw new IllegalArgumentException("sourceId cannot be null");
        }
        if (stage == null) {
            throw new IllegalArgumentException("stage cannot be null");
        }
        if (message == null || message.isBlank()) {
            message = "unknown error";
        }
    }

    public static CopyFailed of(ItemId sourceId, CopyStage stage, String message) {
        return new CopyFailed(sourceId, stage, message);
    }

    /**
     * 감사 기록용 메시지 (단계 태그 포함).
     *
     * @return 예: "[PAYLOAD] bucket dev-audio unavailable"
     */
    public String describe() {
        return "[" + stage + "] " + message;
    }
}
