package com.ryuqq.promotion.application.preview;

import com.ryuqq.promotion.core.model.ContentKind;
import com.ryuqq.promotion.core.model.Environment;
import com.ryuqq.promotion.core.model.HasSize;
import com.ryuqq.promotion.core.model.ItemId;
import com.ryuqq.promotion.core.model.PromotableItem;

/**
 * 미리보기 항목 요약.
 *
 * @param id 항목 ID
 * @param kind 콘텐츠 종류
 * @param environment 항목 환경
 * @param displayNameOrNull 표시 이름 (없으면 null)
 * @param sizeBytesOrNull 크기 (크기 정보가 없는 종류는 null)
 * @author Promotion Team
 * @since 1.0.0
 */
public record PreviewItem(
    ItemId id,
    ContentKind kind,
    Environment environment,
    String displayNameOrNull,
    Long sizeBytesOrNull
) {

    public PreviewItem {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
    }

    /**
     * 항목에서 요약 생성.
     *
     * @param item 원본 항목
     * @return 미리보기 항목
     */
    public static PreviewItem of(PromotableItem item) {
        Long size = item instanceof HasSize sized ? sized.sizeBytes() : null;
        return new PreviewItem(item.getId(), item.kind(), item.getEnvironment(), item.displayName(), size);
    }
}
