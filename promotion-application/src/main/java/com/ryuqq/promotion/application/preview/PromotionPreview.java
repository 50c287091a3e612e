package com.ryuqq.promotion.application.preview;

import com.ryuqq.promotion.core.model.ContentKind;

import java.util.List;

/**
 * 승격 미리보기 결과.
 *
 * <p>warnings는 참고용이며 Execute를 막지 않습니다. errors가 하나라도 있으면 유효하지 않습니다.</p>
 *
 * @param sourceEnvironment 요청된 원본 환경
 * @param targetEnvironment 요청된 대상 환경
 * @param kind 콘텐츠 종류
 * @param items 승격 대상 항목
 * @param totalCount 항목 수
 * @param totalSizeBytes 크기 합계 (HasSize 항목만 합산)
 * @param warnings 경고 목록
 * @param errors 오류 목록
 * @author Promotion Team
 * @since 1.0.0
 */
public record PromotionPreview(
    String sourceEnvironment,
    String targetEnvironment,
    ContentKind kind,
    List<PreviewItem> items,
    int totalCount,
    long totalSizeBytes,
    List<String> warnings,
    List<String> errors
) {

    public PromotionPreview {
        items = items == null ? List.of() : List.copyOf(items);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    /**
     * 오류만 담은 미리보기 생성.
     */
    public static PromotionPreview invalid(String sourceEnvironment, String targetEnvironment,
                                           ContentKind kind, String error) {
        return new PromotionPreview(sourceEnvironment, targetEnvironment, kind,
            List.of(), 0, 0L, List.of(), List.of(error));
    }

    public boolean isValid() {
        return errors.isEmpty();
    }
}
