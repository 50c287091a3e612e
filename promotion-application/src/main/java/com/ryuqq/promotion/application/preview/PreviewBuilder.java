package com.ryuqq.promotion.application.preview;

import com.ryuqq.promotion.core.model.ContentKind;
import com.ryuqq.promotion.core.model.HasSize;
import com.ryuqq.promotion.core.model.ItemId;
import com.ryuqq.promotion.core.model.PromotableItem;
import com.ryuqq.promotion.core.spi.ContentStore;
import com.ryuqq.promotion.core.spi.EligibilityFilter;
import com.ryuqq.promotion.core.spi.StoreException;
import com.ryuqq.promotion.core.validation.PathValidation;
import com.ryuqq.promotion.core.validation.PathValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * 승격 미리보기 생성기.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <ol>
 *   <li>PathValidator로 경로 검증 (실패 시 즉시 반환)</li>
 *   <li>ContentStore에서 적격 항목 조회 (itemIds가 있으면 교집합)</li>
 *   <li>항목 요약 및 크기 합산</li>
 *   <li>경고 생성 (항목 없음, 10 GiB 초과)</li>
 * </ol>
 *
 * <p>원본 환경 데이터만 읽으며 어떤 상태도 변경하지 않습니다.</p>
 *
 * @author Promotion Team
 * @since 1.0.0
 */
public final class PreviewBuilder {

    private static final Logger log = LoggerFactory.getLogger(PreviewBuilder.class);

    /**
     * 대용량 경고 기준 (10 GiB).
     */
    public static final long LARGE_PROMOTION_BYTES = 10L * 1024 * 1024 * 1024;

    static final String NO_ITEMS_WARNING = "No items found to promote";

    private final ContentStore contentStore;
    private final PathValidator pathValidator;

    public PreviewBuilder(ContentStore contentStore, PathValidator pathValidator) {
        if (contentStore == null) {
            throw new IllegalArgumentException("contentStore cannot be null");
        }
        if (pathValidator == null) {
            throw new IllegalArgumentException("pathValidator cannot be null");
        }
        this.contentStore = contentStore;
        this.pathValidator = pathValidator;
    }

    /**
     * 미리보기 생성.
     *
     * @param kind 콘텐츠 종류
     * @param source 원본 환경 (원문)
     * @param target 대상 환경 (원문)
     * @param itemIds 대상 항목 ID (null 또는 빈 값이면 적격 항목 전체)
     * @return 미리보기 (예외를 던지지 않음)
     */
    public PromotionPreview preview(ContentKind kind, String source, String target, Collection<ItemId> itemIds) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }

        // 1. 경로 검증
        PathValidation validation = pathValidator.validate(source, target);
        if (!validation.ok()) {
            log.info("Promotion preview rejected: {}→{} ({}): {}", source, target, kind.tag(), validation.reason());
            return PromotionPreview.invalid(source, target, kind, validation.reason());
        }

        // 2. 적격 항목 조회
        List<PromotableItem> eligible;
        try {
            eligible = contentStore.findEligible(kind, validation.source(), EligibilityFilter.ofIds(itemIds));
        } catch (StoreException e) {
            log.error("Failed to load eligible {} items from {}: {}", kind.tag(), source, e.getMessage(), e);
            return PromotionPreview.invalid(source, target, kind,
                "Failed to load eligible items: " + e.getMessage());
        }

        // 3. 항목 요약
        List<PreviewItem> items = new ArrayList<>(eligible.size());
        long totalSize = 0;
        for (PromotableItem item : eligible) {
            items.add(PreviewItem.of(item));
            if (item instanceof HasSize sized) {
                totalSize += sized.sizeBytes();
            }
        }

        // 4. 경고
        List<String> warnings = new ArrayList<>();
        if (items.isEmpty()) {
            warnings.add(NO_ITEMS_WARNING);
        }
        if (totalSize > LARGE_PROMOTION_BYTES) {
            warnings.add(String.format(Locale.ROOT, "Large promotion size: %.2f GB",
                totalSize / (1024.0 * 1024 * 1024)));
        }

        log.info("Promotion preview generated: {}→{} ({}), count={}, sizeBytes={}",
            source, target, kind.tag(), items.size(), totalSize);

        return new PromotionPreview(source, target, kind, items, items.size(), totalSize, warnings, List.of());
    }
}
