package com.ryuqq.promotion.core.model;

/**
 * 승격 가능한 콘텐츠 종류.
 *
 * <p>{@link #tag()} 값은 PromotionRecord의 promotionType으로 기록됩니다.</p>
 *
 * @author Promotion Team
 * @since 1.0.0
 */
public enum ContentKind {

    /**
     * RAG 문서 (벡터 포인트 보유).
     */
    DOCUMENT("documents"),

    /**
     * 오디오 리소스 (오브젝트 스토리지 페이로드 보유).
     */
    AUDIO_RESOURCE("audio_resources"),

    /**
     * 설정 항목 (레코드만 존재).
     */
    CONFIG("configs");

    private final String tag;

    ContentKind(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
