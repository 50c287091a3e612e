package com.ryuqq.promotion.core.model;

/**
 * 바이트 크기를 노출하는 항목 (미리보기 용량 집계에 사용).
 *
 * @author Promotion Team
 * @since 1.0.0
 */
public interface HasSize {

    long sizeBytes();
}
