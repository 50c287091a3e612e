package com.ryuqq.promotion.core.model;

import java.util.UUID;

/**
 * 승격 작업(PromotionRecord)의 전역 고유 식별자.
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 *
 * @author Promotion Team
 * @since 1.0.0
 */
public final class PromotionId {

    private final String value;

    private PromotionId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("PromotionId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("PromotionId length cannot exceed 255 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_]+$")) {
            throw new IllegalArgumentException("PromotionId contains invalid characters. Only alphanumeric, hyphen, and underscore are allowed");
        }
        this.value = value;
    }

    /**
     * PromotionId 생성.
     *
     * @param value PromotionId 값
     * @return PromotionId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static PromotionId of(String value) {
        return new PromotionId(value);
    }

    /**
     * 새 PromotionId 발급 (UUID 기반).
     *
     * @return 새 PromotionId
     */
    public static PromotionId newId() {
        return new PromotionId(UUID.randomUUID().toString());
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PromotionId that = (PromotionId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "PromotionId{" + value + '}';
    }
}
