package com.ryuqq.promotion.core.model;

import java.util.UUID;

/**
 * 승격 대상 항목의 식별자.
 *
 * <p>환경마다 항목은 서로 다른 식별자를 가집니다. 승격으로 생성된 항목은 새 ItemId를 부여받고,
 * 원본 ItemId는 {@code sourceId}로만 참조됩니다 (소유 관계 아님).</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_)만 허용</li>
 * </ul>
 *
 * @author Promotion Team
 * @since 1.0.0
 */
public final class ItemId {

    private final String value;

    private ItemId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ItemId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("ItemId length cannot exceed 255 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_]+$")) {
            throw new IllegalArgumentException("ItemId contains invalid characters. Only alphanumeric, hyphen, and underscore are allowed");
        }
        this.value = value;
    }

    /**
     * ItemId 생성.
     *
     * @param value ItemId 값
     * @return ItemId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static ItemId of(String value) {
        return new ItemId(value);
    }

    /**
     * 새 ItemId 발급 (UUID 기반).
     *
     * @return 새 ItemId
     */
    public static ItemId newId() {
        return new ItemId(UUID.randomUUID().toString());
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ItemId itemId = (ItemId) o;
        return value.equals(itemId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
