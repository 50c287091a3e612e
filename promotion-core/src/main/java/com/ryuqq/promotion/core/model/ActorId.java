package com.ryuqq.promotion.core.model;

/**
 * 승격/롤백을 실행한 운영자 식별자.
 *
 * <p>감사(audit) 기록에 남는 값이므로 null 또는 빈 문자열을 허용하지 않습니다.</p>
 *
 * @param value 운영자 식별 값 (사용자 UUID, 계정명 등)
 *
 * @author Promotion Team
 * @since 1.0.0
 */
public record ActorId(String value) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException value가 null/blank이거나 255자를 초과하는 경우
     */
    public ActorId {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ActorId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("ActorId length cannot exceed 255 characters");
        }
    }

    public static ActorId of(String value) {
        return new ActorId(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
