package com.ryuqq.promotion.core.model;

/**
 * 오브젝트 스토리지 내 페이로드 위치.
 *
 * <p>bucket은 환경 접두사가 없는 기본 이름입니다.
 * 실제 버킷명은 {@code {environment}-{bucket}} 규칙으로 결정됩니다.</p>
 *
 * @param bucket 기본 버킷명 (예: "audio")
 * @param objectKey 오브젝트 키
 *
 * @author Promotion Team
 * @since 1.0.0
 */
public record PayloadLocation(String bucket, String objectKey) {

    public PayloadLocation {
        if (bucket == null || bucket.isBlank()) {
            throw new IllegalArgumentException("bucket cannot be null or blank");
        }
        if (objectKey == null || objectKey.isBlank()) {
            throw new IllegalArgumentException("objectKey cannot be null or blank");
        }
    }
}
