package com.ryuqq.promotion.core.spi;

import com.ryuqq.promotion.core.model.Environment;

/**
 * 환경별 저장소 네이밍 규칙.
 *
 * <ul>
 *   <li>오브젝트 스토리지 버킷: {@code {environment}-{baseBucketName}} (예: dev-audio)</li>
 *   <li>벡터 컬렉션: {@code {baseCollectionName}_{environment}} (예: knowledge_stage)</li>
 * </ul>
 *
 * @author Promotion Team
 * @since 1.0.0
 */
public final class StoreNames {

    private StoreNames() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static String bucketName(Environment environment, String baseBucketName) {
        if (environment == null) {
            throw new IllegalArgumentException("environment cannot be null");
        }
        if (baseBucketName == null || baseBucketName.isBlank()) {
            throw new IllegalArgumentException("baseBucketName cannot be null or blank");
        }
        return environment.value() + "-" + baseBucketName;
    }

    public static String collectionName(String baseCollectionName, Environment environment) {
        if (environment == null) {
            throw new IllegalArgumentException("environment cannot be null");
        }
        if (baseCollectionName == null || baseCollectionName.isBlank()) {
            throw new IllegalArgumentException("baseCollectionName cannot be null or blank");
        }
        return baseCollectionName + "_" + environment.value();
    }
}
