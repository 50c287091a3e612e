package com.ryuqq.promotion.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * 배포 환경.
 *
 * <p>각 환경은 서로 격리된 저장소(관계형 저장소, 오브젝트 스토리지, 벡터 인덱스)를 가지며,
 * 승격(promotion)은 항상 한 환경에서 다른 환경으로의 단방향 복사입니다.</p>
 *
 * <p><strong>허용 값:</strong> dev, test, stage, prod (고정 집합)</p>
 *
 * @author Promotion Team
 * @since 1.0.0
 */
public enum Environment {

    DEV("dev"),
    TEST("test"),
    STAGE("stage"),
    PROD("prod");

    private final String value;

    Environment(String value) {
        this.value = value;
    }

    /**
     * 환경 식별 문자열 조회 (저장소 네이밍에 사용).
     *
     * @return 소문자 환경 값 (예: "dev")
     */
    public String value() {
        return value;
    }

    /**
     * 문자열을 환경으로 해석.
     *
     * <p>대소문자와 앞뒤 공백은 무시합니다. 이 메서드는 예외를 던지지 않습니다.</p>
     *
     * @param raw 환경 문자열 (null 가능)
     * @return 해석된 환경, 고정 집합에 없으면 empty
     */
    public static Optional<Environment> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (Environment environment : values()) {
            if (environment.value.equals(normalized)) {
                return Optional.of(environment);
            }
        }
        return Optional.empty();
    }

    /**
     * 문자열을 환경으로 변환.
     *
     * @param raw 환경 문자열
     * @return 환경
     * @throws IllegalArgumentException 고정 집합에 없는 값인 경우
     */
    public static Environment of(String raw) {
        return parse(raw).orElseThrow(() ->
            new IllegalArgumentException("Unknown environment: " + raw + " (allowed: dev, test, stage, prod)"));
    }

    @Override
    public String toString() {
        return value;
    }
}
