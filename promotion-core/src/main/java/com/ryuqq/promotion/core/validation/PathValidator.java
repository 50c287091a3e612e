package com.ryuqq.promotion.core.validation;

import com.ryuqq.promotion.core.model.Environment;

import java.util.List;

/**
 * 승격 경로 검증기.
 *
 * <p>순수 함수입니다: 부수 효과가 없고, 결정적이며, 예외를 던지지 않습니다.</p>
 *
 * <p><strong>검증 순서:</strong></p>
 * <ol>
 *   <li>두 값 모두 환경 집합 {dev, test, stage, prod}에 속해야 함</li>
 *   <li>source != target</li>
 *   <li>설정에서 승격이 활성화되어 있어야 함</li>
 *   <li>(source, target)이 허용 목록에 있어야 함</li>
 * </ol>
 *
 * @author Promotion Team
 * @since 1.0.0
 */
public final class PathValidator {

    private final boolean promotionEnabled;
    private final List<PromotionPath> allowedPaths;

    /**
     * 생성자.
     *
     * @param promotionEnabled 승격 활성화 여부
     * @param allowedPaths 허용 경로 목록 (순서 유지)
     * @throws IllegalArgumentException allowedPaths가 null인 경우
     */
    public PathValidator(boolean promotionEnabled, List<PromotionPath> allowedPaths) {
        if (allowedPaths == null) {
            throw new IllegalArgumentException("allowedPaths cannot be null");
        }
        this.promotionEnabled = promotionEnabled;
        this.allowedPaths = List.copyOf(allowedPaths);
    }

    /**
     * 경로 검증.
     *
     * @param source 원본 환경 문자열 (null 가능)
     * @param target 대상 환경 문자열 (null 가능)
     * @return 검증 결과 (항상 non-null)
     */
    public PathValidation validate(String source, String target) {
        Environment sourceEnv = Environment.parse(source).orElse(null);
        Environment targetEnv = Environment.parse(target).orElse(null);
        if (sourceEnv == null || targetEnv == null) {
            return PathValidation.rejected(
                "Invalid environment (source: " + source + ", target: " + target
                    + "). Must be one of: dev, test, stage, prod");
        }

        if (sourceEnv == targetEnv) {
            return PathValidation.rejected("Source and target environments must be different");
        }

        if (!promotionEnabled) {
            return PathValidation.rejected("Promotion is disabled in settings");
        }

        PromotionPath requested = new PromotionPath(sourceEnv, targetEnv);
        if (!allowedPaths.contains(requested)) {
            return PathValidation.rejected(
                "Promotion path " + requested + " not allowed. Allowed: " + allowedPaths);
        }

        return PathValidation.allowed(sourceEnv, targetEnv);
    }

    /**
     * 경로 검증 (환경 타입 오버로드).
     *
     * @param source 원본 환경
     * @param target 대상 환경
     * @return 검증 결과
     */
    public PathValidation validate(Environment source, Environment target) {
        return validate(source == null ? null : source.value(), target == null ? null : target.value());
    }

    public boolean isPromotionEnabled() {
        return promotionEnabled;
    }

    public List<PromotionPath> getAllowedPaths() {
        return allowedPaths;
    }
}
