package com.ryuqq.promotion.core.validation;

import com.ryuqq.promotion.core.model.Environment;

import java.util.ArrayList;
import java.util.List;

/**
 * 허용된 승격 경로 (source → target 순서쌍).
 *
 * <p>문자열 표기: {@code "dev->stage"}. 목록은 쉼표로 구분합니다
 * (예: {@code "dev->stage,stage->prod,dev->prod"}).</p>
 *
 * @param source 원본 환경
 * @param target 대상 환경
 *
 * @author Promotion Team
 * @since 1.0.0
 */
public record PromotionPath(Environment source, Environment target) {

    private static final String ARROW = "->";

    public PromotionPath {
        if (source == null || target == null) {
            throw new IllegalArgumentException("source and target cannot be null");
        }
    }

    public static PromotionPath of(Environment source, Environment target) {
        return new PromotionPath(source, target);
    }

    /**
     * "dev->stage" 형식 문자열 해석.
     *
     * @param raw 경로 문자열
     * @return 경로
     * @throws IllegalArgumentException 형식이 잘못되었거나 환경 값이 유효하지 않은 경우
     */
    public static PromotionPath parse(String raw) {
        if (raw == null || !raw.contains(ARROW)) {
            throw new IllegalArgumentException("Promotion path must look like 'dev->stage' (current: " + raw + ")");
        }
        String[] parts = raw.split(ARROW, -1);
        if (parts.length != 2) {
            throw new IllegalArgumentException("Promotion path must look like 'dev->stage' (current: " + raw + ")");
        }
        return new PromotionPath(Environment.of(parts[0]), Environment.of(parts[1]));
    }

    /**
     * 쉼표 구분 경로 목록 해석 (순서 유지, 빈 항목 무시).
     *
     * @param raw 경로 목록 문자열
     * @return 경로 목록
     */
    public static List<PromotionPath> parseList(String raw) {
        List<PromotionPath> paths = new ArrayList<>();
        if (raw == null || raw.isBlank()) {
            return paths;
        }
        for (String token : raw.split(",")) {
            if (!token.isBlank()) {
                paths.add(parse(token.trim()));
            }
        }
        return paths;
    }

    /**
     * 기본 허용 경로: dev→stage, stage→prod, dev→prod.
     *
     * @return 기본 경로 목록
     */
    public static List<PromotionPath> defaults() {
        return List.of(
            new PromotionPath(Environment.DEV, Environment.STAGE),
            new PromotionPath(Environment.STAGE, Environment.PROD),
            new PromotionPath(Environment.DEV, Environment.PROD)
        );
    }

    @Override
    public String toString() {
        return source.value() + ARROW + target.value();
    }
}
