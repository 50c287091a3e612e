package com.ryuqq.promotion.core.detection;

import com.ryuqq.promotion.core.model.PromotableItem;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * 테스트/더미 데이터 패턴 탐지기.
 *
 * <p>테스트 데이터는 승격 적격 조건에서 제외되므로, 검수 전에 표시해 두어야 합니다.
 * 탐지는 대소문자를 구분하지 않으며, 처음 일치한 패턴을 사유로 반환합니다.</p>
 *
 * @author Promotion Team
 * @since 1.0.0
 */
public final class TestDataDetector {

    private static final List<String> DEFAULT_PATTERNS = List.of(
        // 일반 테스트 키워드
        "\\btest\\b",
        "\\bdemo\\b",
        "\\bdummy\\b",
        "\\bsample\\b",
        "\\bexample\\b",
        "\\bdebug\\b",
        "\\bfoo\\b",
        "\\bbar\\b",
        "\\bbaz\\b",
        "\\bqux\\b",

        // 테스트용 이름
        "john\\s*doe",
        "jane\\s*doe",
        "test\\s*user",
        "demo\\s*user",

        // 이메일
        "test@test\\.com",
        "test@example\\.com",
        "demo@.*",
        ".*@test\\..*",
        ".*@example\\..*",

        // 순번 패턴
        "^test\\d+$",
        "^user\\d+$",
        "^demo\\d+$",

        // 자리 표시 텍스트
        "lorem\\s*ipsum",
        "dolor\\s*sit\\s*amet",
        "asdf",
        "qwerty",
        "123456",

        // 개발 마커
        "dev-test",
        "staging-test",
        "qa-test"
    );

    private final List<Pattern> patterns;

    /**
     * 기본 패턴으로 생성.
     */
    public TestDataDetector() {
        this(DEFAULT_PATTERNS);
    }

    /**
     * 사용자 지정 패턴으로 생성.
     *
     * @param regexes 정규식 목록
     * @throws IllegalArgumentException regexes가 null인 경우
     */
    public TestDataDetector(List<String> regexes) {
        if (regexes == null) {
            throw new IllegalArgumentException("regexes cannot be null");
        }
        this.patterns = regexes.stream()
            .map(regex -> Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE))
            .toList();
    }

    /**
     * 텍스트 검사.
     *
     * @param text 검사할 텍스트 (null 가능)
     * @return 일치한 경우 사유 (예: "Matches test pattern: john\s*doe")
     */
    public Optional<String> detect(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String normalized = text.strip();
        for (Pattern pattern : patterns) {
            if (pattern.matcher(normalized).find()) {
                return Optional.of("Matches test pattern: " + pattern.pattern());
            }
        }
        return Optional.empty();
    }

    /**
     * 항목의 텍스트 필드 전체 검사.
     *
     * @param item 검사할 항목
     * @return 일치한 경우 필드명이 포함된 사유 (예: "Field 'title': Matches test pattern: \btest\b")
     */
    public Optional<String> inspect(PromotableItem item) {
        if (item == null) {
            throw new IllegalArgumentException("item cannot be null");
        }
        for (Map.Entry<String, String> field : item.textFields().entrySet()) {
            Optional<String> reason = detect(field.getValue());
            if (reason.isPresent()) {
                return Optional.of("Field '" + field.getKey() + "': " + reason.get());
            }
        }
        return Optional.empty();
    }
}
