package com.ryuqq.promotion.core.validation;

import com.ryuqq.promotion.core.model.Environment;

/**
 * 경로 검증 결과.
 *
 * <p>ok=true인 경우 source/target은 해석된 환경이며 reason은 null입니다.
 * ok=false인 경우 reason에 거부 사유가 담깁니다.</p>
 *
 * @param ok 허용 여부
 * @param reason 거부 사유 (ok=true이면 null)
 * @param source 해석된 원본 환경 (ok=false이면 null 가능)
 * @param target 해석된 대상 환경 (ok=false이면 null 가능)
 *
 * @author Promotion Team
 * @since 1.0.0
 */
public record PathValidation(boolean ok, String reason, Environment source, Environment target) {

    public static PathValidation allowed(Environment source, Environment target) {
        return new PathValidation(true, null, source, target);
    }

    public static PathValidation rejected(String reason) {
        return new PathValidation(false, reason, null, null);
    }
}
