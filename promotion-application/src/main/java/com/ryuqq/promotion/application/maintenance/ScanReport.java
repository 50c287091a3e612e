package com.ryuqq.promotion.application.maintenance;

import com.ryuqq.promotion.core.model.ContentKind;
import com.ryuqq.promotion.core.model.Environment;

/**
 * 테스트 데이터 스캔 결과.
 *
 * @param kind 콘텐츠 종류
 * @param environment 스캔한 환경
 * @param scanned 검사한 항목 수 (이미 표시된 항목 제외)
 * @param markedAsTest 이번 스캔에서 테스트 데이터로 표시한 항목 수
 * @param alreadyMarked 이미 테스트 데이터로 표시되어 있던 항목 수
 * @param errors 검사 또는 저장 중 오류가 발생한 항목 수
 * @author Promotion Team
 * @since 1.0.0
 */
public record ScanReport(
    ContentKind kind,
    Environment environment,
    int scanned,
    int markedAsTest,
    int alreadyMarked,
    int errors
) {
}
