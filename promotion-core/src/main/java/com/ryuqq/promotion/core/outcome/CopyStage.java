package com.ryuqq.promotion.core.outcome;

/**
 * 항목 복사 실패 단계.
 *
 * <p>벡터 복사는 실패해도 항목 실패가 아니므로 단계에 포함되지 않습니다.</p>
 *
 * @author Promotion Team
 * @since 1.0.0
 */
public enum CopyStage {

    /**
     * 오브젝트 스토리지 페이로드 읽기/쓰기. 레코드는 생성되지 않음.
     */
    PAYLOAD,

    /**
     * 대상 환경 레코드 저장.
     */
    RECORD,

    /**
     * 항목별 시간 제한 초과.
     */
    TIMEOUT,

    /**
     * 운영자 중단 요청으로 시작하지 않음.
     */
    ABORTED,

    /**
     * 분류되지 않은 예외.
     */
    UNEXPECTED
}
