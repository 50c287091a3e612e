package com.ryuqq.promotion.core.model;

/**
 * 오브젝트 스토리지에 바이너리 페이로드를 가진 항목.
 *
 * <p>ItemCopier는 이 capability가 있는 항목에 대해서만 페이로드를 복사합니다.
 * 페이로드 복사는 대상 레코드 저장보다 먼저 수행됩니다.</p>
 *
 * @author Promotion Team
 * @since 1.0.0
 */
public interface HasPayload {

    /**
     * 페이로드 위치 (환경 접두사가 붙지 않은 기본 버킷명 + 오브젝트 키).
     *
     * @return 페이로드 위치
     */
    PayloadLocation payloadLocation();
}
