package com.ryuqq.promotion.core.spi;

/**
 * 저장소 어댑터 장애.
 *
 * <p>SPI 구현체는 인프라 장애(연결 실패, 오브젝트 없음, 쓰기 거부 등)를 이 예외로 알립니다.
 * 항목 처리 중 발생한 경우 Orchestrator가 항목 단위 오류로 변환합니다.</p>
 *
 * @author Promotion Team
 * @since 1.0.0
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
