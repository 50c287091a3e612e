package com.ryuqq.promotion.application.copy;

import java.util.concurrent.atomic.AtomicReference;

/**
 * 실행 중인 승격의 협조적 중단 신호.
 *
 * <p>운영자의 명시적 중단 요청으로만 설정됩니다. 이미 진행 중인 항목은 끝까지 처리되고,
 * 아직 시작하지 않은 항목은 건너뜁니다.</p>
 *
 * @author Promotion Team
 * @since 1.0.0
 */
public final class AbortSignal {

    private final AtomicReference<String> reason = new AtomicReference<>();

    /**
     * 중단 요청. 최초 사유만 유지됩니다.
     *
     * @param reason 중단 사유 (null이면 "aborted by operator")
     * @return 이번 호출로 중단 상태가 된 경우 true
     */
    public boolean abort(String reason) {
        String value = (reason == null || reason.isBlank()) ? "aborted by operator" : reason;
        return this.reason.compareAndSet(null, value);
    }

    public boolean isAborted() {
        return reason.get() != null;
    }

    public String getReasonOrNull() {
        return reason.get();
    }
}
