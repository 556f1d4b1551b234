package com.ryuqq.voiceguard.core.outcome;

/**
 * 논리 요청의 종료 사유.
 *
 * <p>닫힌 열거형이므로 호출자는 switch로 모든 사유를 빠짐없이 처리할 수 있습니다.</p>
 *
 * <p><strong>분류:</strong></p>
 * <ul>
 *   <li>성공: {@link #SUCCESS}</li>
 *   <li>실패: {@link #MAX_RETRIES_EXCEEDED}, {@link #FATAL_CLIENT_ERROR}</li>
 *   <li>거부: {@link #BREAKER_OPEN}, {@link #RATE_LIMITED} (호출자가 재큐잉 여부 결정)</li>
 *   <li>취소: {@link #CANCELLED}</li>
 * </ul>
 *
 * @author VoiceGuard Team
 * @since 1.0.0
 */
public enum TerminalReason {

    /**
     * 2xx 응답 수신.
     */
    SUCCESS,

    /**
     * 재시도 가능한 실패가 maxAttempts까지 지속됨.
     */
    MAX_RETRIES_EXCEEDED,

    /**
     * 재시도 불가능한 실패 (429를 제외한 4xx 등).
     */
    FATAL_CLIENT_ERROR,

    /**
     * Circuit Breaker가 OPEN 상태라 호출하지 않음.
     */
    BREAKER_OPEN,

    /**
     * Rate Limiter가 요청을 허용하지 않음.
     */
    RATE_LIMITED,

    /**
     * 외부 취소 신호를 관측함.
     */
    CANCELLED;

    /**
     * 실패 사유인지 확인 (재시도 소진 또는 치명적 오류).
     *
     * @return 실패 사유이면 true
     */
    public boolean isFailure() {
        return this == MAX_RETRIES_EXCEEDED || this == FATAL_CLIENT_ERROR;
    }

    /**
     * 보호 장치에 의한 거부 사유인지 확인.
     *
     * @return BREAKER_OPEN 또는 RATE_LIMITED이면 true
     */
    public boolean isRejection() {
        return this == BREAKER_OPEN || this == RATE_LIMITED;
    }
}
