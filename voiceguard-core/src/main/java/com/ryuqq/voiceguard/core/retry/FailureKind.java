package com.ryuqq.voiceguard.core.retry;

/**
 * 실패 시도의 분류.
 *
 * @author VoiceGuard Team
 * @since 1.0.0
 */
public enum FailureKind {

    /**
     * 일시적 실패 (5xx, 429, 타임아웃, 연결 오류). 재시도 대상.
     */
    RETRYABLE,

    /**
     * 영구적 실패 (429 이외의 4xx 등). 재시도하지 않음.
     */
    FATAL,

    /**
     * Circuit Breaker 차단. 재시도하지 않고 호출자에게 보고.
     */
    BREAKER_OPEN,

    /**
     * Rate Limiter 거부. 재시도하지 않고 호출자에게 보고.
     */
    RATE_LIMITED
}
