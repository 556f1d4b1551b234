package com.ryuqq.voiceguard.application.executor;

/**
 * RequestExecutor 설정.
 *
 * @param perRequestTimeoutMs Transport 호출 1회당 타임아웃 (밀리초, 양수)
 * @param admissionTimeoutMs Rate Limiter 허가 대기 한도 (밀리초, 0이면 대기하지 않고 즉시 RATE_LIMITED)
 * @author VoiceGuard Team
 * @since 1.0.0
 */
public record ExecutorConfig(long perRequestTimeoutMs, long admissionTimeoutMs) {

    /**
     * 기본 설정: 요청 타임아웃 30초, 허가 대기 없음.
     */
    public ExecutorConfig() {
        this(30_000L, 0L);
    }

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ExecutorConfig {
        if (perRequestTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "perRequestTimeoutMs must be positive (current: " + perRequestTimeoutMs + ")"
            );
        }
        if (admissionTimeoutMs < 0) {
            throw new IllegalArgumentException(
                "admissionTimeoutMs cannot be negative (current: " + admissionTimeoutMs + ")"
            );
        }
    }

    public ExecutorConfig withPerRequestTimeoutMs(long perRequestTimeoutMs) {
        return new ExecutorConfig(perRequestTimeoutMs, admissionTimeoutMs);
    }

    public ExecutorConfig withAdmissionTimeoutMs(long admissionTimeoutMs) {
        return new ExecutorConfig(perRequestTimeoutMs, admissionTimeoutMs);
    }
}
