package com.ryuqq.voiceguard.core.retry;

/**
 * 재시도 설정.
 *
 * <p>기본값: maxAttempts=4, baseDelayMs=1000, maxDelayMs=30000</p>
 *
 * @param maxAttempts 최대 시도 횟수 (첫 시도 포함, 1 이상)
 * @param baseDelayMs 첫 재시도 전 최대 지연 (밀리초, 0 이상)
 * @param maxDelayMs 지연 상한 (밀리초, baseDelayMs 이상)
 * @author VoiceGuard Team
 * @since 1.0.0
 */
public record RetryConfig(int maxAttempts, long baseDelayMs, long maxDelayMs) {

    /**
     * 기본 설정 생성자.
     */
    public RetryConfig() {
        this(4, 1000, 30_000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RetryConfig {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException(
                "maxAttempts must be >= 1 (current: " + maxAttempts + ")"
            );
        }
        if (baseDelayMs < 0) {
            throw new IllegalArgumentException(
                "baseDelayMs cannot be negative (current: " + baseDelayMs + ")"
            );
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
    }

    /**
     * maxAttempts만 변경한 새 인스턴스 생성.
     */
    public RetryConfig withMaxAttempts(int maxAttempts) {
        return new RetryConfig(maxAttempts, baseDelayMs, maxDelayMs);
    }

    /**
     * baseDelayMs와 maxDelayMs를 변경한 새 인스턴스 생성.
     */
    public RetryConfig withDelays(long baseDelayMs, long maxDelayMs) {
        return new RetryConfig(maxAttempts, baseDelayMs, maxDelayMs);
    }
}
