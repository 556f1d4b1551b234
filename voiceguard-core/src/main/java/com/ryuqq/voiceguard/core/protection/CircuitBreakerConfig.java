package com.ryuqq.voiceguard.core.protection;

/**
 * Circuit Breaker 설정.
 *
 * <p>기본값은 failureThreshold=5, successThreshold=2, recoveryTimeoutMs=60000 입니다.</p>
 *
 * @param failureThreshold OPEN 전이까지의 연속 실패 횟수 (1 이상)
 * @param successThreshold HALF_OPEN에서 CLOSED 전이까지의 연속 성공 횟수 (1 이상)
 * @param recoveryTimeoutMs OPEN 유지 시간 (밀리초, 양수)
 * @author VoiceGuard Team
 * @since 1.0.0
 */
public record CircuitBreakerConfig(int failureThreshold, int successThreshold, long recoveryTimeoutMs) {

    /**
     * 기본 설정 생성자.
     */
    public CircuitBreakerConfig() {
        this(5, 2, 60_000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public CircuitBreakerConfig {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException(
                "failureThreshold must be >= 1 (current: " + failureThreshold + ")"
            );
        }
        if (successThreshold < 1) {
            throw new IllegalArgumentException(
                "successThreshold must be >= 1 (current: " + successThreshold + ")"
            );
        }
        if (recoveryTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "recoveryTimeoutMs must be positive (current: " + recoveryTimeoutMs + ")"
            );
        }
    }

    /**
     * failureThreshold만 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerConfig withFailureThreshold(int failureThreshold) {
        return new CircuitBreakerConfig(failureThreshold, successThreshold, recoveryTimeoutMs);
    }

    /**
     * successThreshold만 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerConfig withSuccessThreshold(int successThreshold) {
        return new CircuitBreakerConfig(failureThreshold, successThreshold, recoveryTimeoutMs);
    }

    /**
     * recoveryTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerConfig withRecoveryTimeoutMs(long recoveryTimeoutMs) {
        return new CircuitBreakerConfig(failureThreshold, successThreshold, recoveryTimeoutMs);
    }
}
