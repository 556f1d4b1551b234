package com.ryuqq.voiceguard.core.metrics;

import com.ryuqq.voiceguard.core.protection.CircuitBreakerState;

import java.util.Map;
import java.util.TreeMap;

/**
 * 헬스 스냅샷.
 *
 * <p>circuitBreakerState는 엔드포인트별 상태 중 가장 나쁜 상태입니다
 * (OPEN &gt; HALF_OPEN &gt; CLOSED). Circuit Breaker가 하나도 없으면 CLOSED입니다.</p>
 *
 * @param status 전체 상태
 * @param circuitBreakerState 대표 Circuit Breaker 상태
 * @param breakers 엔드포인트별 Circuit Breaker 상태
 * @author VoiceGuard Team
 * @since 1.0.0
 */
public record HealthSnapshot(
    Status status,
    CircuitBreakerState circuitBreakerState,
    Map<String, CircuitBreakerState> breakers
) {

    /**
     * 전체 상태.
     */
    public enum Status {
        /** 모든 Circuit Breaker가 CLOSED. */
        HEALTHY,
        /** 하나 이상의 Circuit Breaker가 OPEN 또는 HALF_OPEN. */
        DEGRADED
    }

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException null 값이 있는 경우
     */
    public HealthSnapshot {
        if (status == null || circuitBreakerState == null || breakers == null) {
            throw new IllegalArgumentException("status, circuitBreakerState and breakers cannot be null");
        }
        breakers = Map.copyOf(breakers);
    }

    /**
     * 엔드포인트별 상태로부터 스냅샷 생성.
     *
     * @param states 엔드포인트별 Circuit Breaker 상태
     * @return HealthSnapshot 인스턴스
     */
    public static HealthSnapshot from(Map<String, CircuitBreakerState> states) {
        CircuitBreakerState worst = CircuitBreakerState.CLOSED;
        for (CircuitBreakerState state : states.values()) {
            if (state == CircuitBreakerState.OPEN) {
                worst = CircuitBreakerState.OPEN;
                break;
            }
            if (state == CircuitBreakerState.HALF_OPEN) {
                worst = CircuitBreakerState.HALF_OPEN;
            }
        }
        Status status = worst == CircuitBreakerState.CLOSED ? Status.HEALTHY : Status.DEGRADED;
        return new HealthSnapshot(status, worst, new TreeMap<>(states));
    }

    @Override
    public Map<String, CircuitBreakerState> breakers() {
        return new TreeMap<>(breakers);
    }
}
