package com.ryuqq.voiceguard.core.protection;

/**
 * Circuit Breaker 상태.
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * CLOSED (정상)
 *   │
 *   ▼ (연속 실패 failureThreshold회)
 * OPEN (차단)
 *   │
 *   ▼ (recoveryTimeout 경과, 다음 호출 시점에 평가)
 * HALF_OPEN (반개방)
 *   │
 *   ├─► 연속 성공 successThreshold회 → CLOSED
 *   └─► 실패 1회 → OPEN
 * </pre>
 *
 * <p>종료 상태는 없으며 상태 머신은 무한히 순환합니다.</p>
 *
 * @author VoiceGuard Team
 * @since 1.0.0
 */
public enum CircuitBreakerState {

    /**
     * 정상 상태 (요청 통과).
     */
    CLOSED,

    /**
     * 차단 상태 (요청 즉시 거부).
     */
    OPEN,

    /**
     * 반개방 상태 (시험 요청 통과).
     */
    HALF_OPEN;

    /**
     * 요청 통과가 가능한 상태인지 확인.
     *
     * @return CLOSED 또는 HALF_OPEN이면 true
     */
    public boolean permitsCalls() {
        return this != OPEN;
    }
}
