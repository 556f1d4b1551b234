package com.ryuqq.voiceguard.core.protection;

/**
 * Circuit Breaker SPI.
 *
 * <p>원격 엔드포인트의 연속 실패를 추적하고, 임계값 도달 시 빠르게 실패(Fail-Fast)하여
 * 장애 중인 엔드포인트로 불필요한 호출이 나가지 않도록 합니다.</p>
 *
 * <p><strong>Circuit Breaker 패턴:</strong></p>
 * <ul>
 *   <li>CLOSED: 정상 동작, 연속 실패 횟수 추적</li>
 *   <li>OPEN: 요청 차단, 빠른 실패</li>
 *   <li>HALF_OPEN: 시험 요청으로 복구 테스트</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * CircuitBreaker cb = registry.forEndpoint("deepfake");
 *
 * if (!cb.allow()) {
 *     // Circuit Breaker OPEN 상태
 *     return RequestOutcome.breakerOpen(...);
 * }
 *
 * try {
 *     TransportResponse response = transport.send(request, timeoutMs);
 *     cb.recordSuccess();
 *     return response;
 * } catch (TransportException e) {
 *     cb.recordFailure(e);
 *     throw e;
 * }
 * }</pre>
 *
 * <p>호출자는 시도마다 {@link #allow()}를 먼저 확인하고, 결과를 정확히 한 번
 * {@link #recordSuccess()} 또는 {@link #recordFailure(Throwable)}로 보고해야 합니다.</p>
 *
 * @author VoiceGuard Team
 * @since 1.0.0
 */
public interface CircuitBreaker {

    /**
     * Circuit Breaker 이름 (보통 엔드포인트 이름).
     *
     * @return 이름
     */
    String name();

    /**
     * Circuit Breaker 통과 허용 여부 확인.
     *
     * <p>상태를 변경하지 않는 순수 조회입니다. OPEN 상태에서 복구 타임아웃이 지났다면
     * HALF_OPEN으로 간주하여 true를 반환합니다.</p>
     *
     * <ul>
     *   <li>CLOSED: 항상 true 반환 (정상 통과)</li>
     *   <li>OPEN: 복구 타임아웃 전이면 false 반환 (즉시 차단)</li>
     *   <li>HALF_OPEN: true 반환 (시험 요청 통과)</li>
     * </ul>
     *
     * @return true: 요청 통과 허용, false: 요청 차단
     */
    boolean allow();

    /**
     * 실행 성공 기록.
     *
     * <ul>
     *   <li>CLOSED: 연속 실패 카운터 리셋</li>
     *   <li>HALF_OPEN: 연속 성공 임계값 도달 시 CLOSED로 전이</li>
     * </ul>
     */
    void recordSuccess();

    /**
     * 실행 실패 기록.
     *
     * <ul>
     *   <li>CLOSED: 연속 실패 임계값 도달 시 OPEN으로 전이</li>
     *   <li>HALF_OPEN: 즉시 OPEN으로 전이</li>
     * </ul>
     *
     * @param throwable 발생한 예외 (null 가능)
     */
    void recordFailure(Throwable throwable);

    /**
     * 현재 Circuit Breaker 상태 조회.
     *
     * <p>복구 타임아웃이 지난 OPEN 상태는 HALF_OPEN으로 보고됩니다.</p>
     *
     * @return CLOSED, OPEN, HALF_OPEN 중 하나
     */
    CircuitBreakerState getState();

    /**
     * CLOSED에서 OPEN으로 전이한 누적 횟수.
     *
     * @return OPEN 전이 횟수 (HALF_OPEN에서 재차단된 경우 포함)
     */
    long openCount();

    /**
     * Circuit Breaker를 CLOSED 상태로 강제 리셋.
     *
     * <p>수동 복구 또는 테스트 목적으로 사용됩니다.</p>
     */
    void reset();
}
