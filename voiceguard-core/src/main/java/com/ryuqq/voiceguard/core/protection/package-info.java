/**
 * Protection SPI (Service Provider Interface) 패키지.
 *
 * <p>원격 음성 사기 탐지 API 호출을 보호하는 Rate Limiter와 Circuit Breaker의
 * 확장점을 정의합니다.</p>
 *
 * <h2>Protection 체인 순서</h2>
 *
 * <p>RequestExecutor는 시도마다 다음 순서로 보호 장치를 적용합니다:</p>
 * <pre>
 * 1. RateLimiter      → 토큰 없으면 RATE_LIMITED
 * 2. CircuitBreaker   → OPEN 상태면 BREAKER_OPEN
 * 3. Transport        → 실제 호출 (타임아웃 적용)
 * 4. CircuitBreaker   → 성공/실패 기록
 * 5. RetryPolicy      → 재시도 여부 및 backoff 결정
 * </pre>
 *
 * <h2>동시성 규칙</h2>
 * <ul>
 *   <li>구현체는 공유 상태를 자신의 메서드를 통해서만 변경합니다.</li>
 *   <li>잠금은 상태 갱신에만 사용하며, 대기나 I/O 중에는 잠금을 보유하지 않습니다.</li>
 * </ul>
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>adapter-protection 모듈: {@code TokenBucketRateLimiter}, {@code ConsecutiveFailureCircuitBreaker}</li>
 *   <li>{@code noop} 하위 패키지: 항상 허용하는 NoOp 구현</li>
 * </ul>
 *
 * @author VoiceGuard Team
 * @since 1.0.0
 * @see com.ryuqq.voiceguard.core.protection.RateLimiter
 * @see com.ryuqq.voiceguard.core.protection.CircuitBreaker
 * @see com.ryuqq.voiceguard.core.protection.noop
 */
package com.ryuqq.voiceguard.core.protection;
