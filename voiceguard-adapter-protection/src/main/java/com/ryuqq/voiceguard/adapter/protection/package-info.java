/**
 * Protection SPI 구현 패키지.
 *
 * <p>core 모듈의 {@code RateLimiter}, {@code CircuitBreaker} SPI를 외부 라이브러리 없이 구현합니다.
 * 두 구현 모두 {@code Clock}을 주입받아 시뮬레이션 시계로 검증할 수 있습니다.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.voiceguard.adapter.protection.TokenBucketRateLimiter} - Token Bucket 기반 Rate Limiter</li>
 *   <li>{@link com.ryuqq.voiceguard.adapter.protection.ConsecutiveFailureCircuitBreaker} - 연속 실패 기반 Circuit Breaker</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.ryuqq.voiceguard.adapter.protection;
