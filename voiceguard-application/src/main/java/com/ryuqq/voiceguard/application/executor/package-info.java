/**
 * 요청 실행 패키지.
 *
 * <p>{@link com.ryuqq.voiceguard.application.executor.RequestExecutor}는 Rate Limiter, Circuit Breaker,
 * Transport, 재시도 정책을 하나의 시도 루프로 조합합니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.voiceguard.application.executor;
