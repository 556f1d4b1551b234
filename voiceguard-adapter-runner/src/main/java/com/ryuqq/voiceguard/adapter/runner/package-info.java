/**
 * Runner 어댑터 패키지.
 *
 * <p>배치 실행과 클라이언트 조립을 담당합니다.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.voiceguard.adapter.runner.WorkerPoolBatchCoordinator} - 고정 워커 풀 배치 실행</li>
 *   <li>{@link com.ryuqq.voiceguard.adapter.runner.ResilienceSettings} - 환경 변수 기반 설정</li>
 *   <li>{@link com.ryuqq.voiceguard.adapter.runner.ResilientClient} - Rate Limiter, Circuit Breaker, Executor 조립</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.ryuqq.voiceguard.adapter.runner;
