package com.ryuqq.voiceguard.core.time;

/**
 * 시간 소스 및 대기 추상화.
 *
 * <p>Rate Limiter의 토큰 충전, Circuit Breaker의 복구 타임아웃, Retry backoff 대기가
 * 모두 이 인터페이스를 통해 시간을 읽고 대기합니다. 테스트에서는 시뮬레이션 시계로
 * 교체하여 결정적으로 검증할 수 있습니다.</p>
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>{@link #nanoTime()}은 단조 증가해야 합니다 (벽시계 시간이 아님).</li>
 *   <li>{@link #sleep(long)}은 호출한 스레드만 블로킹해야 합니다.</li>
 *   <li>구현체는 thread-safe해야 합니다.</li>
 * </ul>
 *
 * @author VoiceGuard Team
 * @since 1.0.0
 */
public interface Clock {

    /**
     * 단조 증가 시간 조회.
     *
     * @return 임의 기준점으로부터의 경과 시간 (나노초)
     */
    long nanoTime();

    /**
     * 현재 스레드를 지정된 시간 동안 대기시킵니다.
     *
     * @param millis 대기 시간 (밀리초, 0 이하이면 즉시 반환)
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    void sleep(long millis) throws InterruptedException;

    /**
     * 시스템 시계 반환.
     *
     * @return {@link System#nanoTime()}과 {@link Thread#sleep(long)} 기반 Clock
     */
    static Clock system() {
        return SystemClock.INSTANCE;
    }
}
