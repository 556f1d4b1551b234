package com.ryuqq.voiceguard.core.protection;

/**
 * Rate Limiter SPI.
 *
 * <p>초당 요청 시작 수를 제한하여 원격 API의 호출 한도를 지킵니다.
 * 하나의 클라이언트가 하나의 인스턴스를 소유하며, 모든 워커가 공유합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * RateLimiter limiter = ...;
 *
 * if (!limiter.tryAcquire()) {
 *     // Rate Limit 초과
 *     return RequestOutcome.rateLimited(...);
 * }
 *
 * // 요청 처리
 * TransportResponse response = transport.send(request, timeoutMs);
 * }</pre>
 *
 * @author VoiceGuard Team
 * @since 1.0.0
 */
public interface RateLimiter {

    /**
     * Rate Limiter 통과 허용 여부 확인 (비블로킹).
     *
     * <p>현재 Rate Limit 내에서 요청 처리가 가능한지 즉시 확인합니다.
     * 허용되면 토큰 1개를 소비하고, 허용되지 않으면 false를 반환하며 대기하지 않습니다.</p>
     *
     * @return true: 요청 허용, false: Rate Limit 초과
     */
    boolean tryAcquire();

    /**
     * Rate Limiter 통과 허용 여부 확인 (타임아웃 대기).
     *
     * <p>지정된 시간 안에 토큰을 얻을 수 있으면 대기 후 true를 반환합니다.
     * 시간 안에 토큰을 얻을 수 없으면 대기하지 않고 즉시 false를 반환합니다.</p>
     *
     * @param timeoutMs 최대 대기 시간 (밀리초), 0이면 {@link #tryAcquire()}와 동일
     * @return true: 요청 허용, false: 타임아웃
     * @throws InterruptedException 대기 중 인터럽트 발생
     */
    boolean tryAcquire(long timeoutMs) throws InterruptedException;

    /**
     * 토큰을 얻을 때까지 대기 (블로킹).
     *
     * <p>호출한 스레드만 대기하며, 다른 호출자는 영향을 받지 않습니다.</p>
     *
     * @throws InterruptedException 대기 중 인터럽트 발생
     */
    void acquire() throws InterruptedException;

    /**
     * 현재 사용 가능한 토큰 수 조회.
     *
     * <p>조회 시점까지의 충전분을 반영합니다. 토큰을 소비하지는 않습니다.</p>
     *
     * @return 사용 가능한 토큰 수 (0 이상, capacity 이하)
     */
    double availableTokens();

    /**
     * Rate Limiter 설정 정보 조회.
     *
     * @return Rate Limiter 설정 (초당 충전 속도, 버스트 용량)
     */
    RateLimiterConfig getConfig();
}
