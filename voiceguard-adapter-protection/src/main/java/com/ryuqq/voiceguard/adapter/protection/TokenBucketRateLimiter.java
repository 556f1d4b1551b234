package com.ryuqq.voiceguard.adapter.protection;

import com.ryuqq.voiceguard.core.protection.RateLimiter;
import com.ryuqq.voiceguard.core.protection.RateLimiterConfig;
import com.ryuqq.voiceguard.core.time.Clock;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Token Bucket 기반 Rate Limiter.
 *
 * <p>토큰은 ratePerSecond 속도로 burstCapacity까지 충전되며, 요청 1건이 토큰 1개를 소비합니다.
 * 버킷은 가득 찬 상태로 시작합니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * 확인 시점마다:
 *   elapsed = now - lastRefillTime
 *   tokens  = min(capacity, tokens + elapsed * ratePerSecond)
 *   lastRefillTime = now
 *   tokens >= 1 → tokens -= 1, 허용
 *   tokens &lt; 1  → 거부 또는 (1 - tokens) / ratePerSecond 만큼 대기 후 재확인
 * </pre>
 *
 * <p><strong>동시성 제어:</strong></p>
 * <ul>
 *   <li>tokens와 lastRefillTime의 read-modify-write는 하나의 잠금으로 직렬화됩니다.</li>
 *   <li>블로킹 대기는 잠금을 해제한 뒤 호출 스레드에서만 일어납니다.</li>
 * </ul>
 *
 * @author VoiceGuard Team
 * @since 1.0.0
 */
public final class TokenBucketRateLimiter implements RateLimiter {

    private static final double NANOS_PER_SECOND = 1_000_000_000.0;

    private final RateLimiterConfig config;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private double tokens;
    private long lastRefillNanos;

    /**
     * 시스템 시계를 사용하는 생성자.
     *
     * @param config Rate Limiter 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public TokenBucketRateLimiter(RateLimiterConfig config) {
        this(config, Clock.system());
    }

    /**
     * 생성자 (Clock 주입).
     *
     * @param config Rate Limiter 설정
     * @param clock 시간 소스
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public TokenBucketRateLimiter(RateLimiterConfig config, Clock clock) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.config = config;
        this.clock = clock;
        this.tokens = config.burstCapacity();
        this.lastRefillNanos = clock.nanoTime();
    }

    @Override
    public boolean tryAcquire() {
        return reserveOrWaitNanos() == 0L;
    }

    @Override
    public boolean tryAcquire(long timeoutMs) throws InterruptedException {
        if (timeoutMs <= 0) {
            return tryAcquire();
        }
        long deadlineNanos = clock.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);

        while (true) {
            long waitNanos = reserveOrWaitNanos();
            if (waitNanos == 0L) {
                return true;
            }
            if (clock.nanoTime() + waitNanos > deadlineNanos) {
                return false;
            }
            clock.sleep(toMillisCeil(waitNanos));
        }
    }

    @Override
    public void acquire() throws InterruptedException {
        while (true) {
            long waitNanos = reserveOrWaitNanos();
            if (waitNanos == 0L) {
                return;
            }
            clock.sleep(toMillisCeil(waitNanos));
        }
    }

    @Override
    public double availableTokens() {
        lock.lock();
        try {
            refill(clock.nanoTime());
            return tokens;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public RateLimiterConfig getConfig() {
        return config;
    }

    /**
     * 토큰 1개 소비 시도.
     *
     * @return 0: 소비 성공, 양수: 토큰 1개가 충전될 때까지 남은 시간 (나노초)
     */
    private long reserveOrWaitNanos() {
        lock.lock();
        try {
            refill(clock.nanoTime());
            if (tokens >= 1.0) {
                tokens -= 1.0;
                return 0L;
            }
            double missing = 1.0 - tokens;
            return Math.max(1L, (long) Math.ceil(missing / config.ratePerSecond() * NANOS_PER_SECOND));
        } finally {
            lock.unlock();
        }
    }

    /**
     * 경과 시간만큼 토큰 충전 (잠금 보유 상태에서만 호출).
     *
     * @param nowNanos 현재 시각 (나노초)
     */
    private void refill(long nowNanos) {
        long elapsed = nowNanos - lastRefillNanos;
        if (elapsed <= 0) {
            return;
        }
        tokens = Math.min(config.burstCapacity(), tokens + elapsed * config.ratePerSecond() / NANOS_PER_SECOND);
        lastRefillNanos = nowNanos;
    }

    private static long toMillisCeil(long nanos) {
        return Math.max(1L, (nanos + 999_999L) / 1_000_000L);
    }
}
