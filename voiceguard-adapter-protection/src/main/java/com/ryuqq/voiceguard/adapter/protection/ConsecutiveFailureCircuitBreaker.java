package com.ryuqq.voiceguard.adapter.protection;

import com.ryuqq.voiceguard.core.protection.CircuitBreaker;
import com.ryuqq.voiceguard.core.protection.CircuitBreakerConfig;
import com.ryuqq.voiceguard.core.protection.CircuitBreakerState;
import com.ryuqq.voiceguard.core.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 연속 실패 횟수 기반 Circuit Breaker.
 *
 * <p>상태는 (state, 카운터, openedAt)만으로 결정되며 백그라운드 타이머가 없습니다.
 * OPEN → HALF_OPEN 전이는 다음 호출 시점에 지연 평가됩니다.</p>
 *
 * <p><strong>상태 전이:</strong></p>
 * <ul>
 *   <li>CLOSED: 실패 시 consecutiveFailures 증가, failureThreshold 도달 시 OPEN.
 *       성공 시 consecutiveFailures = 0</li>
 *   <li>OPEN: 모든 호출 거부. now - openedAt ≥ recoveryTimeout이면 HALF_OPEN으로 간주</li>
 *   <li>HALF_OPEN: 호출 허용(시험 요청). 성공 시 consecutiveSuccesses 증가,
 *       successThreshold 도달 시 CLOSED. 실패 1회면 즉시 OPEN (openedAt 갱신)</li>
 * </ul>
 *
 * <p><strong>OPEN 상태에서의 결과 보고:</strong> OPEN 전이 이전에 통과한 호출이 뒤늦게
 * 결과를 보고하면 무시합니다. 차단 기간은 연장되지 않습니다.</p>
 *
 * <p><strong>동시성:</strong> 모든 상태 읽기/쓰기는 하나의 잠금 안에서 일어나며,
 * 잠금은 상태 갱신 동안만 보유합니다.</p>
 *
 * @author VoiceGuard Team
 * @since 1.0.0
 */
public final class ConsecutiveFailureCircuitBreaker implements CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(ConsecutiveFailureCircuitBreaker.class);

    private final String name;
    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final long recoveryTimeoutNanos;
    private final ReentrantLock lock = new ReentrantLock();

    private CircuitBreakerState state = CircuitBreakerState.CLOSED;
    private int consecutiveFailures;
    private int consecutiveSuccesses;
    private long openedAtNanos;
    private long openCount;

    /**
     * 시스템 시계를 사용하는 생성자.
     *
     * @param name Circuit Breaker 이름
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ConsecutiveFailureCircuitBreaker(String name, CircuitBreakerConfig config) {
        this(name, config, Clock.system());
    }

    /**
     * 생성자 (Clock 주입).
     *
     * @param name Circuit Breaker 이름
     * @param config 설정
     * @param clock 시간 소스
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ConsecutiveFailureCircuitBreaker(String name, CircuitBreakerConfig config, Clock clock) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.name = name;
        this.config = config;
        this.clock = clock;
        this.recoveryTimeoutNanos = TimeUnit.MILLISECONDS.toNanos(config.recoveryTimeoutMs());
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean allow() {
        return getState().permitsCalls();
    }

    @Override
    public CircuitBreakerState getState() {
        lock.lock();
        try {
            if (state == CircuitBreakerState.OPEN && recoveryElapsed(clock.nanoTime())) {
                return CircuitBreakerState.HALF_OPEN;
            }
            return state;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void recordSuccess() {
        lock.lock();
        try {
            promoteIfRecovered(clock.nanoTime());
            switch (state) {
                case CLOSED -> consecutiveFailures = 0;
                case HALF_OPEN -> {
                    consecutiveSuccesses++;
                    if (consecutiveSuccesses >= config.successThreshold()) {
                        transitionToClosed();
                    }
                }
                case OPEN -> log.debug("Circuit breaker '{}' ignored late success while OPEN", name);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void recordFailure(Throwable throwable) {
        lock.lock();
        try {
            long now = clock.nanoTime();
            promoteIfRecovered(now);
            switch (state) {
                case CLOSED -> {
                    consecutiveFailures++;
                    if (consecutiveFailures >= config.failureThreshold()) {
                        log.warn("Circuit breaker '{}' opening after {} consecutive failures",
                            name, consecutiveFailures);
                        transitionToOpen(now);
                    }
                }
                case HALF_OPEN -> {
                    log.warn("Circuit breaker '{}' reopening after failed trial request: {}",
                        name, throwable == null ? "unknown" : throwable.getMessage());
                    transitionToOpen(now);
                }
                case OPEN -> log.debug("Circuit breaker '{}' ignored late failure while OPEN", name);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long openCount() {
        lock.lock();
        try {
            return openCount;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void reset() {
        lock.lock();
        try {
            transitionToClosed();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 현재 연속 실패 횟수 (CLOSED 상태에서 의미 있음).
     *
     * @return 연속 실패 횟수
     */
    public int consecutiveFailures() {
        lock.lock();
        try {
            return consecutiveFailures;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 현재 연속 성공 횟수 (HALF_OPEN 상태에서 의미 있음).
     *
     * @return 연속 성공 횟수
     */
    public int consecutiveSuccesses() {
        lock.lock();
        try {
            return consecutiveSuccesses;
        } finally {
            lock.unlock();
        }
    }

    public CircuitBreakerConfig getConfig() {
        return config;
    }

    private boolean recoveryElapsed(long nowNanos) {
        return nowNanos - openedAtNanos >= recoveryTimeoutNanos;
    }

    private void promoteIfRecovered(long nowNanos) {
        if (state == CircuitBreakerState.OPEN && recoveryElapsed(nowNanos)) {
            state = CircuitBreakerState.HALF_OPEN;
            consecutiveSuccesses = 0;
            log.info("Circuit breaker '{}' entering HALF_OPEN state", name);
        }
    }

    private void transitionToOpen(long nowNanos) {
        state = CircuitBreakerState.OPEN;
        openedAtNanos = nowNanos;
        consecutiveFailures = 0;
        consecutiveSuccesses = 0;
        openCount++;
    }

    private void transitionToClosed() {
        if (state != CircuitBreakerState.CLOSED) {
            log.info("Circuit breaker '{}' closing after successful recovery", name);
        }
        state = CircuitBreakerState.CLOSED;
        consecutiveFailures = 0;
        consecutiveSuccesses = 0;
    }
}
