package com.ryuqq.voiceguard.application.retry;

import com.ryuqq.voiceguard.core.retry.RetryConfig;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential Backoff with Full Jitter 계산기.
 *
 * <p>재시도 간격의 상한을 지수적으로 증가시키고, 실제 대기 시간은 0과 상한 사이에서
 * 균등하게 뽑습니다. 여러 워커가 같은 순간에 실패해도 재시도 시점이 흩어집니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * ceiling = min(baseDelay * 2^(attemptCount-1), maxDelay)
 * delay   = uniform(0, ceiling)
 * </pre>
 *
 * <p><strong>예시 (baseDelay=1000ms, maxDelay=30000ms):</strong></p>
 * <ul>
 *   <li>attemptCount=1: 0-1000ms</li>
 *   <li>attemptCount=2: 0-2000ms</li>
 *   <li>attemptCount=3: 0-4000ms</li>
 *   <li>attemptCount=10: 0-30000ms (상한 512000ms가 maxDelay로 제한됨)</li>
 * </ul>
 *
 * <p>난수 소스는 {@link DoubleSupplier}로 주입할 수 있으며, [0.0, 1.0) 범위의 값을 반환해야 합니다.</p>
 *
 * @author VoiceGuard Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final DoubleSupplier random;

    /**
     * 기본 설정으로 생성.
     *
     * <p>기본값: baseDelay=1000ms, maxDelay=30000ms</p>
     */
    public BackoffCalculator() {
        this(new RetryConfig());
    }

    /**
     * RetryConfig의 지연 설정으로 생성.
     *
     * @param config 재시도 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public BackoffCalculator(RetryConfig config) {
        this(requireConfig(config).baseDelayMs(), config.maxDelayMs(),
            () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * 커스텀 설정으로 생성.
     *
     * @param baseDelayMs 기본 지연 시간 (밀리초, 0 이상)
     * @param maxDelayMs 최대 지연 시간 (밀리초, baseDelayMs 이상이어야 함)
     * @param random [0.0, 1.0) 난수 소스
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BackoffCalculator(long baseDelayMs, long maxDelayMs, DoubleSupplier random) {
        if (baseDelayMs < 0) {
            throw new IllegalArgumentException(
                "baseDelayMs cannot be negative (current: " + baseDelayMs + ")"
            );
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }

        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.random = random;
    }

    /**
     * 재시도 지연 시간 계산.
     *
     * @param attemptCount 방금 실패한 시도 번호 (1부터 시작)
     * @return 재시도 전 대기 시간 (밀리초, 0 이상 ceiling 이하)
     * @throws IllegalArgumentException attemptCount가 양수가 아닌 경우
     */
    public long calculate(int attemptCount) {
        long ceiling = ceiling(attemptCount);
        double sample = random.getAsDouble();
        if (sample < 0.0 || sample > 1.0 || Double.isNaN(sample)) {
            throw new IllegalStateException("random must return a value in [0.0, 1.0] (current: " + sample + ")");
        }
        return Math.min((long) (ceiling * sample), ceiling);
    }

    /**
     * 지연 시간 상한 계산 (Jitter 적용 전).
     *
     * @param attemptCount 방금 실패한 시도 번호 (1부터 시작)
     * @return min(baseDelay * 2^(attemptCount-1), maxDelay)
     * @throws IllegalArgumentException attemptCount가 양수가 아닌 경우
     */
    public long ceiling(int attemptCount) {
        if (attemptCount <= 0) {
            throw new IllegalArgumentException(
                "attemptCount must be positive (current: " + attemptCount + ")"
            );
        }

        // 시프트 결과가 maxDelay를 넘는지 먼저 비교해 overflow를 피함
        int shift = Math.min(attemptCount - 1, 62);
        if (baseDelayMs > (maxDelayMs >> shift)) {
            return maxDelayMs;
        }
        return Math.min(baseDelayMs << shift, maxDelayMs);
    }

    /**
     * 기본 지연 시간 조회.
     *
     * @return 기본 지연 시간 (밀리초)
     */
    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    /**
     * 최대 지연 시간 조회.
     *
     * @return 최대 지연 시간 (밀리초)
     */
    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    private static RetryConfig requireConfig(RetryConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        return config;
    }
}
