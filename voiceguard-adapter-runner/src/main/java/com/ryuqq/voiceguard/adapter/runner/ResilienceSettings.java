package com.ryuqq.voiceguard.adapter.runner;

import com.ryuqq.voiceguard.application.executor.ExecutorConfig;
import com.ryuqq.voiceguard.core.protection.CircuitBreakerConfig;
import com.ryuqq.voiceguard.core.protection.RateLimiterConfig;
import com.ryuqq.voiceguard.core.retry.RetryConfig;

import java.util.Map;

/**
 * 클라이언트 전체 복원력 설정 (불변 record).
 *
 * <p>환경 변수에서 읽어 구성 요소별 설정 record로 나눠 전달합니다.
 * 각 값의 범위는 해당 구성 요소 설정의 검증 규칙을 그대로 따릅니다.</p>
 *
 * <p><strong>환경 변수 (괄호 안은 기본값):</strong></p>
 * <ul>
 *   <li>VOICEGUARD_RATE_PER_SECOND (10)</li>
 *   <li>VOICEGUARD_BURST_CAPACITY (10)</li>
 *   <li>VOICEGUARD_FAILURE_THRESHOLD (5)</li>
 *   <li>VOICEGUARD_SUCCESS_THRESHOLD (2)</li>
 *   <li>VOICEGUARD_RECOVERY_TIMEOUT_MS (60000)</li>
 *   <li>VOICEGUARD_MAX_ATTEMPTS (4)</li>
 *   <li>VOICEGUARD_BASE_DELAY_MS (1000)</li>
 *   <li>VOICEGUARD_MAX_DELAY_MS (30000)</li>
 *   <li>VOICEGUARD_CONCURRENCY (5)</li>
 *   <li>VOICEGUARD_REQUEST_TIMEOUT_MS (30000)</li>
 *   <li>VOICEGUARD_ADMISSION_TIMEOUT_MS (0, 토큰이 없으면 즉시 RATE_LIMITED)</li>
 * </ul>
 *
 * @author VoiceGuard Team
 * @since 1.0.0
 * @param ratePerSecond 초당 토큰 충전 속도
 * @param burstCapacity 버킷 용량
 * @param failureThreshold OPEN 전이 연속 실패 횟수
 * @param successThreshold CLOSED 복귀 연속 성공 횟수
 * @param recoveryTimeoutMs OPEN 유지 시간 (밀리초)
 * @param maxAttempts 논리 요청당 최대 시도 횟수
 * @param baseDelayMs 백오프 기본 지연 (밀리초)
 * @param maxDelayMs 백오프 최대 지연 (밀리초)
 * @param concurrency 배치 동시 워커 수
 * @param perRequestTimeoutMs Transport 호출 1회 타임아웃 (밀리초)
 * @param admissionTimeoutMs 토큰을 기다리는 최대 시간 (밀리초, 0이면 대기하지 않음)
 */
public record ResilienceSettings(
    double ratePerSecond,
    int burstCapacity,
    int failureThreshold,
    int successThreshold,
    long recoveryTimeoutMs,
    int maxAttempts,
    long baseDelayMs,
    long maxDelayMs,
    int concurrency,
    long perRequestTimeoutMs,
    long admissionTimeoutMs
) {

    public static final String RATE_PER_SECOND = "VOICEGUARD_RATE_PER_SECOND";
    public static final String BURST_CAPACITY = "VOICEGUARD_BURST_CAPACITY";
    public static final String FAILURE_THRESHOLD = "VOICEGUARD_FAILURE_THRESHOLD";
    public static final String SUCCESS_THRESHOLD = "VOICEGUARD_SUCCESS_THRESHOLD";
    public static final String RECOVERY_TIMEOUT_MS = "VOICEGUARD_RECOVERY_TIMEOUT_MS";
    public static final String MAX_ATTEMPTS = "VOICEGUARD_MAX_ATTEMPTS";
    public static final String BASE_DELAY_MS = "VOICEGUARD_BASE_DELAY_MS";
    public static final String MAX_DELAY_MS = "VOICEGUARD_MAX_DELAY_MS";
    public static final String CONCURRENCY = "VOICEGUARD_CONCURRENCY";
    public static final String REQUEST_TIMEOUT_MS = "VOICEGUARD_REQUEST_TIMEOUT_MS";
    public static final String ADMISSION_TIMEOUT_MS = "VOICEGUARD_ADMISSION_TIMEOUT_MS";

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: 10 rps, burst 10, 실패 5회, 성공 2회, 복구 60초, 시도 4회,
     * 백오프 1초~30초, 워커 5개, 요청 타임아웃 30초, 허가 대기 없음</p>
     */
    public ResilienceSettings() {
        this(10.0, 10, 5, 2, 60_000L, 4, 1_000L, 30_000L, 5, 30_000L, 0L);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ResilienceSettings {
        new RateLimiterConfig(ratePerSecond, burstCapacity);
        new CircuitBreakerConfig(failureThreshold, successThreshold, recoveryTimeoutMs);
        new RetryConfig(maxAttempts, baseDelayMs, maxDelayMs);
        new ExecutorConfig(perRequestTimeoutMs, admissionTimeoutMs);
        if (concurrency <= 0) {
            throw new IllegalArgumentException(
                "concurrency must be positive (current: " + concurrency + ")"
            );
        }
    }

    /**
     * 프로세스 환경 변수로 설정 생성.
     *
     * @return ResilienceSettings
     * @throws IllegalArgumentException 값을 해석할 수 없거나 범위를 벗어난 경우
     */
    public static ResilienceSettings fromSystemEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * 환경 변수 맵으로 설정 생성. 없는 키는 기본값을 사용합니다.
     *
     * @param env 환경 변수 맵
     * @return ResilienceSettings
     * @throws IllegalArgumentException 값을 해석할 수 없거나 범위를 벗어난 경우
     */
    public static ResilienceSettings fromEnvironment(Map<String, String> env) {
        if (env == null) {
            throw new IllegalArgumentException("env cannot be null");
        }
        ResilienceSettings defaults = new ResilienceSettings();
        return new ResilienceSettings(
            readDouble(env, RATE_PER_SECOND, defaults.ratePerSecond()),
            readInt(env, BURST_CAPACITY, defaults.burstCapacity()),
            readInt(env, FAILURE_THRESHOLD, defaults.failureThreshold()),
            readInt(env, SUCCESS_THRESHOLD, defaults.successThreshold()),
            readLong(env, RECOVERY_TIMEOUT_MS, defaults.recoveryTimeoutMs()),
            readInt(env, MAX_ATTEMPTS, defaults.maxAttempts()),
            readLong(env, BASE_DELAY_MS, defaults.baseDelayMs()),
            readLong(env, MAX_DELAY_MS, defaults.maxDelayMs()),
            readInt(env, CONCURRENCY, defaults.concurrency()),
            readLong(env, REQUEST_TIMEOUT_MS, defaults.perRequestTimeoutMs()),
            readLong(env, ADMISSION_TIMEOUT_MS, defaults.admissionTimeoutMs())
        );
    }

    public RateLimiterConfig toRateLimiterConfig() {
        return new RateLimiterConfig(ratePerSecond, burstCapacity);
    }

    public CircuitBreakerConfig toCircuitBreakerConfig() {
        return new CircuitBreakerConfig(failureThreshold, successThreshold, recoveryTimeoutMs);
    }

    public RetryConfig toRetryConfig() {
        return new RetryConfig(maxAttempts, baseDelayMs, maxDelayMs);
    }

    public ExecutorConfig toExecutorConfig() {
        return new ExecutorConfig(perRequestTimeoutMs, admissionTimeoutMs);
    }

    public BatchConfig toBatchConfig() {
        return new BatchConfig().withConcurrency(concurrency);
    }

    public ResilienceSettings withRateLimit(double ratePerSecond, int burstCapacity) {
        return new ResilienceSettings(ratePerSecond, burstCapacity, failureThreshold, successThreshold,
            recoveryTimeoutMs, maxAttempts, baseDelayMs, maxDelayMs, concurrency, perRequestTimeoutMs,
            admissionTimeoutMs);
    }

    public ResilienceSettings withCircuitBreaker(int failureThreshold, int successThreshold, long recoveryTimeoutMs) {
        return new ResilienceSettings(ratePerSecond, burstCapacity, failureThreshold, successThreshold,
            recoveryTimeoutMs, maxAttempts, baseDelayMs, maxDelayMs, concurrency, perRequestTimeoutMs,
            admissionTimeoutMs);
    }

    public ResilienceSettings withRetry(int maxAttempts, long baseDelayMs, long maxDelayMs) {
        return new ResilienceSettings(ratePerSecond, burstCapacity, failureThreshold, successThreshold,
            recoveryTimeoutMs, maxAttempts, baseDelayMs, maxDelayMs, concurrency, perRequestTimeoutMs,
            admissionTimeoutMs);
    }

    public ResilienceSettings withConcurrency(int concurrency) {
        return new ResilienceSettings(ratePerSecond, burstCapacity, failureThreshold, successThreshold,
            recoveryTimeoutMs, maxAttempts, baseDelayMs, maxDelayMs, concurrency, perRequestTimeoutMs,
            admissionTimeoutMs);
    }

    public ResilienceSettings withPerRequestTimeoutMs(long perRequestTimeoutMs) {
        return new ResilienceSettings(ratePerSecond, burstCapacity, failureThreshold, successThreshold,
            recoveryTimeoutMs, maxAttempts, baseDelayMs, maxDelayMs, concurrency, perRequestTimeoutMs,
            admissionTimeoutMs);
    }

    public ResilienceSettings withAdmissionTimeoutMs(long admissionTimeoutMs) {
        return new ResilienceSettings(ratePerSecond, burstCapacity, failureThreshold, successThreshold,
            recoveryTimeoutMs, maxAttempts, baseDelayMs, maxDelayMs, concurrency, perRequestTimeoutMs,
            admissionTimeoutMs);
    }

    private static String read(Map<String, String> env, String key) {
        String value = env.get(key);
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static double readDouble(Map<String, String> env, String key, double defaultValue) {
        String value = read(env, key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a number (current: " + value + ")", e);
        }
    }

    private static int readInt(Map<String, String> env, String key, int defaultValue) {
        String value = read(env, key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer (current: " + value + ")", e);
        }
    }

    private static long readLong(Map<String, String> env, String key, long defaultValue) {
        String value = read(env, key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer (current: " + value + ")", e);
        }
    }
}
