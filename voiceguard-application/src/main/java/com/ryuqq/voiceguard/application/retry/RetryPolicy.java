package com.ryuqq.voiceguard.application.retry;

import com.ryuqq.voiceguard.core.retry.FailureKind;
import com.ryuqq.voiceguard.core.retry.RetryConfig;
import com.ryuqq.voiceguard.core.retry.RetryContext;

/**
 * 재시도 정책.
 *
 * <p>마지막 실패가 RETRYABLE이고 시도 횟수가 남아 있을 때만 재시도합니다.
 * FATAL, BREAKER_OPEN, RATE_LIMITED는 재시도하지 않습니다.</p>
 *
 * @author VoiceGuard Team
 * @since 1.0.0
 */
public class RetryPolicy {

    private final RetryConfig config;
    private final BackoffCalculator backoffCalculator;

    /**
     * 기본 Jitter 난수 소스를 사용하는 생성자.
     *
     * @param config 재시도 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public RetryPolicy(RetryConfig config) {
        this(config, new BackoffCalculator(config));
    }

    /**
     * 생성자.
     *
     * @param config 재시도 설정
     * @param backoffCalculator 지연 시간 계산기
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public RetryPolicy(RetryConfig config, BackoffCalculator backoffCalculator) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (backoffCalculator == null) {
            throw new IllegalArgumentException("backoffCalculator cannot be null");
        }
        this.config = config;
        this.backoffCalculator = backoffCalculator;
    }

    /**
     * 논리 요청 하나에 대한 새 RetryContext 생성.
     *
     * @return RetryContext
     */
    public RetryContext newContext() {
        return new RetryContext(config.maxAttempts());
    }

    /**
     * 재시도 여부 판단.
     *
     * @param context 실패가 기록된 RetryContext
     * @return 재시도해야 하면 true
     */
    public boolean shouldRetry(RetryContext context) {
        return context.lastError() == FailureKind.RETRYABLE && context.hasAttemptsRemaining();
    }

    /**
     * 재시도 전 대기 시간.
     *
     * @param attempt 방금 실패한 시도 번호 (1부터)
     * @return 대기 시간 (밀리초)
     */
    public long backoffDelayMs(int attempt) {
        return backoffCalculator.calculate(attempt);
    }

    public RetryConfig getConfig() {
        return config;
    }
}
