package com.ryuqq.voiceguard.application.executor;

import com.ryuqq.voiceguard.application.retry.FailureClassifier;
import com.ryuqq.voiceguard.application.retry.RetryPolicy;
import com.ryuqq.voiceguard.core.cancel.CancellationToken;
import com.ryuqq.voiceguard.core.metrics.MetricsSink;
import com.ryuqq.voiceguard.core.outcome.RequestOutcome;
import com.ryuqq.voiceguard.core.outcome.TerminalReason;
import com.ryuqq.voiceguard.core.protection.CircuitBreaker;
import com.ryuqq.voiceguard.core.protection.CircuitBreakerRegistry;
import com.ryuqq.voiceguard.core.protection.RateLimiter;
import com.ryuqq.voiceguard.core.retry.FailureKind;
import com.ryuqq.voiceguard.core.retry.RetryContext;
import com.ryuqq.voiceguard.core.time.Clock;
import com.ryuqq.voiceguard.core.transport.Transport;
import com.ryuqq.voiceguard.core.transport.TransportException;
import com.ryuqq.voiceguard.core.transport.TransportRequest;
import com.ryuqq.voiceguard.core.transport.TransportResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * 논리 요청 1건을 보호 계층을 거쳐 실행하는 Executor.
 *
 * <p><strong>처리 흐름 (시도마다 반복):</strong></p>
 * <ol>
 *   <li>취소 확인</li>
 *   <li>Rate Limiter 허가 (거부 시 RATE_LIMITED로 종료)</li>
 *   <li>엔드포인트 Circuit Breaker 확인 (거부 시 BREAKER_OPEN으로 종료)</li>
 *   <li>Transport 호출 (perRequestTimeoutMs)</li>
 *   <li>결과를 Circuit Breaker에 보고</li>
 *   <li>실패 분류 후 재시도 판단: FATAL이면 FATAL_CLIENT_ERROR, 시도 소진이면 MAX_RETRIES_EXCEEDED</li>
 *   <li>백오프 대기 후 1번으로</li>
 * </ol>
 *
 * <p>어떤 실패도 예외로 던지지 않고 {@link RequestOutcome}으로 반환합니다.
 * 대기 중 인터럽트되면 인터럽트 플래그를 복원하고 CANCELLED를 반환합니다.</p>
 *
 * <p>Rate Limiter, Circuit Breaker 상태는 여러 워커가 공유하므로 이 클래스는 자체 상태를 갖지 않습니다.
 * 동시에 여러 스레드에서 호출해도 안전합니다.</p>
 *
 * @author VoiceGuard Team
 * @since 1.0.0
 */
public final class RequestExecutor {

    private static final Logger log = LoggerFactory.getLogger(RequestExecutor.class);

    private final RateLimiter rateLimiter;
    private final CircuitBreakerRegistry breakers;
    private final Transport transport;
    private final RetryPolicy retryPolicy;
    private final ExecutorConfig config;
    private final MetricsSink metricsSink;
    private final Clock clock;

    /**
     * 생성자.
     *
     * @param rateLimiter 공유 Rate Limiter
     * @param breakers 엔드포인트별 Circuit Breaker 레지스트리
     * @param transport Transport
     * @param retryPolicy 재시도 정책
     * @param config Executor 설정
     * @param metricsSink 메트릭 수집기
     * @param clock 시간 소스 (백오프 대기와 지연 측정)
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public RequestExecutor(
        RateLimiter rateLimiter,
        CircuitBreakerRegistry breakers,
        Transport transport,
        RetryPolicy retryPolicy,
        ExecutorConfig config,
        MetricsSink metricsSink,
        Clock clock
    ) {
        if (rateLimiter == null) {
            throw new IllegalArgumentException("rateLimiter cannot be null");
        }
        if (breakers == null) {
            throw new IllegalArgumentException("breakers cannot be null");
        }
        if (transport == null) {
            throw new IllegalArgumentException("transport cannot be null");
        }
        if (retryPolicy == null) {
            throw new IllegalArgumentException("retryPolicy cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (metricsSink == null) {
            throw new IllegalArgumentException("metricsSink cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.rateLimiter = rateLimiter;
        this.breakers = breakers;
        this.transport = transport;
        this.retryPolicy = retryPolicy;
        this.config = config;
        this.metricsSink = metricsSink;
        this.clock = clock;
    }

    /**
     * 요청 실행.
     *
     * @param request 요청
     * @param cancellationToken 취소 토큰
     * @return 최종 결과 (예외를 던지지 않음)
     * @throws IllegalArgumentException request 또는 cancellationToken이 null인 경우
     */
    public RequestOutcome execute(TransportRequest request, CancellationToken cancellationToken) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        if (cancellationToken == null) {
            throw new IllegalArgumentException("cancellationToken cannot be null");
        }

        long startNanos = clock.nanoTime();
        RetryContext context = retryPolicy.newContext();
        CircuitBreaker breaker = breakers.forEndpoint(request.endpoint());
        int retries = 0;

        try {
            while (true) {
                if (cancellationToken.isCancelled()) {
                    return finish(request, TerminalReason.CANCELLED, context, retries, startNanos, "cancelled");
                }
                int attempt = context.beginAttempt();

                if (!admit()) {
                    context.recordFailure(FailureKind.RATE_LIMITED, "rate limiter denied admission");
                    log.warn("Rate limited: {} (attempt {}/{})", request.path(), attempt, context.maxAttempts());
                    return finish(request, TerminalReason.RATE_LIMITED, context, retries, startNanos,
                        context.lastErrorDetail());
                }

                if (!breaker.allow()) {
                    context.recordFailure(FailureKind.BREAKER_OPEN, "circuit breaker '" + breaker.name() + "' is open");
                    log.warn("Circuit open: {} (attempt {}/{})", request.path(), attempt, context.maxAttempts());
                    return finish(request, TerminalReason.BREAKER_OPEN, context, retries, startNanos,
                        context.lastErrorDetail());
                }

                TransportResponse response = sendOnce(request, breaker, context);
                if (response != null) {
                    breaker.recordSuccess();
                    RequestOutcome outcome = RequestOutcome.success(
                        context.attempt(), retries, elapsedSince(startNanos), response);
                    metricsSink.recordOutcome(request.endpoint(), outcome);
                    return outcome;
                }

                if (context.lastError() == FailureKind.FATAL) {
                    return finish(request, TerminalReason.FATAL_CLIENT_ERROR, context, retries, startNanos,
                        context.lastErrorDetail());
                }
                if (!retryPolicy.shouldRetry(context)) {
                    return finish(request, TerminalReason.MAX_RETRIES_EXCEEDED, context, retries, startNanos,
                        context.lastErrorDetail());
                }
                if (cancellationToken.isCancelled()) {
                    return finish(request, TerminalReason.CANCELLED, context, retries, startNanos, "cancelled");
                }

                long delayMs = retryPolicy.backoffDelayMs(attempt);
                log.warn("Retrying {} after attempt {}/{} failed ({}), backoff {}ms",
                    request.path(), attempt, context.maxAttempts(), context.lastErrorDetail(), delayMs);
                clock.sleep(delayMs);
                retries++;
                metricsSink.recordRetry(request.endpoint());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return finish(request, TerminalReason.CANCELLED, context, retries, startNanos, "interrupted");
        }
    }

    /**
     * 한 번의 Transport 호출.
     *
     * <p>실패는 여기서 브레이커와 RetryContext에 정확히 한 번 기록되고 null을 반환합니다.
     * 응답 없이 반환한 Transport는 FATAL 실패로 취급합니다.</p>
     */
    private TransportResponse sendOnce(TransportRequest request, CircuitBreaker breaker, RetryContext context)
        throws InterruptedException {
        TransportResponse response;
        try {
            response = transport.send(request, config.perRequestTimeoutMs());
        } catch (TransportException e) {
            breaker.recordFailure(e);
            context.recordFailure(FailureClassifier.classify(e), describe(e));
            return null;
        } catch (RuntimeException e) {
            breaker.recordFailure(e);
            context.recordFailure(FailureKind.FATAL, e.toString());
            log.error("Unexpected transport failure for {}", request.path(), e);
            return null;
        }
        if (response == null) {
            IllegalStateException missing = new IllegalStateException("transport returned no response");
            breaker.recordFailure(missing);
            context.recordFailure(FailureKind.FATAL, missing.toString());
            log.error("Transport returned no response for {}", request.path());
        }
        return response;
    }

    private boolean admit() throws InterruptedException {
        if (config.admissionTimeoutMs() > 0) {
            return rateLimiter.tryAcquire(config.admissionTimeoutMs());
        }
        return rateLimiter.tryAcquire();
    }

    private RequestOutcome finish(
        TransportRequest request,
        TerminalReason reason,
        RetryContext context,
        int retries,
        long startNanos,
        String detail
    ) {
        RequestOutcome outcome = RequestOutcome.of(reason, context.attempt(), retries, elapsedSince(startNanos), detail);
        if (reason.isFailure()) {
            log.warn("Request {} failed: {} after {} attempt(s) ({})",
                request.path(), reason, outcome.attemptsUsed(), detail);
        }
        metricsSink.recordOutcome(request.endpoint(), outcome);
        return outcome;
    }

    private Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(Math.max(0L, clock.nanoTime() - startNanos));
    }

    private static String describe(TransportException e) {
        if (e.getStatusCode() != TransportException.NO_STATUS) {
            return "HTTP " + e.getStatusCode() + ": " + e.getMessage();
        }
        return e.getType() + ": " + e.getMessage();
    }
}
