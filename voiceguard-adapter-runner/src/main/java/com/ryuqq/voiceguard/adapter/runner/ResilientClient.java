package com.ryuqq.voiceguard.adapter.runner;

import com.ryuqq.voiceguard.adapter.micrometer.metrics.MicrometerMetricsSink;
import com.ryuqq.voiceguard.adapter.protection.ConsecutiveFailureCircuitBreaker;
import com.ryuqq.voiceguard.adapter.protection.TokenBucketRateLimiter;
import com.ryuqq.voiceguard.application.batch.BatchItem;
import com.ryuqq.voiceguard.application.batch.BatchSummary;
import com.ryuqq.voiceguard.application.batch.ScoreExtractor;
import com.ryuqq.voiceguard.application.executor.RequestExecutor;
import com.ryuqq.voiceguard.application.retry.RetryPolicy;
import com.ryuqq.voiceguard.core.cancel.CancellationToken;
import com.ryuqq.voiceguard.core.metrics.HealthSnapshot;
import com.ryuqq.voiceguard.core.metrics.MetricsSnapshot;
import com.ryuqq.voiceguard.core.outcome.RequestOutcome;
import com.ryuqq.voiceguard.core.protection.CircuitBreaker;
import com.ryuqq.voiceguard.core.protection.CircuitBreakerConfig;
import com.ryuqq.voiceguard.core.protection.CircuitBreakerRegistry;
import com.ryuqq.voiceguard.core.protection.RateLimiter;
import com.ryuqq.voiceguard.core.time.Clock;
import com.ryuqq.voiceguard.core.transport.Transport;
import com.ryuqq.voiceguard.core.transport.TransportRequest;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.List;

/**
 * 복원력 계층을 갖춘 클라이언트.
 *
 * <p>Rate Limiter 하나, 엔드포인트별 Circuit Breaker 레지스트리 하나, RequestExecutor 하나를 소유합니다.
 * 프로세스 전역 상태가 없으므로 클라이언트 인스턴스마다 보호 상태가 독립적입니다.</p>
 *
 * <p>메트릭은 Micrometer {@link MeterRegistry}에 기록되며, 생성되는 Circuit Breaker마다 상태 gauge가
 * 등록됩니다. Prometheus 레지스트리를 넘기면 {@code /metrics}로 그대로 노출할 수 있습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * PrometheusMeterRegistry registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
 * ResilientClient client = new ResilientClient(
 *     new JdkHttpTransport(baseUri, apiKey), ResilienceSettings.fromSystemEnvironment(),
 *     ScoreExtractor.none(), Clock.system(), registry);
 *
 * RequestOutcome outcome = client.send(request);
 * BatchSummary summary = client.runBatch(items, CancellationToken.create());
 * HealthSnapshot health = client.health();
 * }</pre>
 *
 * @author VoiceGuard Team
 * @since 1.0.0
 */
public final class ResilientClient {

    private final ResilienceSettings settings;
    private final RateLimiter rateLimiter;
    private final CircuitBreakerRegistry breakers;
    private final MicrometerMetricsSink metricsSink;
    private final RequestExecutor executor;
    private final WorkerPoolBatchCoordinator coordinator;

    /**
     * 점수 추출 없이 시스템 시계를 사용하는 생성자.
     *
     * @param transport Transport
     * @param settings 복원력 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ResilientClient(Transport transport, ResilienceSettings settings) {
        this(transport, settings, ScoreExtractor.none(), Clock.system());
    }

    /**
     * 메트릭을 내부 {@link SimpleMeterRegistry}에 기록하는 생성자.
     *
     * @param transport Transport
     * @param settings 복원력 설정
     * @param scoreExtractor 배치 위험도 집계용 점수 추출기
     * @param clock 시간 소스
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ResilientClient(Transport transport, ResilienceSettings settings, ScoreExtractor scoreExtractor, Clock clock) {
        this(transport, settings, scoreExtractor, clock, new SimpleMeterRegistry());
    }

    /**
     * 생성자.
     *
     * @param transport Transport
     * @param settings 복원력 설정
     * @param scoreExtractor 배치 위험도 집계용 점수 추출기
     * @param clock 시간 소스
     * @param meterRegistry 메트릭을 등록할 Micrometer 레지스트리
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ResilientClient(
        Transport transport,
        ResilienceSettings settings,
        ScoreExtractor scoreExtractor,
        Clock clock,
        MeterRegistry meterRegistry
    ) {
        if (transport == null) {
            throw new IllegalArgumentException("transport cannot be null");
        }
        if (settings == null) {
            throw new IllegalArgumentException("settings cannot be null");
        }
        if (scoreExtractor == null) {
            throw new IllegalArgumentException("scoreExtractor cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (meterRegistry == null) {
            throw new IllegalArgumentException("meterRegistry cannot be null");
        }

        CircuitBreakerConfig breakerConfig = settings.toCircuitBreakerConfig();
        this.settings = settings;
        this.rateLimiter = new TokenBucketRateLimiter(settings.toRateLimiterConfig(), clock);
        MicrometerMetricsSink sink = new MicrometerMetricsSink(meterRegistry);
        this.metricsSink = sink;
        this.breakers = new CircuitBreakerRegistry(endpoint -> {
            CircuitBreaker breaker = new ConsecutiveFailureCircuitBreaker(endpoint, breakerConfig, clock);
            sink.bindCircuitBreaker(breaker);
            return breaker;
        });
        this.executor = new RequestExecutor(
            rateLimiter,
            breakers,
            transport,
            new RetryPolicy(settings.toRetryConfig()),
            settings.toExecutorConfig(),
            metricsSink,
            clock
        );
        this.coordinator = new WorkerPoolBatchCoordinator(
            executor, scoreExtractor, metricsSink, settings.toBatchConfig(), clock);
    }

    /**
     * 요청 1건 실행.
     *
     * @param request 요청
     * @return 최종 결과
     */
    public RequestOutcome send(TransportRequest request) {
        return send(request, CancellationToken.create());
    }

    /**
     * 요청 1건 실행 (취소 가능).
     *
     * @param request 요청
     * @param cancellationToken 취소 토큰
     * @return 최종 결과
     */
    public RequestOutcome send(TransportRequest request, CancellationToken cancellationToken) {
        return executor.execute(request, cancellationToken);
    }

    /**
     * 설정의 concurrency로 배치 실행.
     *
     * @param items 배치 항목
     * @param cancellationToken 취소 토큰
     * @return 배치 요약
     */
    public BatchSummary runBatch(List<BatchItem> items, CancellationToken cancellationToken) {
        return coordinator.runBatch(items, cancellationToken);
    }

    /**
     * 지정한 concurrency로 배치 실행.
     *
     * @param items 배치 항목
     * @param concurrency 동시 워커 수
     * @param cancellationToken 취소 토큰
     * @return 배치 요약
     */
    public BatchSummary runBatch(List<BatchItem> items, int concurrency, CancellationToken cancellationToken) {
        return coordinator.runBatch(items, concurrency, cancellationToken);
    }

    /**
     * 누적 메트릭.
     *
     * @return MetricsSnapshot
     */
    public MetricsSnapshot metrics() {
        return metricsSink.snapshot();
    }

    /**
     * Circuit Breaker 상태 기반 헬스.
     *
     * @return HealthSnapshot
     */
    public HealthSnapshot health() {
        return HealthSnapshot.from(breakers.states());
    }

    /**
     * 엔드포인트 Circuit Breaker 조회 (없으면 생성).
     *
     * @param endpoint 엔드포인트 이름
     * @return CircuitBreaker
     */
    public CircuitBreaker circuitBreaker(String endpoint) {
        return breakers.forEndpoint(endpoint);
    }

    public MeterRegistry meterRegistry() {
        return metricsSink.registry();
    }

    public RateLimiter rateLimiter() {
        return rateLimiter;
    }

    public ResilienceSettings settings() {
        return settings;
    }
}
