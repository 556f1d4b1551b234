package com.ryuqq.voiceguard.core.metrics;

import com.ryuqq.voiceguard.core.outcome.RequestOutcome;

/**
 * Metrics Sink SPI.
 *
 * <p>RequestExecutor가 재시도와 종료 결과를 보고하는 카운터 저장소입니다.
 * 외부 모니터링 계층(/metrics HTTP 엔드포인트 등)은 {@link #snapshot()}으로 값을 당겨 갑니다.</p>
 *
 * <p><strong>동시성:</strong> 여러 워커가 동시에 기록하므로 구현체는 thread-safe해야 합니다.</p>
 *
 * @author VoiceGuard Team
 * @since 1.0.0
 */
public interface MetricsSink {

    /**
     * backoff 후 재시도 1회 기록.
     *
     * @param endpoint 엔드포인트 이름
     */
    void recordRetry(String endpoint);

    /**
     * 논리 요청의 종료 결과 기록.
     *
     * @param endpoint 엔드포인트 이름
     * @param outcome 종료 결과
     */
    void recordOutcome(String endpoint, RequestOutcome outcome);

    /**
     * 현재 카운터 스냅샷.
     *
     * @return 스냅샷 (불변)
     */
    MetricsSnapshot snapshot();

    /**
     * 아무것도 기록하지 않는 Sink.
     *
     * @return NoOp MetricsSink
     */
    static MetricsSink noop() {
        return NoOpMetricsSink.INSTANCE;
    }
}
