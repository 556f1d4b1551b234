/**
 * Metrics SPI 패키지.
 *
 * <p>카운터 기록({@link com.ryuqq.voiceguard.core.metrics.MetricsSink})과 외부 노출용
 * 스냅샷({@link com.ryuqq.voiceguard.core.metrics.MetricsSnapshot},
 * {@link com.ryuqq.voiceguard.core.metrics.HealthSnapshot})을 정의합니다.
 * Prometheus 텍스트와 JSON 렌더링은 adapter-http 모듈이 담당합니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.voiceguard.core.metrics;
