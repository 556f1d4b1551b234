/**
 * Micrometer MetricsSink adapter package.
 *
 * <p>{@link com.ryuqq.voiceguard.adapter.micrometer.metrics.MicrometerMetricsSink} records outcomes as
 * Micrometer meters on a caller-supplied {@link io.micrometer.core.instrument.MeterRegistry}. Pass a
 * Prometheus registry to expose them on {@code /metrics}; the default simple registry keeps them in
 * process only.</p>
 *
 * @see com.ryuqq.voiceguard.core.metrics.MetricsSink
 * @author VoiceGuard Team
 * @since 1.0.0
 */
package com.ryuqq.voiceguard.adapter.micrometer.metrics;
