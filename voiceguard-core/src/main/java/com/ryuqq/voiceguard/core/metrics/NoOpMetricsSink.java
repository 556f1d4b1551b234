package com.ryuqq.voiceguard.core.metrics;

import com.ryuqq.voiceguard.core.outcome.RequestOutcome;

/**
 * MetricsSink NoOp 구현.
 *
 * @author VoiceGuard Team
 * @since 1.0.0
 */
final class NoOpMetricsSink implements MetricsSink {

    static final NoOpMetricsSink INSTANCE = new NoOpMetricsSink();

    private NoOpMetricsSink() {
    }

    @Override
    public void recordRetry(String endpoint) {
        // NoOp
    }

    @Override
    public void recordOutcome(String endpoint, RequestOutcome outcome) {
        // NoOp
    }

    @Override
    public MetricsSnapshot snapshot() {
        return MetricsSnapshot.empty();
    }
}
