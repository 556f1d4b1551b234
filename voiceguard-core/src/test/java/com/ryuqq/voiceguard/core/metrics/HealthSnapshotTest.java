package com.ryuqq.voiceguard.core.metrics;

import com.ryuqq.voiceguard.core.protection.CircuitBreakerState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * HealthSnapshot, MetricsSnapshot 테스트.
 *
 * @author VoiceGuard Team
 * @since 1.0.0
 */
@DisplayName("HealthSnapshot 테스트")
class HealthSnapshotTest {

    @Test
    @DisplayName("Circuit Breaker가 없거나 모두 CLOSED면 HEALTHY")
    void 모두_CLOSED_HEALTHY() {
        assertThat(HealthSnapshot.from(Map.of()).status()).isEqualTo(HealthSnapshot.Status.HEALTHY);

        HealthSnapshot health = HealthSnapshot.from(Map.of("deepfake", CircuitBreakerState.CLOSED));

        assertThat(health.status()).isEqualTo(HealthSnapshot.Status.HEALTHY);
        assertThat(health.circuitBreakerState()).isEqualTo(CircuitBreakerState.CLOSED);
    }

    @Test
    @DisplayName("가장 나쁜 상태를 대표 상태로 사용한다 (OPEN > HALF_OPEN > CLOSED)")
    void 최악_상태_대표() {
        // when
        HealthSnapshot halfOpen = HealthSnapshot.from(Map.of(
            "deepfake", CircuitBreakerState.HALF_OPEN,
            "sar", CircuitBreakerState.CLOSED));
        HealthSnapshot open = HealthSnapshot.from(Map.of(
            "deepfake", CircuitBreakerState.HALF_OPEN,
            "voice-mfa", CircuitBreakerState.OPEN,
            "sar", CircuitBreakerState.CLOSED));

        // then
        assertThat(halfOpen.circuitBreakerState()).isEqualTo(CircuitBreakerState.HALF_OPEN);
        assertThat(halfOpen.status()).isEqualTo(HealthSnapshot.Status.DEGRADED);
        assertThat(open.circuitBreakerState()).isEqualTo(CircuitBreakerState.OPEN);
        assertThat(open.breakers().keySet()).containsExactly("deepfake", "sar", "voice-mfa");
    }

    @Test
    @DisplayName("MetricsSnapshot은 음수 카운터를 거부한다")
    void metricsSnapshot_음수_거부() {
        assertThat(MetricsSnapshot.empty().filesProcessed()).isZero();

        assertThatThrownBy(() -> new MetricsSnapshot(-1, 0, 0, 0, 0, 0, 0, 0.0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("NoOp MetricsSink는 항상 빈 스냅샷을 반환한다")
    void noopSink_빈_스냅샷() {
        MetricsSink sink = MetricsSink.noop();
        sink.recordRetry("deepfake");

        assertThat(sink.snapshot()).isEqualTo(MetricsSnapshot.empty());
    }
}
