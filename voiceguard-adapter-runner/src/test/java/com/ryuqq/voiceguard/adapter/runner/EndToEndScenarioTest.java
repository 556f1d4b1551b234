package com.ryuqq.voiceguard.adapter.runner;

import com.ryuqq.voiceguard.application.batch.BatchItem;
import com.ryuqq.voiceguard.application.batch.BatchSummary;
import com.ryuqq.voiceguard.application.batch.ScoreExtractor;
import com.ryuqq.voiceguard.core.cancel.CancellationToken;
import com.ryuqq.voiceguard.core.metrics.HealthSnapshot;
import com.ryuqq.voiceguard.core.metrics.MetricsSnapshot;
import com.ryuqq.voiceguard.core.outcome.TerminalReason;
import com.ryuqq.voiceguard.core.protection.CircuitBreakerState;
import com.ryuqq.voiceguard.core.transport.TransportException;
import com.ryuqq.voiceguard.core.transport.TransportResponse;
import com.ryuqq.voiceguard.testkit.contract.AbstractResilienceContractTest;
import com.ryuqq.voiceguard.testkit.transport.ScriptedTransport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 배치 처리 시나리오 테스트.
 *
 * @author VoiceGuard Team
 * @since 1.0.0
 */
@DisplayName("배치 처리 시나리오 테스트")
class EndToEndScenarioTest extends AbstractResilienceContractTest {

    @Test
    @DisplayName("일시적 500 두 번 뒤 성공하는 항목 10개는 모두 3번째 시도에 성공한다")
    void 일시_장애_후_전체_성공() {
        // given
        ResilienceSettings settings = new ResilienceSettings()
            .withRetry(3, 10, 1_000)
            .withRateLimit(1_000.0, 100)
            .withCircuitBreaker(50, 2, 60_000L)
            .withConcurrency(5);
        ScriptedTransport transport = ScriptedTransport.failingThenSucceeding(2, 500, "{\"score\":0.3}");
        ResilientClient client = new ResilientClient(transport, settings, ScoreExtractor.none(), clock);
        List<BatchItem> items = items(10);

        // when
        BatchSummary summary = client.runBatch(items, CancellationToken.create());

        // then
        assertThat(summary.succeeded()).isEqualTo(10);
        assertThat(summary.failed()).isZero();
        assertThat(summary.retryCount()).isEqualTo(20);
        items.forEach(item -> assertTerminal(summary.outcomeOf(item.itemId()), TerminalReason.SUCCESS, 3));
        assertThat(transport.invocations()).isEqualTo(30);
        assertThat(client.health().status()).isEqualTo(HealthSnapshot.Status.HEALTHY);
    }

    @Test
    @DisplayName("지속적 500이면 Breaker가 3번째 실패에서 열리고 나머지 항목은 전송 없이 차단된다")
    void 지속_장애_Breaker_차단() {
        // given
        ResilienceSettings settings = new ResilienceSettings()
            .withRetry(1, 10, 1_000)
            .withRateLimit(1_000.0, 100)
            .withCircuitBreaker(3, 2, 60_000L)
            .withConcurrency(1);
        ScriptedTransport transport = ScriptedTransport.alwaysFailing(500);
        ResilientClient client = new ResilientClient(transport, settings, ScoreExtractor.none(), clock);

        // when
        BatchSummary summary = client.runBatch(items(5), CancellationToken.create());

        // then
        assertThat(summary.failed()).isEqualTo(3);
        assertThat(summary.breakerTrips()).isEqualTo(2);
        assertThat(transport.invocations()).isEqualTo(3);
        assertTerminal(summary.outcomeOf("sample-3.wav"), TerminalReason.BREAKER_OPEN, 1);
        assertTerminal(summary.outcomeOf("sample-4.wav"), TerminalReason.BREAKER_OPEN, 1);

        HealthSnapshot health = client.health();
        assertThat(health.status()).isEqualTo(HealthSnapshot.Status.DEGRADED);
        assertThat(health.circuitBreakerState()).isEqualTo(CircuitBreakerState.OPEN);

        MetricsSnapshot metrics = client.metrics();
        assertThat(metrics.filesProcessed()).isEqualTo(5);
        assertThat(metrics.filesFailed()).isEqualTo(3);
        assertThat(metrics.breakerTrips()).isEqualTo(2);
    }

    @Test
    @DisplayName("복구 시간이 지나면 다음 배치가 HALF_OPEN 탐침으로 Breaker를 닫는다")
    void 복구_후_다음_배치() {
        // given
        ResilienceSettings settings = new ResilienceSettings()
            .withRetry(1, 10, 1_000)
            .withRateLimit(1_000.0, 100)
            .withCircuitBreaker(3, 2, 60_000L)
            .withConcurrency(1);
        AtomicBoolean healthy = new AtomicBoolean(false);
        ScriptedTransport transport = new ScriptedTransport((request, call) -> {
            if (!healthy.get()) {
                throw TransportException.httpStatus(500, "down");
            }
            return TransportResponse.ok("{\"score\":0.1}");
        });
        ResilientClient client = new ResilientClient(transport, settings, ScoreExtractor.none(), clock);
        client.runBatch(items(3), CancellationToken.create());
        assertThat(client.health().circuitBreakerState()).isEqualTo(CircuitBreakerState.OPEN);

        // when
        healthy.set(true);
        clock.advanceMillis(60_000L);
        BatchSummary summary = client.runBatch(items(4), CancellationToken.create());

        // then
        assertThat(summary.succeeded()).isEqualTo(4);
        assertThat(client.health().status()).isEqualTo(HealthSnapshot.Status.HEALTHY);
    }

    private List<BatchItem> items(int count) {
        List<BatchItem> items = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            String itemId = "sample-" + i + ".wav";
            items.add(new BatchItem(itemId, deepfakeRequest(itemId)));
        }
        return items;
    }
}
