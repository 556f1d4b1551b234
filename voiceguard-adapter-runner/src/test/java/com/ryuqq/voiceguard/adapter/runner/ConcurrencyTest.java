package com.ryuqq.voiceguard.adapter.runner;

import com.ryuqq.voiceguard.adapter.protection.ConsecutiveFailureCircuitBreaker;
import com.ryuqq.voiceguard.application.batch.BatchItem;
import com.ryuqq.voiceguard.application.batch.BatchSummary;
import com.ryuqq.voiceguard.application.batch.ScoreExtractor;
import com.ryuqq.voiceguard.core.cancel.CancellationToken;
import com.ryuqq.voiceguard.core.outcome.TerminalReason;
import com.ryuqq.voiceguard.core.protection.CircuitBreakerState;
import com.ryuqq.voiceguard.core.time.Clock;
import com.ryuqq.voiceguard.testkit.contract.AbstractResilienceContractTest;
import com.ryuqq.voiceguard.testkit.transport.ScriptedTransport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 동시성 테스트.
 *
 * <p>20개 워커가 하나의 Rate Limiter와 Circuit Breaker를 공유할 때
 * 토큰 보존과 Breaker 전이가 정확한지 검증합니다. 허가 대기 테스트를 제외하면 시계는 멈춰 있어
 * 토큰이 보충되지 않습니다.</p>
 *
 * @author VoiceGuard Team
 * @since 1.0.0
 */
@DisplayName("동시성 테스트")
class ConcurrencyTest extends AbstractResilienceContractTest {

    private static final int WORKERS = 20;
    private static final int ITEMS = 50;

    @RepeatedTest(5)
    @DisplayName("burst 5인 Limiter를 20개 워커가 공유하면 정확히 5건만 허용된다")
    void 토큰_보존() {
        // given
        ResilienceSettings settings = new ResilienceSettings()
            .withRateLimit(1.0, 5)
            .withConcurrency(WORKERS);
        ScriptedTransport transport = ScriptedTransport.alwaysSucceeding("{\"score\":0.1}");
        ResilientClient client = new ResilientClient(transport, settings, ScoreExtractor.none(), clock);

        // when
        BatchSummary summary = client.runBatch(items(ITEMS), CancellationToken.create());

        // then
        assertThat(summary.total()).isEqualTo(ITEMS);
        assertThat(summary.succeeded()).isEqualTo(5);
        assertThat(summary.rateLimited()).isEqualTo(ITEMS - 5);
        assertThat(transport.invocations()).isEqualTo(5);
        assertThat(client.metrics().rateLimited()).isEqualTo(ITEMS - 5);
        assertThat(client.rateLimiter().availableTokens()).isLessThan(1.0);
    }

    @RepeatedTest(5)
    @DisplayName("동시 실패가 몰려도 Breaker는 한 번만 OPEN되고 모든 항목이 실패 또는 차단으로 끝난다")
    void 동시_실패_Breaker_1회_OPEN() {
        // given
        ResilienceSettings settings = new ResilienceSettings()
            .withRateLimit(1_000.0, 1_000)
            .withCircuitBreaker(5, 2, 60_000L)
            .withRetry(1, 10, 1_000)
            .withConcurrency(WORKERS);
        ScriptedTransport transport = ScriptedTransport.alwaysFailing(500);
        ResilientClient client = new ResilientClient(transport, settings, ScoreExtractor.none(), clock);

        // when
        BatchSummary summary = client.runBatch(items(ITEMS), CancellationToken.create());

        // then
        ConsecutiveFailureCircuitBreaker breaker =
            (ConsecutiveFailureCircuitBreaker) client.circuitBreaker(DEEPFAKE_ENDPOINT);
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.OPEN);
        assertThat(breaker.openCount()).isEqualTo(1);
        assertThat(summary.failed() + summary.breakerTrips()).isEqualTo(ITEMS);
        assertThat(summary.failed()).isEqualTo(transport.invocations());
        assertThat(summary.failed()).isGreaterThanOrEqualTo(5);
        assertThat(summary.breakerTrips()).isPositive();
    }

    @Test
    @DisplayName("모든 결과가 정확히 한 번씩 누적되어 합계가 맞는다")
    void 결과_누적_합계() {
        // given
        ResilienceSettings settings = new ResilienceSettings()
            .withRateLimit(1_000.0, 1_000)
            .withRetry(3, 10, 1_000)
            .withConcurrency(WORKERS);
        ScriptedTransport transport = ScriptedTransport.failingThenSucceeding(1, 503, "{\"score\":0.5}");
        ResilientClient client = new ResilientClient(transport, settings, ScoreExtractor.none(), clock);

        // when
        BatchSummary summary = client.runBatch(items(ITEMS), CancellationToken.create());

        // then
        assertThat(summary.succeeded()).isEqualTo(ITEMS);
        assertThat(summary.retryCount()).isEqualTo(ITEMS);
        assertThat(summary.outcomes()).hasSize(ITEMS);
        summary.outcomes().values().forEach(outcome -> {
            assertThat(outcome.terminalReason()).isEqualTo(TerminalReason.SUCCESS);
            assertThat(outcome.attemptsUsed()).isEqualTo(2);
        });
        assertThat(client.metrics().filesProcessed()).isEqualTo(ITEMS);
        assertThat(client.metrics().retryCount()).isEqualTo(ITEMS);
    }

    @Test
    @DisplayName("admissionTimeoutMs를 설정하면 burst를 넘는 항목도 토큰을 기다려 모두 성공한다")
    void 허가_대기_배치() {
        // given
        ResilienceSettings settings = ResilienceSettings.fromEnvironment(
                Map.of(ResilienceSettings.ADMISSION_TIMEOUT_MS, "5000"))
            .withRateLimit(100.0, 5)
            .withConcurrency(WORKERS);
        ScriptedTransport transport = ScriptedTransport.alwaysSucceeding("{\"score\":0.1}");
        ResilientClient client = new ResilientClient(transport, settings, ScoreExtractor.none(), Clock.system());

        // when
        BatchSummary summary = client.runBatch(items(30), CancellationToken.create());

        // then
        assertThat(summary.succeeded()).isEqualTo(30);
        assertThat(summary.rateLimited()).isZero();
        assertThat(transport.invocations()).isEqualTo(30);
        assertThat(client.metrics().rateLimited()).isZero();
    }

    private List<BatchItem> items(int count) {
        List<BatchItem> items = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            String itemId = "call-" + i + ".wav";
            items.add(new BatchItem(itemId, deepfakeRequest(itemId)));
        }
        return items;
    }
}
