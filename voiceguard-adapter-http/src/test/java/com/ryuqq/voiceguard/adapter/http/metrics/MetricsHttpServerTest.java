package com.ryuqq.voiceguard.adapter.http.metrics;

import com.ryuqq.voiceguard.adapter.micrometer.metrics.MicrometerMetricsSink;
import com.ryuqq.voiceguard.core.metrics.HealthSnapshot;
import com.ryuqq.voiceguard.core.outcome.RequestOutcome;
import com.ryuqq.voiceguard.core.protection.CircuitBreaker;
import com.ryuqq.voiceguard.core.protection.CircuitBreakerState;
import com.ryuqq.voiceguard.core.transport.TransportResponse;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * MetricsHttpServer 테스트.
 *
 * @author VoiceGuard Team
 * @since 1.0.0
 */
@DisplayName("MetricsHttpServer 테스트")
class MetricsHttpServerTest {

    private final PrometheusMeterRegistry registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
    private final MicrometerMetricsSink sink = new MicrometerMetricsSink(registry);
    private final AtomicReference<HealthSnapshot> health =
        new AtomicReference<>(HealthSnapshot.from(Map.of("deepfake", CircuitBreakerState.CLOSED)));
    private final HttpClient httpClient = HttpClient.newHttpClient();
    private MetricsHttpServer server;

    @BeforeEach
    void setUp() {
        server = new MetricsHttpServer(0, registry, sink::snapshot, health::get);
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    @DisplayName("/metrics는 레지스트리의 카운터, 타이머, Breaker gauge를 Prometheus 텍스트로 반환한다")
    void metrics_엔드포인트() throws Exception {
        // given
        CircuitBreaker breaker = mock(CircuitBreaker.class);
        when(breaker.name()).thenReturn("deepfake");
        when(breaker.getState()).thenReturn(CircuitBreakerState.OPEN);
        sink.bindCircuitBreaker(breaker);
        for (int i = 0; i < 3; i++) {
            sink.recordOutcome("deepfake",
                RequestOutcome.success(1, 0, Duration.ofMillis(40), TransportResponse.ok("{}")));
        }
        sink.recordRetry("deepfake");

        // when
        HttpResponse<String> response = get("/metrics");

        // then
        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.headers().firstValue("Content-Type")).hasValueSatisfying(
            value -> assertThat(value).startsWith("text/plain").contains("version=0.0.4"));
        assertThat(response.body())
            .contains("# TYPE voiceguard_files_processed_total counter")
            .contains("voiceguard_request_latency_seconds_count");
        assertThat(sampleValue(response.body(), "voiceguard_files_processed_total")).isEqualTo(3.0);
        assertThat(sampleValue(response.body(), "voiceguard_retries_total")).isEqualTo(1.0);
        assertThat(sampleValue(response.body(), "voiceguard_circuit_breaker_state")).isEqualTo(2.0);
    }

    @Test
    @DisplayName("/health는 Breaker 상태와 메트릭 스냅샷을 JSON으로 반환한다")
    void health_엔드포인트() throws Exception {
        health.set(HealthSnapshot.from(Map.of("deepfake", CircuitBreakerState.OPEN)));
        sink.recordOutcome("deepfake", RequestOutcome.cancelledBeforeStart());

        HttpResponse<String> response = get("/health");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.body()).contains("\"status\":\"degraded\"").contains("\"circuit_breaker\":\"open\"")
            .contains("\"files_processed\":1");
    }

    @Test
    @DisplayName("그 외 경로는 404, GET 이외의 메서드는 405")
    void 없는_경로와_메서드() throws Exception {
        assertThat(get("/other").statusCode()).isEqualTo(404);

        HttpRequest post = HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + server.port() + "/metrics"))
            .POST(HttpRequest.BodyPublishers.noBody())
            .build();
        assertThat(httpClient.send(post, HttpResponse.BodyHandlers.ofString()).statusCode()).isEqualTo(405);
    }

    @Test
    @DisplayName("레지스트리 없이 생성할 수 없다")
    void 레지스트리_필수() {
        assertThatThrownBy(() -> new MetricsHttpServer(0, null, sink::snapshot, health::get))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("registry");
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + server.port() + path))
            .GET()
            .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private static double sampleValue(String body, String metricName) {
        return body.lines()
            .filter(line -> line.startsWith(metricName + "{") && line.contains("endpoint=\"deepfake\""))
            .map(line -> Double.parseDouble(line.substring(line.lastIndexOf(' ') + 1)))
            .findFirst()
            .orElseThrow(() -> new AssertionError(metricName + " not found in:\n" + body));
    }
}
