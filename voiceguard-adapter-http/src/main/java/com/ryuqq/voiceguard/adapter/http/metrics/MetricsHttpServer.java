package com.ryuqq.voiceguard.adapter.http.metrics;

import com.ryuqq.voiceguard.core.metrics.HealthSnapshot;
import com.ryuqq.voiceguard.core.metrics.MetricsSnapshot;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.function.Supplier;

/**
 * {@code /metrics}와 {@code /health}를 제공하는 경량 HTTP 서버.
 *
 * <p>{@code /metrics}는 {@link PrometheusMeterRegistry#scrape()} 결과를 그대로 반환하고,
 * {@code /health}는 요청마다 Supplier에서 최신 스냅샷을 읽어 JSON으로 반환합니다.
 * 그 외 경로는 404로 응답합니다.</p>
 *
 * <pre>{@code
 * PrometheusMeterRegistry registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
 * ResilientClient client = new ResilientClient(transport, settings, ScoreExtractor.none(), Clock.system(), registry);
 * try (MetricsHttpServer server = new MetricsHttpServer(9090, registry, client::metrics, client::health)) {
 *     server.start();
 *     client.runBatch(items, token);
 * }
 * }</pre>
 *
 * @author VoiceGuard Team
 * @since 1.0.0
 */
public final class MetricsHttpServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsHttpServer.class);

    private final HttpServer server;
    private final PrometheusMeterRegistry registry;
    private final Supplier<MetricsSnapshot> metrics;
    private final Supplier<HealthSnapshot> health;
    private final HealthJsonFormatter healthFormatter = new HealthJsonFormatter();

    /**
     * 생성자. 포트를 바인딩하지만 {@link #start()} 전에는 요청을 처리하지 않습니다.
     *
     * @param port 포트 (0이면 임의 포트)
     * @param registry {@code /metrics}로 노출할 Prometheus 레지스트리
     * @param metrics {@code /health} 본문에 포함할 메트릭 공급자
     * @param health 헬스 공급자
     * @throws UncheckedIOException 포트 바인딩 실패 시
     */
    public MetricsHttpServer(
        int port,
        PrometheusMeterRegistry registry,
        Supplier<MetricsSnapshot> metrics,
        Supplier<HealthSnapshot> health
    ) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException("port must be between 0 and 65535 (current: " + port + ")");
        }
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (metrics == null || health == null) {
            throw new IllegalArgumentException("metrics and health suppliers cannot be null");
        }
        this.registry = registry;
        this.metrics = metrics;
        this.health = health;
        try {
            this.server = HttpServer.create(new InetSocketAddress(port), 0);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to bind metrics server on port " + port, e);
        }
        this.server.createContext("/", this::handle);
    }

    public void start() {
        server.start();
        log.info("Metrics server started on port {}", port());
    }

    /**
     * 실제 바인딩된 포트.
     *
     * @return 포트
     */
    public int port() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(0);
        log.info("Metrics server stopped");
    }

    private void handle(HttpExchange exchange) throws IOException {
        try {
            String path = exchange.getRequestURI().getPath();
            if (!"GET".equals(exchange.getRequestMethod())) {
                respond(exchange, 405, "text/plain; charset=utf-8", "Method not allowed");
                return;
            }
            switch (path) {
                case "/metrics" -> respond(exchange, 200, TextFormat.CONTENT_TYPE_004, registry.scrape());
                case "/health" -> respond(exchange, 200, HealthJsonFormatter.CONTENT_TYPE,
                    healthFormatter.format(health.get(), metrics.get()));
                default -> respond(exchange, 404, "text/plain; charset=utf-8", "Not found");
            }
        } catch (RuntimeException e) {
            log.error("Failed to serve {}", exchange.getRequestURI(), e);
            throw e;
        } finally {
            exchange.close();
        }
    }

    private static void respond(HttpExchange exchange, int status, String contentType, String body)
        throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }
}
