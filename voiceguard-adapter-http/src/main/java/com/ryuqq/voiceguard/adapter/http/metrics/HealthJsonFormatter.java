package com.ryuqq.voiceguard.adapter.http.metrics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.voiceguard.core.metrics.HealthSnapshot;
import com.ryuqq.voiceguard.core.metrics.MetricsSnapshot;
import com.ryuqq.voiceguard.core.protection.CircuitBreakerState;

import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * HealthSnapshot을 JSON으로 변환합니다.
 *
 * <pre>{@code
 * {
 *   "status": "degraded",
 *   "circuit_breaker": "open",
 *   "breakers": {"deepfake": "open"},
 *   "metrics": {"files_processed": 5, ...}
 * }
 * }</pre>
 *
 * @author VoiceGuard Team
 * @since 1.0.0
 */
public final class HealthJsonFormatter {

    public static final String CONTENT_TYPE = "application/json; charset=utf-8";

    private final ObjectMapper objectMapper;

    public HealthJsonFormatter() {
        this(new ObjectMapper());
    }

    public HealthJsonFormatter(ObjectMapper objectMapper) {
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        this.objectMapper = objectMapper;
    }

    /**
     * 헬스 변환.
     *
     * @param health 헬스 스냅샷
     * @param metrics 함께 내보낼 메트릭 (null이면 생략)
     * @return JSON 문자열
     * @throws UncheckedIOException 직렬화 실패 시
     */
    public String format(HealthSnapshot health, MetricsSnapshot metrics) {
        if (health == null) {
            throw new IllegalArgumentException("health cannot be null");
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", lower(health.status().name()));
        body.put("circuit_breaker", lower(health.circuitBreakerState().name()));

        Map<String, String> breakers = new LinkedHashMap<>();
        for (Map.Entry<String, CircuitBreakerState> entry : health.breakers().entrySet()) {
            breakers.put(entry.getKey(), lower(entry.getValue().name()));
        }
        body.put("breakers", breakers);

        if (metrics != null) {
            Map<String, Object> values = new LinkedHashMap<>();
            values.put("files_processed", metrics.filesProcessed());
            values.put("files_succeeded", metrics.filesSucceeded());
            values.put("files_failed", metrics.filesFailed());
            values.put("retries", metrics.retryCount());
            values.put("circuit_breaker_trips", metrics.breakerTrips());
            values.put("rate_limited", metrics.rateLimited());
            values.put("cancelled", metrics.cancelled());
            values.put("avg_latency_ms", metrics.avgLatencyMs());
            body.put("metrics", values);
        }

        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize health snapshot", e);
        }
    }

    private static String lower(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
