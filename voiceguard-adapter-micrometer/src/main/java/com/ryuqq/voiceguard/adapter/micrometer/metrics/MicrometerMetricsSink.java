package com.ryuqq.voiceguard.adapter.micrometer.metrics;

import com.ryuqq.voiceguard.core.metrics.MetricsSink;
import com.ryuqq.voiceguard.core.metrics.MetricsSnapshot;
import com.ryuqq.voiceguard.core.outcome.RequestOutcome;
import com.ryuqq.voiceguard.core.protection.CircuitBreaker;
import com.ryuqq.voiceguard.core.protection.CircuitBreakerState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.function.ToLongFunction;

/**
 * {@link MetricsSink} backed by Micrometer meters.
 *
 * <p>Every meter carries an {@code endpoint} tag. Meters for an endpoint are registered the first
 * time that endpoint reports and are cached afterwards, so recording is a map lookup plus a
 * Micrometer increment and never blocks other workers.</p>
 *
 * <p><strong>Meters:</strong></p>
 * <ul>
 *   <li><strong>voiceguard.files.processed:</strong> every terminal outcome</li>
 *   <li><strong>voiceguard.files.succeeded / voiceguard.files.failed:</strong> SUCCESS, and
 *       MAX_RETRIES_EXCEEDED + FATAL_CLIENT_ERROR</li>
 *   <li><strong>voiceguard.circuit.breaker.trips / voiceguard.rate.limited / voiceguard.cancelled:</strong>
 *       one per matching terminal reason</li>
 *   <li><strong>voiceguard.retries:</strong> every backoff wait taken</li>
 *   <li><strong>voiceguard.request.latency:</strong> timer over successful outcomes</li>
 *   <li><strong>voiceguard.circuit.breaker.state:</strong> gauge per bound breaker
 *       (0=closed, 1=half_open, 2=open)</li>
 * </ul>
 *
 * <p>{@link #snapshot()} sums the cached meters of every endpoint. A snapshot taken while workers
 * are still running may mix counts from slightly different instants; once all workers have joined
 * it is exact.</p>
 *
 * @author VoiceGuard Team
 * @since 1.0.0
 */
public class MicrometerMetricsSink implements MetricsSink {

    public static final String FILES_PROCESSED = "voiceguard.files.processed";
    public static final String FILES_SUCCEEDED = "voiceguard.files.succeeded";
    public static final String FILES_FAILED = "voiceguard.files.failed";
    public static final String RETRIES = "voiceguard.retries";
    public static final String BREAKER_TRIPS = "voiceguard.circuit.breaker.trips";
    public static final String RATE_LIMITED = "voiceguard.rate.limited";
    public static final String CANCELLED = "voiceguard.cancelled";
    public static final String REQUEST_LATENCY = "voiceguard.request.latency";
    public static final String BREAKER_STATE = "voiceguard.circuit.breaker.state";

    public static final String ENDPOINT_TAG = "endpoint";
    static final String UNKNOWN_ENDPOINT = "unknown";

    private final MeterRegistry registry;
    private final ConcurrentHashMap<String, EndpointMeters> meters = new ConcurrentHashMap<>();

    /**
     * Creates a sink on a private {@link SimpleMeterRegistry}.
     */
    public MicrometerMetricsSink() {
        this(new SimpleMeterRegistry());
    }

    /**
     * Creates a sink that registers its meters on the given registry.
     *
     * @param registry meter registry, e.g. a Prometheus registry scraped over HTTP
     * @throws IllegalArgumentException if registry is null
     */
    public MicrometerMetricsSink(MeterRegistry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        this.registry = registry;
    }

    @Override
    public void recordRetry(String endpoint) {
        metersFor(endpoint).retries.increment();
    }

    @Override
    public void recordOutcome(String endpoint, RequestOutcome outcome) {
        if (outcome == null) {
            throw new IllegalArgumentException("outcome cannot be null");
        }
        EndpointMeters endpointMeters = metersFor(endpoint);
        endpointMeters.processed.increment();

        switch (outcome.terminalReason()) {
            case SUCCESS -> {
                endpointMeters.succeeded.increment();
                endpointMeters.latency.record(outcome.totalLatency());
            }
            case MAX_RETRIES_EXCEEDED, FATAL_CLIENT_ERROR -> endpointMeters.failed.increment();
            case BREAKER_OPEN -> endpointMeters.breakerTrips.increment();
            case RATE_LIMITED -> endpointMeters.rateLimited.increment();
            case CANCELLED -> endpointMeters.cancelled.increment();
        }
    }

    @Override
    public MetricsSnapshot snapshot() {
        long successCount = 0L;
        double successLatencyMs = 0.0;
        for (EndpointMeters endpointMeters : meters.values()) {
            successCount += endpointMeters.latency.count();
            successLatencyMs += endpointMeters.latency.totalTime(TimeUnit.MILLISECONDS);
        }
        double avgLatencyMs = successCount == 0 ? 0.0 : successLatencyMs / successCount;

        return new MetricsSnapshot(
            sum(m -> count(m.processed)),
            sum(m -> count(m.succeeded)),
            sum(m -> count(m.failed)),
            sum(m -> count(m.retries)),
            sum(m -> count(m.breakerTrips)),
            sum(m -> count(m.rateLimited)),
            sum(m -> count(m.cancelled)),
            avgLatencyMs
        );
    }

    /**
     * Registers a state gauge for the breaker, tagged with its name.
     *
     * <p>The gauge holds a strong reference to the breaker, so it keeps reporting for as long as
     * the registry lives. Binding the same breaker name twice keeps the first gauge.</p>
     *
     * @param breaker circuit breaker to expose
     * @throws IllegalArgumentException if breaker is null
     */
    public void bindCircuitBreaker(CircuitBreaker breaker) {
        if (breaker == null) {
            throw new IllegalArgumentException("breaker cannot be null");
        }
        Gauge.builder(BREAKER_STATE, breaker, b -> stateValue(b.getState()))
            .description("Circuit breaker state (0=closed, 1=half_open, 2=open)")
            .tag(ENDPOINT_TAG, breaker.name())
            .strongReference(true)
            .register(registry);
    }

    /**
     * Terminal outcomes recorded per endpoint.
     *
     * @return endpoint name to count, sorted by name
     */
    public Map<String, Long> processedByEndpoint() {
        Map<String, Long> counts = new TreeMap<>();
        meters.forEach((endpoint, endpointMeters) -> counts.put(endpoint, count(endpointMeters.processed)));
        return Collections.unmodifiableMap(counts);
    }

    public MeterRegistry registry() {
        return registry;
    }

    static int stateValue(CircuitBreakerState state) {
        return switch (state) {
            case CLOSED -> 0;
            case HALF_OPEN -> 1;
            case OPEN -> 2;
        };
    }

    private EndpointMeters metersFor(String endpoint) {
        String tag = endpoint == null || endpoint.isBlank() ? UNKNOWN_ENDPOINT : endpoint;
        return meters.computeIfAbsent(tag, key -> new EndpointMeters(registry, key));
    }

    private long sum(ToLongFunction<EndpointMeters> reader) {
        long total = 0L;
        for (EndpointMeters endpointMeters : meters.values()) {
            total += reader.applyAsLong(endpointMeters);
        }
        return total;
    }

    private static long count(Counter counter) {
        return (long) counter.count();
    }

    /**
     * Meters registered for one endpoint.
     */
    private static final class EndpointMeters {

        private final Counter processed;
        private final Counter succeeded;
        private final Counter failed;
        private final Counter retries;
        private final Counter breakerTrips;
        private final Counter rateLimited;
        private final Counter cancelled;
        private final Timer latency;

        private EndpointMeters(MeterRegistry registry, String endpoint) {
            this.processed = counter(registry, FILES_PROCESSED, "Total number of files processed", endpoint);
            this.succeeded = counter(registry, FILES_SUCCEEDED, "Total number of successfully processed files", endpoint);
            this.failed = counter(registry, FILES_FAILED, "Total number of failed files", endpoint);
            this.retries = counter(registry, RETRIES, "Total number of retries", endpoint);
            this.breakerTrips = counter(registry, BREAKER_TRIPS, "Requests rejected by an open circuit breaker", endpoint);
            this.rateLimited = counter(registry, RATE_LIMITED, "Requests rejected by the rate limiter", endpoint);
            this.cancelled = counter(registry, CANCELLED, "Requests cancelled before completion", endpoint);
            this.latency = Timer.builder(REQUEST_LATENCY)
                .description("Latency of successful requests, retries and backoff included")
                .tag(ENDPOINT_TAG, endpoint)
                .register(registry);
        }

        private static Counter counter(MeterRegistry registry, String name, String description, String endpoint) {
            return Counter.builder(name)
                .description(description)
                .tag(ENDPOINT_TAG, endpoint)
                .register(registry);
        }
    }
}
