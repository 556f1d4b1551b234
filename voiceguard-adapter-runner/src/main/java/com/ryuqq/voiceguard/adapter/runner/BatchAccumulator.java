package com.ryuqq.voiceguard.adapter.runner;

import com.ryuqq.voiceguard.application.batch.BatchSummary;
import com.ryuqq.voiceguard.application.batch.RiskDistribution;
import com.ryuqq.voiceguard.application.batch.RiskLevel;
import com.ryuqq.voiceguard.application.batch.ScoreExtractor;
import com.ryuqq.voiceguard.core.outcome.RequestOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.OptionalDouble;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.DoubleAdder;
import java.util.concurrent.atomic.LongAdder;

/**
 * 배치 결과 누적기.
 *
 * <p>여러 워커가 동시에 {@link #record(String, RequestOutcome)}를 호출합니다.
 * 카운터는 LongAdder/DoubleAdder, 항목별 결과는 ConcurrentHashMap으로 보호되며
 * {@link #toSummary(int, Duration)}는 모든 워커가 종료된 뒤 한 번 호출됩니다.</p>
 *
 * @author VoiceGuard Team
 * @since 1.0.0
 */
final class BatchAccumulator {

    private static final Logger log = LoggerFactory.getLogger(BatchAccumulator.class);

    private static final double NANOS_PER_MILLI = 1_000_000.0;

    private final ScoreExtractor scoreExtractor;
    private final ConcurrentHashMap<String, RequestOutcome> outcomes = new ConcurrentHashMap<>();

    private final LongAdder succeeded = new LongAdder();
    private final LongAdder failed = new LongAdder();
    private final LongAdder retries = new LongAdder();
    private final LongAdder breakerTrips = new LongAdder();
    private final LongAdder rateLimited = new LongAdder();
    private final LongAdder cancelled = new LongAdder();
    private final LongAdder successLatencyNanos = new LongAdder();

    private final LongAdder scored = new LongAdder();
    private final DoubleAdder scoreSum = new DoubleAdder();
    private final LongAdder highRisk = new LongAdder();
    private final LongAdder mediumRisk = new LongAdder();
    private final LongAdder lowRisk = new LongAdder();

    BatchAccumulator(ScoreExtractor scoreExtractor) {
        if (scoreExtractor == null) {
            throw new IllegalArgumentException("scoreExtractor cannot be null");
        }
        this.scoreExtractor = scoreExtractor;
    }

    /**
     * 항목 결과 기록.
     *
     * @param itemId 항목 식별자
     * @param outcome 최종 결과
     * @throws IllegalStateException 같은 항목이 두 번 기록된 경우
     */
    void record(String itemId, RequestOutcome outcome) {
        RequestOutcome previous = outcomes.putIfAbsent(itemId, outcome);
        if (previous != null) {
            throw new IllegalStateException("outcome already recorded for item: " + itemId);
        }

        retries.add(outcome.retries());
        switch (outcome.terminalReason()) {
            case SUCCESS -> {
                succeeded.increment();
                successLatencyNanos.add(outcome.totalLatency().toNanos());
                recordScore(itemId, outcome);
            }
            case MAX_RETRIES_EXCEEDED, FATAL_CLIENT_ERROR -> failed.increment();
            case BREAKER_OPEN -> breakerTrips.increment();
            case RATE_LIMITED -> rateLimited.increment();
            case CANCELLED -> cancelled.increment();
        }
    }

    int recorded() {
        return outcomes.size();
    }

    /**
     * 누적 결과로 BatchSummary 생성.
     *
     * @param total 입력 항목 수
     * @param elapsed 배치 소요 시간
     * @return BatchSummary
     */
    BatchSummary toSummary(int total, Duration elapsed) {
        long successCount = succeeded.sum();
        double avgLatencyMs = successCount == 0
            ? 0.0
            : successLatencyNanos.sum() / NANOS_PER_MILLI / successCount;
        long scoredCount = scored.sum();
        OptionalDouble avgScore = scoredCount == 0
            ? OptionalDouble.empty()
            : OptionalDouble.of(scoreSum.sum() / scoredCount);

        return new BatchSummary(
            total,
            successCount,
            failed.sum(),
            retries.sum(),
            breakerTrips.sum(),
            rateLimited.sum(),
            cancelled.sum(),
            avgLatencyMs,
            avgScore,
            new RiskDistribution(highRisk.sum(), mediumRisk.sum(), lowRisk.sum()),
            elapsed,
            outcomes
        );
    }

    private void recordScore(String itemId, RequestOutcome outcome) {
        OptionalDouble score;
        try {
            score = scoreExtractor.extract(outcome.response());
        } catch (RuntimeException e) {
            log.warn("Score extraction failed for item {}: {}", itemId, e.toString());
            return;
        }
        if (score.isEmpty()) {
            return;
        }

        double value = score.getAsDouble();
        scored.increment();
        scoreSum.add(value);
        switch (RiskLevel.of(value)) {
            case HIGH -> highRisk.increment();
            case MEDIUM -> mediumRisk.increment();
            case LOW -> lowRisk.increment();
        }
    }
}
