package com.ryuqq.voiceguard.application.batch;

import com.ryuqq.voiceguard.core.outcome.RequestOutcome;

import java.time.Duration;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * 배치 실행 요약.
 *
 * <p>모든 항목은 정확히 한 범주에 속합니다:
 * {@code total = succeeded + failed + breakerTrips + rateLimited + cancelled}.
 * failed는 MAX_RETRIES_EXCEEDED와 FATAL_CLIENT_ERROR를 합한 값입니다.</p>
 *
 * @param total 입력 항목 수
 * @param succeeded SUCCESS 건수
 * @param failed MAX_RETRIES_EXCEEDED + FATAL_CLIENT_ERROR 건수
 * @param retryCount 전체 백오프 재시도 횟수
 * @param breakerTrips BREAKER_OPEN 건수
 * @param rateLimited RATE_LIMITED 건수
 * @param cancelled CANCELLED 건수
 * @param avgLatencyMs 성공 항목의 평균 지연 (밀리초, 성공이 없으면 0)
 * @param avgScore 점수가 추출된 성공 항목의 평균 점수
 * @param riskDistribution 점수 위험도 분포
 * @param elapsed 배치 전체 소요 시간
 * @param outcomes itemId별 결과
 * @author VoiceGuard Team
 * @since 1.0.0
 */
public record BatchSummary(
    int total,
    long succeeded,
    long failed,
    long retryCount,
    long breakerTrips,
    long rateLimited,
    long cancelled,
    double avgLatencyMs,
    OptionalDouble avgScore,
    RiskDistribution riskDistribution,
    Duration elapsed,
    Map<String, RequestOutcome> outcomes
) {

    public BatchSummary {
        if (avgScore == null || riskDistribution == null || elapsed == null || outcomes == null) {
            throw new IllegalArgumentException("avgScore, riskDistribution, elapsed and outcomes cannot be null");
        }
        long categorized = succeeded + failed + breakerTrips + rateLimited + cancelled;
        if (categorized != total) {
            throw new IllegalArgumentException(
                "outcome categories must add up to total (total: " + total + ", categorized: " + categorized + ")"
            );
        }
        if (outcomes.size() != total) {
            throw new IllegalArgumentException(
                "every item must have one outcome (total: " + total + ", outcomes: " + outcomes.size() + ")"
            );
        }
        outcomes = Map.copyOf(outcomes);
    }

    /**
     * 성공률.
     *
     * @return 성공 비율 (0.0 ~ 1.0, 항목이 없으면 0.0)
     */
    public double successRate() {
        return total == 0 ? 0.0 : (double) succeeded / total;
    }

    /**
     * 항목 결과 조회.
     *
     * @param itemId 항목 식별자
     * @return 결과 (없으면 null)
     */
    public RequestOutcome outcomeOf(String itemId) {
        return outcomes.get(itemId);
    }
}
