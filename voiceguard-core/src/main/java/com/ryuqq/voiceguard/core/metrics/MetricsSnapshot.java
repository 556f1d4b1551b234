package com.ryuqq.voiceguard.core.metrics;

/**
 * 메트릭 스냅샷.
 *
 * <p>filesProcessed는 취소를 제외한 모든 종료 결과 수이며,
 * filesSucceeded + filesFailed + breakerTrips + rateLimited와 같습니다.</p>
 *
 * @param filesProcessed 처리 완료 수 (취소 제외)
 * @param filesSucceeded 성공 수
 * @param filesFailed 실패 수 (재시도 소진 + 치명적 오류)
 * @param retryCount 재시도 누적 횟수
 * @param breakerTrips Circuit Breaker 차단으로 끝난 요청 수
 * @param rateLimited Rate Limiter 거부로 끝난 요청 수
 * @param cancelled 취소된 요청 수
 * @param avgLatencyMs 성공 요청의 평균 지연 (밀리초)
 * @author VoiceGuard Team
 * @since 1.0.0
 */
public record MetricsSnapshot(
    long filesProcessed,
    long filesSucceeded,
    long filesFailed,
    long retryCount,
    long breakerTrips,
    long rateLimited,
    long cancelled,
    double avgLatencyMs
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 음수 값이 있는 경우
     */
    public MetricsSnapshot {
        if (filesProcessed < 0 || filesSucceeded < 0 || filesFailed < 0 || retryCount < 0
            || breakerTrips < 0 || rateLimited < 0 || cancelled < 0 || avgLatencyMs < 0) {
            throw new IllegalArgumentException("metrics cannot be negative");
        }
    }

    /**
     * 모든 값이 0인 스냅샷.
     *
     * @return 빈 스냅샷
     */
    public static MetricsSnapshot empty() {
        return new MetricsSnapshot(0, 0, 0, 0, 0, 0, 0, 0.0);
    }
}
