package com.ryuqq.voiceguard.application.batch;

/**
 * 성공 응답의 위험도 분포.
 *
 * @param high HIGH 건수
 * @param medium MEDIUM 건수
 * @param low LOW 건수
 * @author VoiceGuard Team
 * @since 1.0.0
 */
public record RiskDistribution(long high, long medium, long low) {

    public RiskDistribution {
        if (high < 0 || medium < 0 || low < 0) {
            throw new IllegalArgumentException(
                "risk counts cannot be negative (high: " + high + ", medium: " + medium + ", low: " + low + ")"
            );
        }
    }

    public static RiskDistribution empty() {
        return new RiskDistribution(0, 0, 0);
    }

    /**
     * 점수 1건을 더한 새 분포.
     *
     * @param score Deepfake 점수
     * @return 새 RiskDistribution
     */
    public RiskDistribution plus(double score) {
        return switch (RiskLevel.of(score)) {
            case HIGH -> new RiskDistribution(high + 1, medium, low);
            case MEDIUM -> new RiskDistribution(high, medium + 1, low);
            case LOW -> new RiskDistribution(high, medium, low + 1);
        };
    }

    public long total() {
        return high + medium + low;
    }
}
