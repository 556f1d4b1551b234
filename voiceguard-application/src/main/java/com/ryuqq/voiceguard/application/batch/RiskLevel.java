package com.ryuqq.voiceguard.application.batch;

/**
 * Deepfake 점수 위험도 구간.
 *
 * <ul>
 *   <li>HIGH: score &gt; 0.7</li>
 *   <li>MEDIUM: 0.4 &lt; score ≤ 0.7</li>
 *   <li>LOW: score ≤ 0.4</li>
 * </ul>
 *
 * @author VoiceGuard Team
 * @since 1.0.0
 */
public enum RiskLevel {

    HIGH,
    MEDIUM,
    LOW;

    private static final double HIGH_THRESHOLD = 0.7;
    private static final double MEDIUM_THRESHOLD = 0.4;

    /**
     * 점수의 위험도 구간.
     *
     * @param score Deepfake 점수
     * @return 위험도 구간
     */
    public static RiskLevel of(double score) {
        if (score > HIGH_THRESHOLD) {
            return HIGH;
        }
        if (score > MEDIUM_THRESHOLD) {
            return MEDIUM;
        }
        return LOW;
    }
}
