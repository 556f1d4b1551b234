package com.ryuqq.voiceguard.core.protection;

/**
 * Rate Limiter 설정.
 *
 * <p>Token Bucket의 충전 속도와 버킷 크기를 정의합니다.
 * 잘못된 값은 생성 시점에 즉시 거부됩니다.</p>
 *
 * @param ratePerSecond 초당 토큰 충전 속도 (예: 10.0)
 * @param burstCapacity 버킷 최대 토큰 수 (1 이상)
 * @author VoiceGuard Team
 * @since 1.0.0
 */
public record RateLimiterConfig(double ratePerSecond, int burstCapacity) {

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException if ratePerSecond is not positive or not finite
     * @throws IllegalArgumentException if burstCapacity is less than 1
     */
    public RateLimiterConfig {
        if (!(ratePerSecond > 0) || Double.isInfinite(ratePerSecond)) {
            throw new IllegalArgumentException(
                "ratePerSecond must be positive and finite (current: " + ratePerSecond + ")"
            );
        }
        if (burstCapacity < 1) {
            throw new IllegalArgumentException(
                "burstCapacity must be >= 1 (current: " + burstCapacity + ")"
            );
        }
    }

    /**
     * 버스트 용량을 충전 속도와 같게 설정한 인스턴스 생성.
     *
     * @param ratePerSecond 초당 토큰 충전 속도
     * @return RateLimiterConfig 인스턴스
     */
    public static RateLimiterConfig of(double ratePerSecond) {
        return new RateLimiterConfig(ratePerSecond, Math.max(1, (int) Math.ceil(ratePerSecond)));
    }

    /**
     * burstCapacity만 변경한 새 인스턴스 생성.
     *
     * @param burstCapacity 새로운 버스트 용량
     * @return 새 RateLimiterConfig 인스턴스
     */
    public RateLimiterConfig withBurstCapacity(int burstCapacity) {
        return new RateLimiterConfig(ratePerSecond, burstCapacity);
    }
}
