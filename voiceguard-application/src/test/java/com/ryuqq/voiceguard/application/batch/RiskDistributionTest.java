package com.ryuqq.voiceguard.application.batch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * RiskLevel, RiskDistribution 테스트.
 *
 * @author VoiceGuard Team
 * @since 1.0.0
 */
@DisplayName("RiskDistribution 테스트")
class RiskDistributionTest {

    @Test
    @DisplayName("0.7 초과는 HIGH, 0.4 초과는 MEDIUM, 나머지는 LOW")
    void 위험도_구간() {
        assertThat(RiskLevel.of(0.95)).isEqualTo(RiskLevel.HIGH);
        assertThat(RiskLevel.of(0.7)).isEqualTo(RiskLevel.MEDIUM);
        assertThat(RiskLevel.of(0.41)).isEqualTo(RiskLevel.MEDIUM);
        assertThat(RiskLevel.of(0.4)).isEqualTo(RiskLevel.LOW);
        assertThat(RiskLevel.of(0.0)).isEqualTo(RiskLevel.LOW);
    }

    @Test
    @DisplayName("plus()는 해당 구간만 1 증가시킨 새 분포를 반환한다")
    void plus_구간_증가() {
        // given
        RiskDistribution empty = RiskDistribution.empty();

        // when
        RiskDistribution distribution = empty.plus(0.9).plus(0.5).plus(0.1).plus(0.2);

        // then
        assertThat(distribution).isEqualTo(new RiskDistribution(1, 1, 2));
        assertThat(distribution.total()).isEqualTo(4);
        assertThat(empty.total()).isZero();
    }
}
