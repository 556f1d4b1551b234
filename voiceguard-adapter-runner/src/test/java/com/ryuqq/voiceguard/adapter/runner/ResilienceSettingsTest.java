package com.ryuqq.voiceguard.adapter.runner;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ResilienceSettings 테스트.
 *
 * @author VoiceGuard Team
 * @since 1.0.0
 */
@DisplayName("ResilienceSettings 테스트")
class ResilienceSettingsTest {

    @Test
    @DisplayName("기본값")
    void 기본값() {
        ResilienceSettings settings = new ResilienceSettings();

        assertThat(settings.ratePerSecond()).isEqualTo(10.0);
        assertThat(settings.burstCapacity()).isEqualTo(10);
        assertThat(settings.failureThreshold()).isEqualTo(5);
        assertThat(settings.successThreshold()).isEqualTo(2);
        assertThat(settings.recoveryTimeoutMs()).isEqualTo(60_000L);
        assertThat(settings.maxAttempts()).isEqualTo(4);
        assertThat(settings.baseDelayMs()).isEqualTo(1_000L);
        assertThat(settings.maxDelayMs()).isEqualTo(30_000L);
        assertThat(settings.concurrency()).isEqualTo(5);
        assertThat(settings.perRequestTimeoutMs()).isEqualTo(30_000L);
        assertThat(settings.admissionTimeoutMs()).isZero();
        assertThat(settings.toExecutorConfig().admissionTimeoutMs()).isZero();
    }

    @Test
    @DisplayName("빈 환경이면 기본값을 사용한다")
    void 빈_환경() {
        assertThat(ResilienceSettings.fromEnvironment(Map.of())).isEqualTo(new ResilienceSettings());
    }

    @Test
    @DisplayName("환경 변수 값을 해석하고 공백 값은 기본값으로 대체한다")
    void 환경_변수_해석() {
        // given
        Map<String, String> env = new HashMap<>();
        env.put(ResilienceSettings.RATE_PER_SECOND, "2.5");
        env.put(ResilienceSettings.BURST_CAPACITY, " 20 ");
        env.put(ResilienceSettings.FAILURE_THRESHOLD, "3");
        env.put(ResilienceSettings.MAX_ATTEMPTS, "6");
        env.put(ResilienceSettings.CONCURRENCY, "8");
        env.put(ResilienceSettings.REQUEST_TIMEOUT_MS, "5000");
        env.put(ResilienceSettings.BASE_DELAY_MS, "");
        env.put(ResilienceSettings.ADMISSION_TIMEOUT_MS, "2500");

        // when
        ResilienceSettings settings = ResilienceSettings.fromEnvironment(env);

        // then
        assertThat(settings.ratePerSecond()).isEqualTo(2.5);
        assertThat(settings.burstCapacity()).isEqualTo(20);
        assertThat(settings.failureThreshold()).isEqualTo(3);
        assertThat(settings.maxAttempts()).isEqualTo(6);
        assertThat(settings.concurrency()).isEqualTo(8);
        assertThat(settings.perRequestTimeoutMs()).isEqualTo(5_000L);
        assertThat(settings.baseDelayMs()).isEqualTo(1_000L);
        assertThat(settings.toBatchConfig().concurrency()).isEqualTo(8);
        assertThat(settings.toExecutorConfig().perRequestTimeoutMs()).isEqualTo(5_000L);
        assertThat(settings.toRetryConfig().maxAttempts()).isEqualTo(6);
        assertThat(settings.admissionTimeoutMs()).isEqualTo(2_500L);
        assertThat(settings.toExecutorConfig().admissionTimeoutMs()).isEqualTo(2_500L);
    }

    @Test
    @DisplayName("해석할 수 없는 값은 키 이름과 함께 거부된다")
    void 잘못된_값() {
        Map<String, String> env = Map.of(ResilienceSettings.BURST_CAPACITY, "ten");

        assertThatThrownBy(() -> ResilienceSettings.fromEnvironment(env))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining(ResilienceSettings.BURST_CAPACITY)
            .hasMessageContaining("ten");
    }

    @Test
    @DisplayName("범위를 벗어난 값은 생성 시점에 거부된다")
    void 범위_검증() {
        ResilienceSettings settings = new ResilienceSettings();

        assertThatThrownBy(() -> settings.withRateLimit(0.0, 5))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> settings.withCircuitBreaker(0, 2, 1_000L))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> settings.withRetry(0, 10, 100))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> settings.withConcurrency(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("concurrency");
        assertThatThrownBy(() -> settings.withPerRequestTimeoutMs(0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> settings.withAdmissionTimeoutMs(-1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("admissionTimeoutMs");
        assertThatThrownBy(() -> ResilienceSettings.fromEnvironment(
            Map.of(ResilienceSettings.FAILURE_THRESHOLD, "-1")))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
