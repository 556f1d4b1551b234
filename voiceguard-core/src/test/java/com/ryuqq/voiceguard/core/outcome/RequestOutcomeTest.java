package com.ryuqq.voiceguard.core.outcome;

import com.ryuqq.voiceguard.core.transport.TransportResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * RequestOutcome 테스트.
 *
 * @author VoiceGuard Team
 * @since 1.0.0
 */
@DisplayName("RequestOutcome 테스트")
class RequestOutcomeTest {

    @Test
    @DisplayName("성공 결과는 응답을 포함한다")
    void success_응답_포함() {
        // when
        RequestOutcome outcome = RequestOutcome.success(2, 1, Duration.ofMillis(120), TransportResponse.ok("{}"));

        // then
        assertThat(outcome.succeeded()).isTrue();
        assertThat(outcome.terminalReason()).isEqualTo(TerminalReason.SUCCESS);
        assertThat(outcome.response().bodyAsString()).isEqualTo("{}");
        assertThat(outcome.errorDetail()).isNull();
    }

    @Test
    @DisplayName("SUCCESS가 아닌 결과에는 응답이 없다")
    void 실패_결과_응답_없음() {
        // when
        RequestOutcome outcome = RequestOutcome.of(
            TerminalReason.FATAL_CLIENT_ERROR, 1, 0, Duration.ofMillis(5), "HTTP 400");

        // then
        assertThat(outcome.succeeded()).isFalse();
        assertThat(outcome.response()).isNull();
        assertThat(outcome.terminalReason().isFailure()).isTrue();
        assertThat(outcome.terminalReason().isRejection()).isFalse();
    }

    @Test
    @DisplayName("시작 전 취소 결과는 시도 0회, 지연 0이다")
    void 시작_전_취소() {
        // when
        RequestOutcome outcome = RequestOutcome.cancelledBeforeStart();

        // then
        assertThat(outcome.terminalReason()).isEqualTo(TerminalReason.CANCELLED);
        assertThat(outcome.attemptsUsed()).isZero();
        assertThat(outcome.totalLatency()).isEqualTo(Duration.ZERO);
    }

    @Test
    @DisplayName("불변식을 어기는 결과는 생성할 수 없다")
    void 불변식_검증() {
        assertThatThrownBy(() -> RequestOutcome.success(1, 0, Duration.ZERO, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("response is required");

        assertThatThrownBy(() -> new RequestOutcome(
            TerminalReason.BREAKER_OPEN, 1, 0, Duration.ZERO, TransportResponse.ok("{}"), null))
            .isInstanceOf(IllegalArgumentException.class);

        assertThatThrownBy(() -> RequestOutcome.of(TerminalReason.MAX_RETRIES_EXCEEDED, 1, 2, Duration.ZERO, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("retries");

        assertThatThrownBy(() -> RequestOutcome.of(TerminalReason.CANCELLED, 0, 0, Duration.ofMillis(-1), null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("BREAKER_OPEN과 RATE_LIMITED는 거부로 분류된다")
    void 거부_분류() {
        assertThat(TerminalReason.BREAKER_OPEN.isRejection()).isTrue();
        assertThat(TerminalReason.RATE_LIMITED.isRejection()).isTrue();
        assertThat(TerminalReason.CANCELLED.isRejection()).isFalse();
        assertThat(TerminalReason.CANCELLED.isFailure()).isFalse();
    }
}
