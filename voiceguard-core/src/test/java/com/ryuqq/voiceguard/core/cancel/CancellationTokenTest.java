package com.ryuqq.voiceguard.core.cancel;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * CancellationToken 테스트.
 *
 * @author VoiceGuard Team
 * @since 1.0.0
 */
@DisplayName("CancellationToken 테스트")
class CancellationTokenTest {

    @Test
    @DisplayName("cancel()은 최초 한 번만 true를 반환하고 콜백을 한 번 실행한다")
    void cancel_최초_1회() {
        // given
        CancellationToken token = CancellationToken.create();
        AtomicInteger calls = new AtomicInteger();
        token.onCancel(calls::incrementAndGet);

        // when
        boolean first = token.cancel();
        boolean second = token.cancel();

        // then
        assertThat(first).isTrue();
        assertThat(second).isFalse();
        assertThat(token.isCancelled()).isTrue();
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("이미 취소된 토큰에 등록한 콜백은 즉시 실행된다")
    void 취소_후_등록_즉시_실행() {
        // given
        CancellationToken token = CancellationToken.create();
        token.cancel();
        AtomicInteger calls = new AtomicInteger();

        // when
        token.onCancel(calls::incrementAndGet);

        // then
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("등록 해제한 콜백은 실행되지 않는다")
    void 등록_해제() {
        // given
        CancellationToken token = CancellationToken.create();
        AtomicInteger calls = new AtomicInteger();

        // when
        try (CancellationToken.Registration ignored = token.onCancel(calls::incrementAndGet)) {
            assertThat(token.isCancelled()).isFalse();
        }
        token.cancel();

        // then
        assertThat(calls.get()).isZero();
    }
}
