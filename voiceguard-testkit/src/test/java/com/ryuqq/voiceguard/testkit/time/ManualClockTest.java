package com.ryuqq.voiceguard.testkit.time;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ManualClock 테스트")
class ManualClockTest {

    @Test
    @DisplayName("sleep은 실제로 대기하지 않고 시계를 진행시키며 기록된다")
    void sleep_시계_진행() throws InterruptedException {
        ManualClock clock = new ManualClock(1_000L);

        clock.sleep(250);
        clock.sleep(0);
        clock.advance(Duration.ofMillis(50));

        assertThat(clock.nanoTime()).isEqualTo(1_000L + 300_000_000L);
        assertThat(clock.sleeps()).containsExactly(250L);
        assertThat(clock.totalSleptMillis()).isEqualTo(250L);
    }

    @Test
    @DisplayName("인터럽트된 스레드의 sleep은 InterruptedException을 던지고 플래그를 소비한다")
    void 인터럽트() {
        ManualClock clock = new ManualClock();
        Thread.currentThread().interrupt();

        assertThatThrownBy(() -> clock.sleep(10)).isInstanceOf(InterruptedException.class);
        assertThat(Thread.currentThread().isInterrupted()).isFalse();
        assertThat(clock.sleeps()).isEmpty();
    }

    @Test
    @DisplayName("음수 진행은 거부된다")
    void 음수_진행() {
        assertThatThrownBy(() -> new ManualClock().advance(Duration.ofMillis(-1)))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
