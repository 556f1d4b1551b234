package com.ryuqq.voiceguard.testkit.time;

import com.ryuqq.voiceguard.core.time.Clock;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 수동으로 진행하는 시뮬레이션 시계.
 *
 * <p>{@link #sleep(long)}은 실제로 대기하지 않고 시계를 그만큼 진행시킨 뒤 즉시 반환합니다.
 * 따라서 backoff와 토큰 충전을 실제 시간 경과 없이 결정적으로 검증할 수 있습니다.</p>
 *
 * <p><strong>주의:</strong> 여러 스레드가 동시에 sleep하면 각자의 대기 시간이 모두 누적되어
 * 시계가 진행합니다. 동시성 테스트에서는 sleep이 일어나지 않도록 구성하거나 이 점을 고려해야 합니다.</p>
 *
 * @author VoiceGuard Team
 * @since 1.0.0
 */
public final class ManualClock implements Clock {

    private final AtomicLong nanos;
    private final List<Long> sleeps = new CopyOnWriteArrayList<>();

    /**
     * 0에서 시작하는 시계 생성.
     */
    public ManualClock() {
        this(0L);
    }

    /**
     * 지정한 시각에서 시작하는 시계 생성.
     *
     * @param startNanos 시작 시각 (나노초)
     */
    public ManualClock(long startNanos) {
        this.nanos = new AtomicLong(startNanos);
    }

    @Override
    public long nanoTime() {
        return nanos.get();
    }

    @Override
    public void sleep(long millis) throws InterruptedException {
        if (Thread.interrupted()) {
            throw new InterruptedException("sleep interrupted");
        }
        if (millis <= 0) {
            return;
        }
        sleeps.add(millis);
        advanceMillis(millis);
    }

    /**
     * 시계를 지정한 밀리초만큼 진행.
     *
     * @param millis 진행할 시간 (밀리초, 0 이상)
     */
    public void advanceMillis(long millis) {
        advance(Duration.ofMillis(millis));
    }

    /**
     * 시계를 지정한 시간만큼 진행.
     *
     * @param duration 진행할 시간 (음수 불가)
     * @throws IllegalArgumentException duration이 null이거나 음수인 경우
     */
    public void advance(Duration duration) {
        if (duration == null || duration.isNegative()) {
            throw new IllegalArgumentException("duration cannot be null or negative");
        }
        nanos.addAndGet(duration.toNanos());
    }

    /**
     * 지금까지 요청된 sleep 시간 목록.
     *
     * @return sleep 시간 목록 (밀리초, 호출 순서)
     */
    public List<Long> sleeps() {
        return List.copyOf(sleeps);
    }

    /**
     * 지금까지 요청된 sleep 시간의 합.
     *
     * @return 총 sleep 시간 (밀리초)
     */
    public long totalSleptMillis() {
        return sleeps.stream().mapToLong(Long::longValue).sum();
    }
}
