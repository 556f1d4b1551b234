package com.ryuqq.voiceguard.core.time;

/**
 * JVM 시스템 시계 기반 Clock.
 *
 * @author VoiceGuard Team
 * @since 1.0.0
 */
final class SystemClock implements Clock {

    static final SystemClock INSTANCE = new SystemClock();

    private SystemClock() {
    }

    @Override
    public long nanoTime() {
        return System.nanoTime();
    }

    @Override
    public void sleep(long millis) throws InterruptedException {
        if (millis > 0) {
            Thread.sleep(millis);
        }
    }
}
