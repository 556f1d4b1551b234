package com.ryuqq.voiceguard.core.cancel;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 외부 취소 신호.
 *
 * <p>배치 실행 전체 또는 개별 요청을 외부에서 취소할 때 사용합니다.
 * 취소는 한 번만 일어나며 되돌릴 수 없습니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>{@link #cancel()}: 취소 상태로 전이하고 등록된 콜백을 호출 (최초 1회만)</li>
 *   <li>{@link #isCancelled()}: 재시도 루프가 매 시도 전에 확인</li>
 *   <li>{@link #onCancel(Runnable)}: 이미 취소된 상태라면 콜백을 즉시 실행</li>
 * </ul>
 *
 * @author VoiceGuard Team
 * @since 1.0.0
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    /**
     * 취소되지 않은 새 토큰 생성.
     *
     * @return CancellationToken 인스턴스
     */
    public static CancellationToken create() {
        return new CancellationToken();
    }

    /**
     * 취소 요청.
     *
     * @return 이번 호출로 취소 상태가 되었으면 true, 이미 취소되어 있었으면 false
     */
    public boolean cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        for (Runnable callback : callbacks) {
            callback.run();
        }
        return true;
    }

    /**
     * 취소 여부 확인.
     *
     * @return 취소되었으면 true
     */
    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * 취소 콜백 등록.
     *
     * @param callback 취소 시 실행할 콜백
     * @return 콜백 등록 해제 핸들
     * @throws IllegalArgumentException callback이 null인 경우
     */
    public Registration onCancel(Runnable callback) {
        if (callback == null) {
            throw new IllegalArgumentException("callback cannot be null");
        }
        callbacks.add(callback);
        // cancel()과 경합한 경우에도 콜백이 최소 한 번은 실행되도록 재확인
        if (cancelled.get() && callbacks.remove(callback)) {
            callback.run();
        }
        return () -> callbacks.remove(callback);
    }

    /**
     * 취소 콜백 등록 해제 핸들.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {

        /**
         * 콜백 등록 해제.
         */
        @Override
        void close();
    }
}
