package com.ryuqq.voiceguard.core.retry;

/**
 * 논리 요청 하나의 재시도 진행 상태.
 *
 * <p>요청마다 생성되어 종료 시 버려집니다. 한 워커 스레드만 사용하므로 동기화하지 않습니다.</p>
 *
 * @author VoiceGuard Team
 * @since 1.0.0
 */
public final class RetryContext {

    private final int maxAttempts;
    private int attempt;
    private FailureKind lastError;
    private String lastErrorDetail;

    /**
     * 생성자.
     *
     * @param maxAttempts 최대 시도 횟수 (1 이상)
     * @throws IllegalArgumentException maxAttempts가 1 미만인 경우
     */
    public RetryContext(int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1 (current: " + maxAttempts + ")");
        }
        this.maxAttempts = maxAttempts;
    }

    /**
     * 새 시도 시작.
     *
     * @return 시작한 시도 번호 (1부터)
     * @throws IllegalStateException 이미 maxAttempts만큼 시도한 경우
     */
    public int beginAttempt() {
        if (attempt >= maxAttempts) {
            throw new IllegalStateException("attempts exhausted (maxAttempts: " + maxAttempts + ")");
        }
        return ++attempt;
    }

    /**
     * 현재 시도의 실패 기록.
     *
     * @param kind 실패 분류
     * @param detail 실패 상세 (null 가능)
     */
    public void recordFailure(FailureKind kind, String detail) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        this.lastError = kind;
        this.lastErrorDetail = detail;
    }

    /**
     * 남은 시도가 있는지 확인.
     *
     * @return attempt &lt; maxAttempts이면 true
     */
    public boolean hasAttemptsRemaining() {
        return attempt < maxAttempts;
    }

    public int attempt() {
        return attempt;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    /**
     * 마지막 실패 분류.
     *
     * @return 실패 분류, 아직 실패가 없으면 null
     */
    public FailureKind lastError() {
        return lastError;
    }

    public String lastErrorDetail() {
        return lastErrorDetail;
    }
}
