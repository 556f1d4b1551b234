package com.ryuqq.voiceguard.application.retry;

import com.ryuqq.voiceguard.core.retry.FailureKind;
import com.ryuqq.voiceguard.core.transport.TransportException;

/**
 * Transport 실패 분류기.
 *
 * <ul>
 *   <li>RETRYABLE: 5xx, 429, 타임아웃, 연결 실패, 일시적 네트워크 오류</li>
 *   <li>FATAL: 429를 제외한 4xx, 분류할 수 없는 오류</li>
 * </ul>
 *
 * @author VoiceGuard Team
 * @since 1.0.0
 */
public final class FailureClassifier {

    private static final int TOO_MANY_REQUESTS = 429;

    private FailureClassifier() {
    }

    /**
     * Transport 예외 분류.
     *
     * @param exception Transport 예외
     * @return RETRYABLE 또는 FATAL
     * @throws IllegalArgumentException exception이 null인 경우
     */
    public static FailureKind classify(TransportException exception) {
        if (exception == null) {
            throw new IllegalArgumentException("exception cannot be null");
        }
        return switch (exception.getType()) {
            case TIMEOUT, CONNECTION, NETWORK -> FailureKind.RETRYABLE;
            case HTTP_STATUS -> classifyStatus(exception.getStatusCode());
            case UNKNOWN -> FailureKind.FATAL;
        };
    }

    /**
     * HTTP 상태 코드 분류.
     *
     * @param statusCode HTTP 상태 코드
     * @return RETRYABLE 또는 FATAL
     */
    public static FailureKind classifyStatus(int statusCode) {
        if (statusCode >= 500 && statusCode <= 599) {
            return FailureKind.RETRYABLE;
        }
        if (statusCode == TOO_MANY_REQUESTS) {
            return FailureKind.RETRYABLE;
        }
        return FailureKind.FATAL;
    }
}
