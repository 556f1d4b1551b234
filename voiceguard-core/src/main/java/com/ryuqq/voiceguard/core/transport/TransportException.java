package com.ryuqq.voiceguard.core.transport;

/**
 * 전송 실패.
 *
 * <p>재시도 판단에 필요한 정보(오류 유형, HTTP 상태 코드)를 담습니다.
 * HTTP_STATUS 유형이 아니면 statusCode는 {@link #NO_STATUS}입니다.</p>
 *
 * @author VoiceGuard Team
 * @since 1.0.0
 */
public class TransportException extends Exception {

    /**
     * 상태 코드 없음.
     */
    public static final int NO_STATUS = -1;

    private final TransportErrorType type;
    private final int statusCode;

    /**
     * 생성자.
     *
     * @param type 오류 유형
     * @param statusCode HTTP 상태 코드 (없으면 {@link #NO_STATUS})
     * @param message 오류 메시지
     * @param cause 원인 (null 가능)
     * @throws IllegalArgumentException type이 null이거나 HTTP_STATUS인데 상태 코드가 없는 경우
     */
    public TransportException(TransportErrorType type, int statusCode, String message, Throwable cause) {
        super(message, cause);
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (type == TransportErrorType.HTTP_STATUS && statusCode < 100) {
            throw new IllegalArgumentException("HTTP_STATUS requires a status code (current: " + statusCode + ")");
        }
        this.type = type;
        this.statusCode = type == TransportErrorType.HTTP_STATUS ? statusCode : NO_STATUS;
    }

    /**
     * HTTP 상태 코드 오류 생성.
     *
     * @param statusCode HTTP 상태 코드
     * @param message 오류 메시지 (응답 본문 요약 등)
     * @return TransportException 인스턴스
     */
    public static TransportException httpStatus(int statusCode, String message) {
        return new TransportException(TransportErrorType.HTTP_STATUS, statusCode,
            "HTTP " + statusCode + (message == null || message.isBlank() ? "" : ": " + message), null);
    }

    /**
     * 타임아웃 오류 생성.
     *
     * @param message 오류 메시지
     * @param cause 원인
     * @return TransportException 인스턴스
     */
    public static TransportException timeout(String message, Throwable cause) {
        return new TransportException(TransportErrorType.TIMEOUT, NO_STATUS, message, cause);
    }

    /**
     * 연결 오류 생성.
     *
     * @param message 오류 메시지
     * @param cause 원인
     * @return TransportException 인스턴스
     */
    public static TransportException connection(String message, Throwable cause) {
        return new TransportException(TransportErrorType.CONNECTION, NO_STATUS, message, cause);
    }

    /**
     * 네트워크 오류 생성.
     *
     * @param message 오류 메시지
     * @param cause 원인
     * @return TransportException 인스턴스
     */
    public static TransportException network(String message, Throwable cause) {
        return new TransportException(TransportErrorType.NETWORK, NO_STATUS, message, cause);
    }

    /**
     * 오류 유형 조회.
     *
     * @return 오류 유형
     */
    public TransportErrorType getType() {
        return type;
    }

    /**
     * HTTP 상태 코드 조회.
     *
     * @return HTTP 상태 코드, 없으면 {@link #NO_STATUS}
     */
    public int getStatusCode() {
        return statusCode;
    }
}
