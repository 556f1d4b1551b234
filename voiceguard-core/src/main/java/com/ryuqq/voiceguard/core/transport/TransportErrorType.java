package com.ryuqq.voiceguard.core.transport;

/**
 * 전송 오류 유형.
 *
 * @author VoiceGuard Team
 * @since 1.0.0
 */
public enum TransportErrorType {

    /**
     * 서버가 2xx 이외의 상태 코드로 응답함.
     */
    HTTP_STATUS,

    /**
     * 호출 타임아웃.
     */
    TIMEOUT,

    /**
     * 연결 수립 실패 또는 연결 리셋.
     */
    CONNECTION,

    /**
     * 그 외 일시적 네트워크 오류.
     */
    NETWORK,

    /**
     * 분류할 수 없는 오류 (구현 버그 등).
     */
    UNKNOWN
}
