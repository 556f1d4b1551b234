package com.ryuqq.voiceguard.core.transport;

/**
 * 원격 API 호출 SPI.
 *
 * <p>RequestExecutor가 보호하는 불투명한 HTTP 전송 계층입니다. 요청 본문(멀티파트 오디오,
 * JSON 메타데이터)은 호출자가 구성하며, 이 인터페이스는 전송과 오류 분류 정보만 책임집니다.</p>
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>2xx 응답만 {@link TransportResponse}로 반환합니다.</li>
 *   <li>그 외 응답과 네트워크 오류는 {@link TransportException}으로 던지며,
 *       재시도 여부를 판단할 수 있도록 상태 코드 또는 오류 유형을 포함해야 합니다.</li>
 *   <li>timeoutMs를 넘기는 호출은 {@link TransportErrorType#TIMEOUT}으로 실패해야 합니다.</li>
 *   <li>구현체는 여러 워커가 동시에 호출할 수 있도록 thread-safe해야 합니다.</li>
 * </ul>
 *
 * @author VoiceGuard Team
 * @since 1.0.0
 */
public interface Transport {

    /**
     * 요청 전송.
     *
     * @param request 전송할 요청
     * @param timeoutMs 호출 타임아웃 (밀리초)
     * @return 2xx 응답
     * @throws TransportException 2xx 이외의 응답 또는 전송 오류
     * @throws InterruptedException 호출 중 인터럽트 발생 (취소)
     */
    TransportResponse send(TransportRequest request, long timeoutMs)
        throws TransportException, InterruptedException;
}
