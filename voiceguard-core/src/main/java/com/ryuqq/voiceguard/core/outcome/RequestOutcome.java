package com.ryuqq.voiceguard.core.outcome;

import com.ryuqq.voiceguard.core.transport.TransportResponse;

import java.time.Duration;

/**
 * 논리 요청 하나의 최종 결과.
 *
 * <p>RequestExecutor는 예외를 던지지 않고 모든 종료 사유를 이 값으로 반환합니다.</p>
 *
 * @param terminalReason 종료 사유
 * @param attemptsUsed 사용한 시도 횟수 (보호 장치 확인을 포함한 루프 통과 횟수, 0 이상)
 * @param retries backoff 후 재시도한 횟수 (0 이상, attemptsUsed 이하)
 * @param totalLatency 첫 시도부터 종료까지의 경과 시간
 * @param response 성공 시 응답 (성공이 아니면 null)
 * @param errorDetail 실패 상세 (선택, null 가능)
 *
 * @author VoiceGuard Team
 * @since 1.0.0
 */
public record RequestOutcome(
    TerminalReason terminalReason,
    int attemptsUsed,
    int retries,
    Duration totalLatency,
    TransportResponse response,
    String errorDetail
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public RequestOutcome {
        if (terminalReason == null) {
            throw new IllegalArgumentException("terminalReason cannot be null");
        }
        if (attemptsUsed < 0) {
            throw new IllegalArgumentException("attemptsUsed must be non-negative (current: " + attemptsUsed + ")");
        }
        if (retries < 0 || retries > attemptsUsed) {
            throw new IllegalArgumentException(
                "retries must be between 0 and attemptsUsed (retries: " + retries + ", attemptsUsed: " + attemptsUsed + ")"
            );
        }
        if (totalLatency == null || totalLatency.isNegative()) {
            throw new IllegalArgumentException("totalLatency cannot be null or negative");
        }
        if (terminalReason == TerminalReason.SUCCESS && response == null) {
            throw new IllegalArgumentException("response is required for SUCCESS");
        }
        if (terminalReason != TerminalReason.SUCCESS && response != null) {
            throw new IllegalArgumentException("response is only allowed for SUCCESS (current: " + terminalReason + ")");
        }
    }

    /**
     * 성공 결과 생성.
     *
     * @param attemptsUsed 사용한 시도 횟수
     * @param retries 재시도 횟수
     * @param totalLatency 경과 시간
     * @param response 응답
     * @return RequestOutcome 인스턴스
     */
    public static RequestOutcome success(int attemptsUsed, int retries, Duration totalLatency, TransportResponse response) {
        return new RequestOutcome(TerminalReason.SUCCESS, attemptsUsed, retries, totalLatency, response, null);
    }

    /**
     * 성공 이외의 결과 생성.
     *
     * @param reason 종료 사유 (SUCCESS 제외)
     * @param attemptsUsed 사용한 시도 횟수
     * @param retries 재시도 횟수
     * @param totalLatency 경과 시간
     * @param errorDetail 실패 상세
     * @return RequestOutcome 인스턴스
     */
    public static RequestOutcome of(TerminalReason reason, int attemptsUsed, int retries,
                                    Duration totalLatency, String errorDetail) {
        return new RequestOutcome(reason, attemptsUsed, retries, totalLatency, null, errorDetail);
    }

    /**
     * 시작 전 취소된 결과 생성.
     *
     * @return 시도 0회의 CANCELLED 결과
     */
    public static RequestOutcome cancelledBeforeStart() {
        return new RequestOutcome(TerminalReason.CANCELLED, 0, 0, Duration.ZERO, null, "cancelled before start");
    }

    /**
     * 성공 여부.
     *
     * @return terminalReason이 SUCCESS이면 true
     */
    public boolean succeeded() {
        return terminalReason == TerminalReason.SUCCESS;
    }
}
