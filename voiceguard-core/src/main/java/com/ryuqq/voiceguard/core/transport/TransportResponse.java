package com.ryuqq.voiceguard.core.transport;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * 2xx 전송 응답.
 *
 * @param statusCode HTTP 상태 코드 (200~299)
 * @param body 응답 본문 (null이면 빈 본문)
 * @author VoiceGuard Team
 * @since 1.0.0
 */
public record TransportResponse(int statusCode, byte[] body) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException statusCode가 2xx가 아닌 경우
     */
    public TransportResponse {
        if (statusCode < 200 || statusCode > 299) {
            throw new IllegalArgumentException("statusCode must be 2xx (current: " + statusCode + ")");
        }
        body = body == null ? new byte[0] : body.clone();
    }

    /**
     * 200 OK 응답 생성.
     *
     * @param body UTF-8 본문
     * @return TransportResponse 인스턴스
     */
    public static TransportResponse ok(String body) {
        return new TransportResponse(200, body == null ? null : body.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public byte[] body() {
        return body.clone();
    }

    /**
     * 본문을 UTF-8 문자열로 조회.
     *
     * @return 본문 문자열
     */
    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TransportResponse that)) return false;
        return statusCode == that.statusCode && Arrays.equals(body, that.body);
    }

    @Override
    public int hashCode() {
        return 31 * statusCode + Arrays.hashCode(body);
    }

    @Override
    public String toString() {
        return "TransportResponse{status=" + statusCode + ", bodyBytes=" + body.length + '}';
    }
}
