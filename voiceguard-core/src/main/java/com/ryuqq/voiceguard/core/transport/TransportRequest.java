package com.ryuqq.voiceguard.core.transport;

import java.net.URI;
import java.util.Arrays;
import java.util.Map;
import java.util.Objects;

/**
 * 전송 요청.
 *
 * <p>endpoint는 Circuit Breaker를 선택하는 논리 이름(예: deepfake, mfa, sar)이고,
 * path는 API 기준 URL에 붙는 경로입니다.</p>
 *
 * @param endpoint 논리 엔드포인트 이름
 * @param method HTTP 메서드 (예: POST)
 * @param path 요청 경로 (예: /v1/voice/deepfake)
 * @param headers 추가 헤더 (null이면 빈 맵)
 * @param body 요청 본문 (null이면 빈 본문)
 * @param contentType 본문 Content-Type (null 가능)
 * @author VoiceGuard Team
 * @since 1.0.0
 */
public record TransportRequest(
    String endpoint,
    String method,
    String path,
    Map<String, String> headers,
    byte[] body,
    String contentType
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException endpoint, method, path가 null이거나 빈 문자열인 경우,
     *         또는 path가 URI로 해석되지 않는 경우
     */
    public TransportRequest {
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalArgumentException("endpoint cannot be null or blank");
        }
        if (method == null || method.isBlank()) {
            throw new IllegalArgumentException("method cannot be null or blank");
        }
        if (path == null || !path.startsWith("/")) {
            throw new IllegalArgumentException("path must start with '/' (current: " + path + ")");
        }
        try {
            URI.create(path);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("path is not a valid URI (current: " + path + ")", e);
        }
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        body = body == null ? new byte[0] : body.clone();
    }

    /**
     * 본문 없는 POST 요청 생성.
     *
     * @param endpoint 논리 엔드포인트 이름
     * @param path 요청 경로
     * @return TransportRequest 인스턴스
     */
    public static TransportRequest post(String endpoint, String path) {
        return new TransportRequest(endpoint, "POST", path, Map.of(), null, null);
    }

    /**
     * 본문 포함 POST 요청 생성.
     *
     * @param endpoint 논리 엔드포인트 이름
     * @param path 요청 경로
     * @param body 요청 본문
     * @param contentType Content-Type
     * @return TransportRequest 인스턴스
     */
    public static TransportRequest post(String endpoint, String path, byte[] body, String contentType) {
        return new TransportRequest(endpoint, "POST", path, Map.of(), body, contentType);
    }

    @Override
    public byte[] body() {
        return body.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TransportRequest that)) return false;
        return endpoint.equals(that.endpoint)
            && method.equals(that.method)
            && path.equals(that.path)
            && headers.equals(that.headers)
            && Arrays.equals(body, that.body)
            && Objects.equals(contentType, that.contentType);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(endpoint, method, path, headers, contentType);
        return 31 * result + Arrays.hashCode(body);
    }

    @Override
    public String toString() {
        return "TransportRequest{" + method + " " + path + " endpoint=" + endpoint
            + ", bodyBytes=" + body.length + '}';
    }
}
