package com.ryuqq.voiceguard.adapter.http.transport;

import com.ryuqq.voiceguard.core.transport.Transport;
import com.ryuqq.voiceguard.core.transport.TransportErrorType;
import com.ryuqq.voiceguard.core.transport.TransportException;
import com.ryuqq.voiceguard.core.transport.TransportRequest;
import com.ryuqq.voiceguard.core.transport.TransportResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/**
 * {@link HttpClient} 기반 Transport 구현체.
 *
 * <p>요청 경로를 기준 URI에 붙여 전송하고, 모든 요청에 {@code Authorization: Bearer <key>}와
 * {@code Accept: application/json} 헤더를 추가합니다. 본문은 해석하지 않고 그대로 전달합니다.</p>
 *
 * <p><strong>오류 매핑:</strong></p>
 * <ul>
 *   <li>2xx 이외의 응답 → {@link TransportException#httpStatus(int, String)}</li>
 *   <li>{@link HttpTimeoutException} → {@link TransportException#timeout(String, Throwable)}</li>
 *   <li>{@link ConnectException} → {@link TransportException#connection(String, Throwable)}</li>
 *   <li>그 외 {@link IOException} → {@link TransportException#network(String, Throwable)}</li>
 *   <li>URI나 헤더가 HttpRequest로 만들어지지 않는 요청 → {@link TransportErrorType#UNKNOWN}</li>
 * </ul>
 *
 * <p>HttpClient는 thread-safe하므로 하나의 인스턴스를 모든 워커가 공유합니다.</p>
 *
 * @author VoiceGuard Team
 * @since 1.0.0
 */
public final class JdkHttpTransport implements Transport {

    private static final Logger log = LoggerFactory.getLogger(JdkHttpTransport.class);

    private static final int MAX_ERROR_BODY_CHARS = 200;

    private final HttpClient httpClient;
    private final URI baseUri;
    private final String apiKey;

    /**
     * 기본 HttpClient로 생성.
     *
     * @param baseUri API 기준 URI (예: https://api.example.com)
     * @param apiKey API 키
     * @throws IllegalArgumentException 파라미터가 null이거나 빈 값인 경우
     */
    public JdkHttpTransport(URI baseUri, String apiKey) {
        this(HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build(), baseUri, apiKey);
    }

    /**
     * 생성자.
     *
     * @param httpClient 공유 HttpClient
     * @param baseUri API 기준 URI
     * @param apiKey API 키
     * @throws IllegalArgumentException 파라미터가 null이거나 빈 값인 경우
     */
    public JdkHttpTransport(HttpClient httpClient, URI baseUri, String apiKey) {
        if (httpClient == null) {
            throw new IllegalArgumentException("httpClient cannot be null");
        }
        if (baseUri == null) {
            throw new IllegalArgumentException("baseUri cannot be null");
        }
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalArgumentException("apiKey cannot be null or blank");
        }
        this.httpClient = httpClient;
        this.baseUri = baseUri;
        this.apiKey = apiKey;
    }

    @Override
    public TransportResponse send(TransportRequest request, long timeoutMs)
        throws TransportException, InterruptedException {
        HttpRequest httpRequest;
        try {
            httpRequest = toHttpRequest(request, timeoutMs);
        } catch (IllegalArgumentException e) {
            throw new TransportException(TransportErrorType.UNKNOWN, TransportException.NO_STATUS,
                "cannot build request for " + request.path() + ": " + e.getMessage(), e);
        }

        HttpResponse<byte[]> response;
        try {
            response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofByteArray());
        } catch (HttpTimeoutException e) {
            throw TransportException.timeout(
                request.method() + " " + request.path() + " timed out after " + timeoutMs + "ms", e);
        } catch (ConnectException e) {
            throw TransportException.connection("cannot connect to " + baseUri, e);
        } catch (IOException e) {
            throw TransportException.network(e.getClass().getSimpleName() + ": " + e.getMessage(), e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            log.debug("{} {} responded {}", request.method(), request.path(), status);
            throw TransportException.httpStatus(status, abbreviate(response.body()));
        }
        return new TransportResponse(status, response.body());
    }

    URI resolve(String path) {
        String base = baseUri.toString();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return URI.create(base + path);
    }

    private HttpRequest toHttpRequest(TransportRequest request, long timeoutMs) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(resolve(request.path()))
            .timeout(Duration.ofMillis(timeoutMs))
            .header("Authorization", "Bearer " + apiKey)
            .header("Accept", "application/json")
            .method(request.method(), HttpRequest.BodyPublishers.ofByteArray(request.body()));
        if (request.contentType() != null) {
            builder.header("Content-Type", request.contentType());
        }
        for (Map.Entry<String, String> header : request.headers().entrySet()) {
            builder.header(header.getKey(), header.getValue());
        }
        return builder.build();
    }

    private static String abbreviate(byte[] body) {
        String text = new String(body, StandardCharsets.UTF_8);
        return text.length() <= MAX_ERROR_BODY_CHARS ? text : text.substring(0, MAX_ERROR_BODY_CHARS) + "...";
    }
}
