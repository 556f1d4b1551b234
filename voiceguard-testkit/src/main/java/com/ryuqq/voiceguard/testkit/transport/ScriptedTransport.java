package com.ryuqq.voiceguard.testkit.transport;

import com.ryuqq.voiceguard.core.transport.Transport;
import com.ryuqq.voiceguard.core.transport.TransportException;
import com.ryuqq.voiceguard.core.transport.TransportRequest;
import com.ryuqq.voiceguard.core.transport.TransportResponse;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 스크립트로 응답을 정하는 테스트용 Transport.
 *
 * <p>요청 경로(path)별 호출 횟수를 세고, 그 횟수를 {@link Script}에 넘겨 응답 또는 실패를 결정합니다.
 * 동시 호출 수의 최댓값도 기록하므로 워커 풀의 동시성 한도를 검증할 때도 사용할 수 있습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * // 경로마다 처음 2번은 500, 3번째는 성공
 * ScriptedTransport transport = ScriptedTransport.failingThenSucceeding(2, 500, "{\"score\":0.2}");
 * }</pre>
 *
 * @author VoiceGuard Team
 * @since 1.0.0
 */
public final class ScriptedTransport implements Transport {

    /**
     * 응답 스크립트.
     */
    @FunctionalInterface
    public interface Script {

        /**
         * 호출에 대한 응답 결정.
         *
         * @param request 요청
         * @param callNumber 해당 경로의 호출 번호 (1부터)
         * @return 응답
         * @throws TransportException 실패로 응답할 경우
         * @throws InterruptedException 인터럽트 발생 시
         */
        TransportResponse respond(TransportRequest request, int callNumber)
            throws TransportException, InterruptedException;
    }

    private final Script script;
    private final ConcurrentHashMap<String, AtomicInteger> callsByPath = new ConcurrentHashMap<>();
    private final List<TransportRequest> requests = new CopyOnWriteArrayList<>();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();

    /**
     * 생성자.
     *
     * @param script 응답 스크립트
     * @throws IllegalArgumentException script가 null인 경우
     */
    public ScriptedTransport(Script script) {
        if (script == null) {
            throw new IllegalArgumentException("script cannot be null");
        }
        this.script = script;
    }

    /**
     * 항상 200 OK로 응답하는 Transport.
     *
     * @param body 응답 본문
     * @return ScriptedTransport 인스턴스
     */
    public static ScriptedTransport alwaysSucceeding(String body) {
        return new ScriptedTransport((request, callNumber) -> TransportResponse.ok(body));
    }

    /**
     * 항상 지정한 상태 코드로 실패하는 Transport.
     *
     * @param statusCode HTTP 상태 코드
     * @return ScriptedTransport 인스턴스
     */
    public static ScriptedTransport alwaysFailing(int statusCode) {
        return new ScriptedTransport((request, callNumber) -> {
            throw TransportException.httpStatus(statusCode, "scripted failure");
        });
    }

    /**
     * 경로마다 처음 failures번은 실패하고 그 이후에는 성공하는 Transport.
     *
     * @param failures 실패 횟수
     * @param statusCode 실패 시 HTTP 상태 코드
     * @param body 성공 시 응답 본문
     * @return ScriptedTransport 인스턴스
     */
    public static ScriptedTransport failingThenSucceeding(int failures, int statusCode, String body) {
        return new ScriptedTransport((request, callNumber) -> {
            if (callNumber <= failures) {
                throw TransportException.httpStatus(statusCode, "scripted failure #" + callNumber);
            }
            return TransportResponse.ok(body);
        });
    }

    @Override
    public TransportResponse send(TransportRequest request, long timeoutMs)
        throws TransportException, InterruptedException {
        requests.add(request);
        int callNumber = callsByPath.computeIfAbsent(request.path(), key -> new AtomicInteger())
            .incrementAndGet();
        int current = inFlight.incrementAndGet();
        maxInFlight.accumulateAndGet(current, Math::max);
        try {
            return script.respond(request, callNumber);
        } finally {
            inFlight.decrementAndGet();
        }
    }

    /**
     * 전체 호출 횟수.
     *
     * @return 호출 횟수
     */
    public int invocations() {
        return requests.size();
    }

    /**
     * 경로별 호출 횟수.
     *
     * @param path 요청 경로
     * @return 호출 횟수
     */
    public int invocations(String path) {
        AtomicInteger calls = callsByPath.get(path);
        return calls == null ? 0 : calls.get();
    }

    /**
     * 관측된 최대 동시 호출 수.
     *
     * @return 최대 동시 호출 수
     */
    public int maxInFlight() {
        return maxInFlight.get();
    }

    /**
     * 수신한 요청 목록 (수신 순서).
     *
     * @return 요청 목록
     */
    public List<TransportRequest> requests() {
        return List.copyOf(requests);
    }
}
