package com.ryuqq.voiceguard.core.protection;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * 엔드포인트별 Circuit Breaker 레지스트리.
 *
 * <p>클라이언트 하나가 레지스트리 하나를 소유하며, 논리 엔드포인트마다 Circuit Breaker를
 * 하나씩 지연 생성합니다. 프로세스 전역 상태가 아니므로 클라이언트 간에 공유되지 않습니다.</p>
 *
 * <p>동일 엔드포인트에 대해 여러 스레드가 동시에 조회해도 항상 같은 인스턴스를 반환합니다.</p>
 *
 * @author VoiceGuard Team
 * @since 1.0.0
 */
public final class CircuitBreakerRegistry {

    private final Function<String, CircuitBreaker> factory;
    private final ConcurrentHashMap<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();

    /**
     * 생성자.
     *
     * @param factory 엔드포인트 이름으로 Circuit Breaker를 생성하는 팩토리
     * @throws IllegalArgumentException factory가 null인 경우
     */
    public CircuitBreakerRegistry(Function<String, CircuitBreaker> factory) {
        if (factory == null) {
            throw new IllegalArgumentException("factory cannot be null");
        }
        this.factory = factory;
    }

    /**
     * 엔드포인트의 Circuit Breaker 조회 (없으면 생성).
     *
     * @param endpoint 엔드포인트 이름
     * @return Circuit Breaker
     * @throws IllegalArgumentException endpoint가 null이거나 빈 문자열인 경우
     */
    public CircuitBreaker forEndpoint(String endpoint) {
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalArgumentException("endpoint cannot be null or blank");
        }
        return breakers.computeIfAbsent(endpoint, factory);
    }

    /**
     * 생성된 모든 Circuit Breaker의 현재 상태 스냅샷.
     *
     * @return 엔드포인트 이름순으로 정렬된 불변 맵
     */
    public Map<String, CircuitBreakerState> states() {
        Map<String, CircuitBreakerState> snapshot = new TreeMap<>();
        breakers.forEach((endpoint, breaker) -> snapshot.put(endpoint, breaker.getState()));
        return Collections.unmodifiableMap(snapshot);
    }

    /**
     * 생성된 Circuit Breaker 수.
     *
     * @return Circuit Breaker 수
     */
    public int size() {
        return breakers.size();
    }
}
