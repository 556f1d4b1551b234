package com.ryuqq.voiceguard.application.batch;

import com.ryuqq.voiceguard.core.transport.TransportResponse;

import java.util.OptionalDouble;

/**
 * 성공 응답에서 Deepfake 점수를 추출하는 SPI.
 *
 * <p>응답 형식은 이 SDK가 해석하지 않으므로 추출 방법은 호출자가 정합니다.
 * 점수가 없거나 해석할 수 없으면 빈 값을 반환합니다.</p>
 *
 * @author VoiceGuard Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ScoreExtractor {

    OptionalDouble extract(TransportResponse response);

    /**
     * 점수를 추출하지 않는 구현.
     *
     * @return 항상 빈 값을 반환하는 ScoreExtractor
     */
    static ScoreExtractor none() {
        return response -> OptionalDouble.empty();
    }
}
