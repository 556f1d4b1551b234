package com.ryuqq.voiceguard.adapter.http.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.voiceguard.application.batch.ScoreExtractor;
import com.ryuqq.voiceguard.core.transport.TransportResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.OptionalDouble;

/**
 * Deepfake 응답 JSON의 {@code score} 필드를 읽는 ScoreExtractor.
 *
 * <p>본문이 JSON이 아니거나 {@code score}가 숫자가 아니면 빈 값을 반환하고,
 * 해당 항목은 위험도 분포에서 제외됩니다.</p>
 *
 * @author VoiceGuard Team
 * @since 1.0.0
 */
public final class JsonScoreExtractor implements ScoreExtractor {

    private static final Logger log = LoggerFactory.getLogger(JsonScoreExtractor.class);

    private static final String DEFAULT_FIELD = "score";

    private final ObjectMapper objectMapper;
    private final String field;

    public JsonScoreExtractor() {
        this(new ObjectMapper(), DEFAULT_FIELD);
    }

    /**
     * 생성자.
     *
     * @param objectMapper Jackson ObjectMapper
     * @param field 점수 필드 이름
     * @throws IllegalArgumentException 파라미터가 null이거나 빈 값인 경우
     */
    public JsonScoreExtractor(ObjectMapper objectMapper, String field) {
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        if (field == null || field.isBlank()) {
            throw new IllegalArgumentException("field cannot be null or blank");
        }
        this.objectMapper = objectMapper;
        this.field = field;
    }

    @Override
    public OptionalDouble extract(TransportResponse response) {
        if (response == null || response.body().length == 0) {
            return OptionalDouble.empty();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(response.body());
        } catch (IOException e) {
            log.warn("Response body is not valid JSON: {}", e.getMessage());
            return OptionalDouble.empty();
        }
        JsonNode score = root == null ? null : root.get(field);
        if (score == null || !score.isNumber()) {
            log.debug("Response has no numeric '{}' field", field);
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(score.asDouble());
    }
}
