package com.ryuqq.voiceguard.testkit.transport;

import com.ryuqq.voiceguard.core.transport.TransportException;
import com.ryuqq.voiceguard.core.transport.TransportRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ScriptedTransport 테스트")
class ScriptedTransportTest {

    @Test
    @DisplayName("실패 횟수는 경로마다 따로 센다")
    void 경로별_호출_횟수() throws Exception {
        ScriptedTransport transport = ScriptedTransport.failingThenSucceeding(1, 503, "ok");
        TransportRequest first = TransportRequest.post("deepfake", "/a");
        TransportRequest second = TransportRequest.post("deepfake", "/b");

        assertThatThrownBy(() -> transport.send(first, 100))
            .isInstanceOfSatisfying(TransportException.class, e -> assertThat(e.getStatusCode()).isEqualTo(503));
        assertThatThrownBy(() -> transport.send(second, 100)).isInstanceOf(TransportException.class);
        assertThat(transport.send(first, 100).bodyAsString()).isEqualTo("ok");

        assertThat(transport.invocations()).isEqualTo(3);
        assertThat(transport.invocations("/a")).isEqualTo(2);
        assertThat(transport.invocations("/b")).isEqualTo(1);
        assertThat(transport.invocations("/c")).isZero();
        assertThat(transport.requests()).extracting(TransportRequest::path).containsExactly("/a", "/b", "/a");
        assertThat(transport.maxInFlight()).isEqualTo(1);
    }
}
