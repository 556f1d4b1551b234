package com.ryuqq.voiceguard.testkit.contract;

import com.ryuqq.voiceguard.core.outcome.RequestOutcome;
import com.ryuqq.voiceguard.core.outcome.TerminalReason;
import com.ryuqq.voiceguard.core.transport.TransportRequest;
import com.ryuqq.voiceguard.testkit.time.ManualClock;
import org.junit.jupiter.api.BeforeEach;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Abstract base class for resilience contract tests.
 *
 * <p>This class provides a fresh simulated clock per test and helper methods for building
 * requests and asserting outcomes.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyContractTest extends AbstractResilienceContractTest {
 *     {@literal @}Test
 *     void scenario() {
 *         TransportRequest request = deepfakeRequest("item-1");
 *         RequestOutcome outcome = executor.execute(request, CancellationToken.create());
 *         assertTerminal(outcome, TerminalReason.SUCCESS, 1);
 *     }
 * }
 * </pre>
 *
 * @author VoiceGuard Team
 * @since 1.0.0
 */
public abstract class AbstractResilienceContractTest {

    /**
     * Deepfake endpoint name used by the helpers.
     */
    protected static final String DEEPFAKE_ENDPOINT = "deepfake";

    /**
     * Deepfake endpoint path used by the helpers.
     */
    protected static final String DEEPFAKE_PATH = "/v1/voice/deepfake";

    protected ManualClock clock;

    /**
     * Creates a fresh clock before each test.
     */
    @BeforeEach
    protected void setUpClock() {
        clock = new ManualClock();
    }

    /**
     * Builds a deepfake request whose path is unique per item.
     *
     * @param itemId item identifier
     * @return request for the deepfake endpoint
     */
    protected TransportRequest deepfakeRequest(String itemId) {
        return TransportRequest.post(DEEPFAKE_ENDPOINT, DEEPFAKE_PATH + "?item=" + itemId,
            ("{\"item\":\"" + itemId + "\"}").getBytes(StandardCharsets.UTF_8), "application/json");
    }

    /**
     * Asserts terminal reason and attempt count of an outcome.
     *
     * @param outcome actual outcome
     * @param expectedReason expected terminal reason
     * @param expectedAttempts expected attempts used
     */
    protected void assertTerminal(RequestOutcome outcome, TerminalReason expectedReason, int expectedAttempts) {
        assertNotNull(outcome, "outcome must not be null");
        assertEquals(expectedReason, outcome.terminalReason(),
            "unexpected terminal reason: " + outcome);
        assertEquals(expectedAttempts, outcome.attemptsUsed(),
            "unexpected attempts used: " + outcome);
    }
}
