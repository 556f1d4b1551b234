/**
 * Request outcome package.
 *
 * <p>This package defines the value returned by every logical request: a
 * {@link com.ryuqq.voiceguard.core.outcome.RequestOutcome} tagged with a closed
 * {@link com.ryuqq.voiceguard.core.outcome.TerminalReason}.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * String result = switch (outcome.terminalReason()) {
 *     case SUCCESS -> "Success after " + outcome.attemptsUsed() + " attempts";
 *     case MAX_RETRIES_EXCEEDED, FATAL_CLIENT_ERROR -> "Failed: " + outcome.errorDetail();
 *     case BREAKER_OPEN, RATE_LIMITED -> "Rejected, may requeue";
 *     case CANCELLED -> "Cancelled";
 * };
 * </pre>
 *
 * @since 1.0.0
 * @author VoiceGuard Team
 */
package com.ryuqq.voiceguard.core.outcome;
