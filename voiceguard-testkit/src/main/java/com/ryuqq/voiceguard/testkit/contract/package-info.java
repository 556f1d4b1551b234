/**
 * Contract test infrastructure.
 *
 * <p>Other modules extend {@link com.ryuqq.voiceguard.testkit.contract.AbstractResilienceContractTest}
 * in their own test sources.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.voiceguard.testkit.contract;
