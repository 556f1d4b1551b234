/**
 * 테스트용 Transport 구현.
 *
 * @since 1.0.0
 */
package com.ryuqq.voiceguard.testkit.transport;
