/**
 * JDK {@code java.net.http} 기반 Transport와 Jackson 기반 점수 추출기.
 *
 * @author VoiceGuard Team
 * @since 1.0.0
 */
package com.ryuqq.voiceguard.adapter.http.transport;
