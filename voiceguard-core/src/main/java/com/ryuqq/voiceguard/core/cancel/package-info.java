/**
 * 외부 취소 신호 패키지.
 *
 * @since 1.0.0
 */
package com.ryuqq.voiceguard.core.cancel;
