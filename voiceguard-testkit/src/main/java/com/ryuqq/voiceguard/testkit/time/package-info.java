/**
 * 시뮬레이션 시계.
 *
 * @since 1.0.0
 */
package com.ryuqq.voiceguard.testkit.time;
