/**
 * Protection SPI의 NoOp 구현 패키지.
 *
 * <p>모든 요청을 허용하고 상태를 추적하지 않습니다. 보호 장치 없이 실행하거나,
 * 테스트에서 특정 보호 장치만 격리해서 검증할 때 사용합니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.voiceguard.core.protection.noop;
