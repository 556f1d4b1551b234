/**
 * 시간 추상화 패키지.
 *
 * <p>{@link com.ryuqq.voiceguard.core.time.Clock}을 주입받는 컴포넌트는 실제 시간 대신
 * 시뮬레이션 시계로 테스트할 수 있습니다. 테스트용 구현은 testkit 모듈의
 * {@code ManualClock}을 사용합니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.voiceguard.core.time;
