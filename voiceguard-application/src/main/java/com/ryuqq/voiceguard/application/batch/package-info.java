/**
 * 배치 실행 SPI와 결과 타입.
 *
 * <p>{@link com.ryuqq.voiceguard.application.batch.BatchCoordinator}의 구현은 runner 어댑터가 제공합니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.voiceguard.application.batch;
