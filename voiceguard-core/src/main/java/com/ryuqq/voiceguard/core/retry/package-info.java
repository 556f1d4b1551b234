/**
 * 재시도 모델 패키지.
 *
 * <p>재시도 정책 자체(분류, backoff 계산)는 application 모듈의 {@code RetryPolicy}에 있습니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.voiceguard.core.retry;
