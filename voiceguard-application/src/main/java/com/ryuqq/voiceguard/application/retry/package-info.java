/**
 * 재시도 정책 패키지.
 *
 * <p>실패 분류({@link com.ryuqq.voiceguard.application.retry.FailureClassifier}),
 * 재시도 판단({@link com.ryuqq.voiceguard.application.retry.RetryPolicy}),
 * Full Jitter 백오프({@link com.ryuqq.voiceguard.application.retry.BackoffCalculator})로 구성됩니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.voiceguard.application.retry;
