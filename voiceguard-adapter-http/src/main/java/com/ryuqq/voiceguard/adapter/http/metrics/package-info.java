/**
 * Micrometer Prometheus 레지스트리와 헬스 스냅샷을 HTTP로 노출하는 어댑터.
 *
 * @since 1.0.0
 */
package com.ryuqq.voiceguard.adapter.http.metrics;
