package com.ryuqq.voiceguard.adapter.runner;

/**
 * WorkerPoolBatchCoordinator 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>concurrency: 기본 동시 워커 수 (기본 5)</li>
 *   <li>workerNamePrefix: 워커 스레드 이름 접두사 (기본 "voiceguard-worker")</li>
 * </ul>
 *
 * @author VoiceGuard Team
 * @since 1.0.0
 * @param concurrency 동시 워커 수 (1 이상이어야 함)
 * @param workerNamePrefix 워커 스레드 이름 접두사 (빈 문자열 불가)
 */
public record BatchConfig(int concurrency, String workerNamePrefix) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: concurrency=5, workerNamePrefix="voiceguard-worker"</p>
     */
    public BatchConfig() {
        this(5, "voiceguard-worker");
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BatchConfig {
        if (concurrency <= 0) {
            throw new IllegalArgumentException(
                "concurrency must be positive (current: " + concurrency + ")"
            );
        }
        if (workerNamePrefix == null || workerNamePrefix.isBlank()) {
            throw new IllegalArgumentException("workerNamePrefix cannot be null or blank");
        }
    }

    /**
     * concurrency 변경.
     *
     * @param concurrency 새 동시 워커 수
     * @return 새 BatchConfig 인스턴스
     */
    public BatchConfig withConcurrency(int concurrency) {
        return new BatchConfig(concurrency, workerNamePrefix);
    }
}
