package com.ryuqq.voiceguard.application.batch;

import com.ryuqq.voiceguard.core.cancel.CancellationToken;

import java.util.List;

/**
 * 배치 실행 SPI.
 *
 * <p>구현체는 제한된 수의 워커로 항목을 동시에 실행하고, 모든 항목이 끝난 뒤(또는 취소된 뒤)
 * 결과를 {@link BatchSummary}로 모아 반환합니다.</p>
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>모든 입력 항목은 정확히 하나의 결과를 갖습니다.</li>
 *   <li>배치 단위 재시도는 없습니다. 재시도는 항목별 RequestExecutor의 책임입니다.</li>
 *   <li>한 항목의 실패가 배치 전체를 중단시키지 않습니다.</li>
 *   <li>취소되면 실행 중인 항목은 재시도를 멈추고, 시작하지 않은 항목은 CANCELLED로 기록됩니다.</li>
 *   <li>항목 간 완료 순서는 보장하지 않습니다.</li>
 * </ul>
 *
 * @author VoiceGuard Team
 * @since 1.0.0
 */
public interface BatchCoordinator {

    /**
     * 배치 실행 (모든 워커가 종료될 때까지 블로킹).
     *
     * @param items 배치 항목 (itemId는 배치 내에서 고유해야 함)
     * @param concurrency 최대 동시 워커 수 (1 이상)
     * @param cancellationToken 취소 토큰
     * @return 배치 요약
     * @throws IllegalArgumentException 입력 검증 실패 시
     */
    BatchSummary runBatch(List<BatchItem> items, int concurrency, CancellationToken cancellationToken);
}
