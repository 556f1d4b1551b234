package com.ryuqq.voiceguard.adapter.runner;

import com.ryuqq.voiceguard.application.batch.BatchCoordinator;
import com.ryuqq.voiceguard.application.batch.BatchItem;
import com.ryuqq.voiceguard.application.batch.BatchSummary;
import com.ryuqq.voiceguard.application.batch.ScoreExtractor;
import com.ryuqq.voiceguard.application.executor.RequestExecutor;
import com.ryuqq.voiceguard.core.cancel.CancellationToken;
import com.ryuqq.voiceguard.core.metrics.MetricsSink;
import com.ryuqq.voiceguard.core.outcome.RequestOutcome;
import com.ryuqq.voiceguard.core.outcome.TerminalReason;
import com.ryuqq.voiceguard.core.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 고정 크기 워커 풀 기반 BatchCoordinator 구현체.
 *
 * <p>워커들이 공유 큐에서 항목을 하나씩 가져와 {@link RequestExecutor}로 실행하고,
 * 결과를 {@link BatchAccumulator}에 기록합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * runBatch(items, concurrency, token)
 *   ↓
 * pending = ConcurrentLinkedQueue(items)
 *   ↓
 * min(concurrency, items) 개의 워커 시작
 *   각 워커: while (!cancelled &amp;&amp; (item = pending.poll()) != null)
 *              outcome = executor.execute(item.request, token)
 *              accumulator.record(item.itemId, outcome)
 *   ↓
 * 모든 워커 Future.get() (명시적 join)
 *   ↓
 * 남은 항목 → CANCELLED (시작 전 취소)
 *   ↓
 * BatchSummary
 * </pre>
 *
 * <p><strong>취소:</strong></p>
 * <ul>
 *   <li>토큰이 취소되면 워커 풀에 shutdownNow()를 호출해 백오프나 I/O 중인 워커를 인터럽트합니다.</li>
 *   <li>실행 중이던 항목은 RequestExecutor가 CANCELLED로 반환합니다.</li>
 *   <li>큐에 남은 항목은 시도 0회의 CANCELLED로 기록합니다.</li>
 * </ul>
 *
 * <p>배치마다 새 워커 풀을 만들고 배치가 끝나면 종료하므로 인스턴스 자체는 상태를 갖지 않습니다.</p>
 *
 * @author VoiceGuard Team
 * @since 1.0.0
 */
public final class WorkerPoolBatchCoordinator implements BatchCoordinator {

    private static final Logger log = LoggerFactory.getLogger(WorkerPoolBatchCoordinator.class);

    private final RequestExecutor executor;
    private final ScoreExtractor scoreExtractor;
    private final MetricsSink metricsSink;
    private final BatchConfig config;
    private final Clock clock;

    /**
     * 생성자.
     *
     * @param executor 요청 실행자
     * @param scoreExtractor 성공 응답 점수 추출기
     * @param metricsSink 시작 전 취소 항목을 보고할 메트릭 수집기
     * @param config 배치 설정
     * @param clock 소요 시간 측정용 시간 소스
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public WorkerPoolBatchCoordinator(
        RequestExecutor executor,
        ScoreExtractor scoreExtractor,
        MetricsSink metricsSink,
        BatchConfig config,
        Clock clock
    ) {
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        if (scoreExtractor == null) {
            throw new IllegalArgumentException("scoreExtractor cannot be null");
        }
        if (metricsSink == null) {
            throw new IllegalArgumentException("metricsSink cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.executor = executor;
        this.scoreExtractor = scoreExtractor;
        this.metricsSink = metricsSink;
        this.config = config;
        this.clock = clock;
    }

    /**
     * 설정의 기본 concurrency로 배치 실행.
     *
     * @param items 배치 항목
     * @param cancellationToken 취소 토큰
     * @return 배치 요약
     */
    public BatchSummary runBatch(List<BatchItem> items, CancellationToken cancellationToken) {
        return runBatch(items, config.concurrency(), cancellationToken);
    }

    @Override
    public BatchSummary runBatch(List<BatchItem> items, int concurrency, CancellationToken cancellationToken) {
        validate(items, concurrency, cancellationToken);

        long startNanos = clock.nanoTime();
        BatchAccumulator accumulator = new BatchAccumulator(scoreExtractor);
        Queue<BatchItem> pending = new ConcurrentLinkedQueue<>(items);
        int workers = Math.min(concurrency, items.size());

        if (workers > 0) {
            log.info("Batch started: {} items, {} workers", items.size(), workers);
            runWorkers(pending, workers, cancellationToken, accumulator);
        }

        // 워커가 시작하지 못한 항목
        BatchItem skipped;
        while ((skipped = pending.poll()) != null) {
            RequestOutcome outcome = RequestOutcome.cancelledBeforeStart();
            metricsSink.recordOutcome(skipped.request().endpoint(), outcome);
            accumulator.record(skipped.itemId(), outcome);
        }

        Duration elapsed = Duration.ofNanos(Math.max(0L, clock.nanoTime() - startNanos));
        BatchSummary summary = accumulator.toSummary(items.size(), elapsed);
        log.info("Batch finished: total={}, succeeded={}, failed={}, breakerTrips={}, rateLimited={}, cancelled={}, retries={}",
            summary.total(), summary.succeeded(), summary.failed(), summary.breakerTrips(),
            summary.rateLimited(), summary.cancelled(), summary.retryCount());
        return summary;
    }

    private void runWorkers(
        Queue<BatchItem> pending,
        int workers,
        CancellationToken cancellationToken,
        BatchAccumulator accumulator
    ) {
        ExecutorService pool = Executors.newFixedThreadPool(workers, workerThreadFactory());
        List<Future<?>> futures = new ArrayList<>(workers);

        try (CancellationToken.Registration ignored = cancellationToken.onCancel(pool::shutdownNow)) {
            for (int i = 0; i < workers; i++) {
                try {
                    futures.add(pool.submit(() -> drain(pending, cancellationToken, accumulator)));
                } catch (RejectedExecutionException e) {
                    // 제출 도중 취소되어 풀이 이미 종료됨
                    log.debug("Worker submission rejected after cancellation");
                    break;
                }
            }
            joinAll(futures, pool);
        } finally {
            pool.shutdown();
        }
    }

    private void drain(Queue<BatchItem> pending, CancellationToken cancellationToken, BatchAccumulator accumulator) {
        while (!cancellationToken.isCancelled() && !Thread.currentThread().isInterrupted()) {
            BatchItem item = pending.poll();
            if (item == null) {
                return;
            }
            accumulator.record(item.itemId(), executeItem(item, cancellationToken));
        }
    }

    private RequestOutcome executeItem(BatchItem item, CancellationToken cancellationToken) {
        try {
            return executor.execute(item.request(), cancellationToken);
        } catch (RuntimeException e) {
            log.error("Unexpected failure while executing item {}", item.itemId(), e);
            RequestOutcome outcome = RequestOutcome.of(
                TerminalReason.FATAL_CLIENT_ERROR, 0, 0, Duration.ZERO, e.toString());
            metricsSink.recordOutcome(item.request().endpoint(), outcome);
            return outcome;
        }
    }

    /**
     * 모든 워커 종료 대기.
     *
     * <p>대기 중 호출 스레드가 인터럽트되면 워커를 인터럽트한 뒤 계속 기다리고,
     * 종료 후 인터럽트 플래그를 복원합니다.</p>
     */
    private void joinAll(List<Future<?>> futures, ExecutorService pool) {
        boolean interrupted = false;
        for (Future<?> future : futures) {
            while (true) {
                try {
                    future.get();
                    break;
                } catch (InterruptedException e) {
                    interrupted = true;
                    pool.shutdownNow();
                } catch (ExecutionException e) {
                    log.error("Batch worker terminated unexpectedly", e.getCause());
                    break;
                }
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    private ThreadFactory workerThreadFactory() {
        AtomicInteger sequence = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, config.workerNamePrefix() + "-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static void validate(List<BatchItem> items, int concurrency, CancellationToken cancellationToken) {
        if (items == null) {
            throw new IllegalArgumentException("items cannot be null");
        }
        if (concurrency <= 0) {
            throw new IllegalArgumentException("concurrency must be positive (current: " + concurrency + ")");
        }
        if (cancellationToken == null) {
            throw new IllegalArgumentException("cancellationToken cannot be null");
        }
        Set<String> ids = new HashSet<>();
        for (BatchItem item : items) {
            if (item == null) {
                throw new IllegalArgumentException("items cannot contain null");
            }
            if (!ids.add(item.itemId())) {
                throw new IllegalArgumentException("duplicate itemId: " + item.itemId());
            }
        }
    }
}
