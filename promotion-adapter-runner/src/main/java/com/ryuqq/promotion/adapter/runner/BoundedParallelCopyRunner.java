package com.ryuqq.promotion.adapter.runner;

import com.ryuqq.promotion.application.config.PromotionConfig;
import com.ryuqq.promotion.application.copy.AbortSignal;
import com.ryuqq.promotion.application.copy.CopyRunner;
import com.ryuqq.promotion.application.copy.CopyTask;
import com.ryuqq.promotion.core.model.PromotableItem;
import com.ryuqq.promotion.core.outcome.Copied;
import com.ryuqq.promotion.core.outcome.CopyFailed;
import com.ryuqq.promotion.core.outcome.CopyOutcome;
import com.ryuqq.promotion.core.outcome.CopyStage;
import com.ryuqq.promotion.core.protection.FixedTimeoutPolicy;
import com.ryuqq.promotion.core.protection.TimeoutPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * 고정 폭 워커 풀에서 항목을 병렬 복사하는 Runner.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * run() 호출
 *   ↓
 * 동시 실행 항목이 width 미만인 동안:
 *   - abort 상태면 → ABORTED 실패를 sink에 전달
 *   - 아니면 → 워커 풀에 제출 (deadline 기록)
 *   ↓
 * 가장 이른 deadline까지 완료 대기:
 *   - 완료 → Outcome을 sink에 전달
 *   - deadline 경과 → cancel(true) + TIMEOUT 실패 + recordTimeout
 *   ↓
 * 모든 항목이 결과를 가질 때까지 반복
 *   ↓
 * 타임아웃된 워커 종료 대기
 * </pre>
 *
 * <p><strong>동시성 제어:</strong></p>
 * <ul>
 *   <li>sink는 run()을 호출한 스레드에서만 호출됩니다 (워커는 Outcome만 반환)</li>
 *   <li>한 항목의 실패나 타임아웃은 다른 항목을 취소하지 않습니다</li>
 *   <li>타임아웃된 항목은 인터럽트되며, 레코드 삽입 전 인터럽트 확인으로 대상 레코드가 생기지 않습니다</li>
 *   <li>인터럽트를 무시한 저장이 타임아웃 보고 뒤에 끝나면 워커가 {@link CopyTask#discard}로 되돌립니다</li>
 *   <li>run()은 타임아웃된 워커가 끝날 때까지 shutdownTimeoutMs 동안 기다린 뒤 반환합니다</li>
 * </ul>
 *
 * <p>Runner 하나를 여러 승격이 공유할 수 있으며, 전체 동시 실행 수는 풀 폭으로 제한됩니다.</p>
 *
 * @author Promotion Team
 * @since 1.0.0
 */
public final class BoundedParallelCopyRunner implements CopyRunner {

    private static final Logger log = LoggerFactory.getLogger(BoundedParallelCopyRunner.class);

    private final CopyRunnerConfig config;
    private final TimeoutPolicy timeoutPolicy;
    private final int width;
    private final ExecutorService workerExecutor;

    /**
     * 생성자 (승격 설정에서 배치 상한과 타임아웃 사용).
     *
     * @param config Runner 설정
     * @param promotionConfig 승격 설정 (maxItemsPerBatch, perItemTimeoutMs)
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public BoundedParallelCopyRunner(CopyRunnerConfig config, PromotionConfig promotionConfig) {
        this(config, requireConfig(promotionConfig).maxItemsPerBatch(),
            new FixedTimeoutPolicy(promotionConfig.perItemTimeoutMs()));
    }

    /**
     * 생성자 (커스텀 TimeoutPolicy 주입).
     *
     * @param config Runner 설정
     * @param maxItemsPerBatch 동시 처리 항목 상한
     * @param timeoutPolicy 항목당 타임아웃 정책
     * @throws IllegalArgumentException 의존성이 null이거나 maxItemsPerBatch가 양수가 아닌 경우
     */
    public BoundedParallelCopyRunner(CopyRunnerConfig config, int maxItemsPerBatch, TimeoutPolicy timeoutPolicy) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (timeoutPolicy == null) {
            throw new IllegalArgumentException("timeoutPolicy cannot be null");
        }
        this.config = config;
        this.timeoutPolicy = timeoutPolicy;
        this.width = config.effectiveWidth(maxItemsPerBatch);
        this.workerExecutor = Executors.newFixedThreadPool(width, new CopyWorkerThreadFactory());
    }

    private static PromotionConfig requireConfig(PromotionConfig promotionConfig) {
        if (promotionConfig == null) {
            throw new IllegalArgumentException("promotionConfig cannot be null");
        }
        return promotionConfig;
    }

    @Override
    public void run(List<PromotableItem> items, CopyTask task, AbortSignal abortSignal, Consumer<CopyOutcome> sink) {
        if (items == null || task == null || abortSignal == null || sink == null) {
            throw new IllegalArgumentException("items, task, abortSignal and sink cannot be null");
        }
        ExecutorCompletionService<CopyOutcome> completion = new ExecutorCompletionService<>(workerExecutor);
        Map<Future<CopyOutcome>, InFlight> inFlight = new LinkedHashMap<>();
        List<CopyAttempt> abandoned = new ArrayList<>();
        Iterator<PromotableItem> pending = items.iterator();

        try {
            while (pending.hasNext() || !inFlight.isEmpty()) {
                // 1. 빈 슬롯만큼 제출
                while (pending.hasNext() && inFlight.size() < width) {
                    PromotableItem item = pending.next();
                    if (abortSignal.isAborted()) {
                        sink.accept(aborted(item, abortSignal.getReasonOrNull()));
                        continue;
                    }
                    submit(completion, inFlight, item, task);
                }
                if (inFlight.isEmpty()) {
                    continue;
                }

                // 2. 다음 완료 대기 (가장 이른 deadline까지)
                Future<CopyOutcome> done = awaitNext(completion, inFlight);
                if (done != null) {
                    InFlight finished = inFlight.remove(done);
                    if (finished != null) {
                        sink.accept(resolve(finished.attempt().item(), done));
                    }
                }

                // 3. deadline 경과 항목 정리
                expireOverdue(inFlight, abandoned, sink);
            }

            // 4. 타임아웃된 워커가 끝날 때까지 대기 (늦은 결과는 워커가 되돌림)
            awaitAbandoned(abandoned);
        } catch (InterruptedException e) {
            log.warn("Copy run interrupted with {} item(s) in flight", inFlight.size());
            for (Map.Entry<Future<CopyOutcome>, InFlight> entry : inFlight.entrySet()) {
                PromotableItem item = entry.getValue().attempt().item();
                if (entry.getValue().attempt().settleByRunner()) {
                    entry.getKey().cancel(true);
                    sink.accept(CopyFailed.of(item.getId(), CopyStage.UNEXPECTED, "Copy interrupted while in progress"));
                } else {
                    // 워커가 이미 결과를 확정함
                    sink.accept(resolve(item, entry.getKey()));
                }
            }
            inFlight.clear();
            while (pending.hasNext()) {
                sink.accept(aborted(pending.next(), "copy run interrupted"));
            }
            Thread.currentThread().interrupt();
        }
    }

    private void submit(ExecutorCompletionService<CopyOutcome> completion,
                        Map<Future<CopyOutcome>, InFlight> inFlight,
                        PromotableItem item, CopyTask task) {
        long timeoutMs = timeoutPolicy.getPerItemTimeoutMs(item.kind());
        long startedAt = System.nanoTime();
        long deadline = timeoutMs > 0 ? startedAt + TimeUnit.MILLISECONDS.toNanos(timeoutMs) : Long.MAX_VALUE;
        CopyAttempt attempt = new CopyAttempt(item);
        Future<CopyOutcome> future = completion.submit(() -> attempt.run(task));
        inFlight.put(future, new InFlight(attempt, startedAt, deadline));
    }

    private Future<CopyOutcome> awaitNext(ExecutorCompletionService<CopyOutcome> completion,
                                          Map<Future<CopyOutcome>, InFlight> inFlight) throws InterruptedException {
        long earliest = Long.MAX_VALUE;
        for (InFlight entry : inFlight.values()) {
            earliest = Math.min(earliest, entry.deadline());
        }
        if (earliest == Long.MAX_VALUE) {
            return completion.take();
        }
        long waitNanos = Math.max(0, earliest - System.nanoTime());
        return completion.poll(waitNanos, TimeUnit.NANOSECONDS);
    }

    private void expireOverdue(Map<Future<CopyOutcome>, InFlight> inFlight, List<CopyAttempt> abandoned,
                               Consumer<CopyOutcome> sink) {
        long now = System.nanoTime();
        List<Future<CopyOutcome>> expired = new ArrayList<>();
        for (Map.Entry<Future<CopyOutcome>, InFlight> entry : inFlight.entrySet()) {
            if (entry.getValue().deadline() <= now && !entry.getKey().isDone()) {
                expired.add(entry.getKey());
            }
        }
        for (Future<CopyOutcome> future : expired) {
            InFlight entry = inFlight.get(future);
            CopyAttempt attempt = entry.attempt();
            if (!attempt.settleByRunner()) {
                // 워커가 deadline 직후 결과를 확정함, 완료 큐에서 수신
                continue;
            }
            inFlight.remove(future);
            future.cancel(true);
            if (attempt.isStarted()) {
                abandoned.add(attempt);
            }
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(now - entry.startedAt());
            timeoutPolicy.recordTimeout(attempt.item().getId(), elapsedMs);
            log.warn("Copy of item {} timed out after {}ms", attempt.item().getId(), elapsedMs);
            sink.accept(CopyFailed.of(attempt.item().getId(), CopyStage.TIMEOUT,
                "Copy did not finish within " + timeoutPolicy.getPerItemTimeoutMs(attempt.item().kind()) + "ms"));
        }
    }

    private void awaitAbandoned(List<CopyAttempt> abandoned) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(config.shutdownTimeoutMs());
        for (CopyAttempt attempt : abandoned) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0 || !attempt.awaitFinished(remaining)) {
                log.warn("Timed-out copy of item {} still running after {}ms, its late result will be discarded",
                    attempt.item().getId(), config.shutdownTimeoutMs());
                return;
            }
        }
    }

    private CopyOutcome resolve(PromotableItem item, Future<CopyOutcome> future) {
        try {
            CopyOutcome outcome = future.get();
            if (outcome == null) {
                return CopyFailed.of(item.getId(), CopyStage.UNEXPECTED, "copy task returned no outcome");
            }
            return outcome;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Unexpected error while copying item {}: {}", item.getId(), cause.getMessage(), cause);
            return CopyFailed.of(item.getId(), CopyStage.UNEXPECTED, cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CopyFailed.of(item.getId(), CopyStage.UNEXPECTED, "Copy interrupted while in progress");
        }
    }

    private static CopyFailed aborted(PromotableItem item, String reason) {
        return CopyFailed.of(item.getId(), CopyStage.ABORTED, "Promotion aborted before item started: " + reason);
    }

    /**
     * 실제 워커 수.
     *
     * @return min(concurrency, maxItemsPerBatch)
     */
    public int getWidth() {
        return width;
    }

    /**
     * Runner 종료 (리소스 정리).
     *
     * <p>진행 중인 복사가 완료되도록 shutdownTimeoutMs까지 대기한 뒤,
     * 남은 작업은 인터럽트합니다.</p>
     *
     * @throws InterruptedException shutdown 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        workerExecutor.shutdown();
        if (!workerExecutor.awaitTermination(config.shutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
            workerExecutor.shutdownNow();
        }
    }

    private record InFlight(CopyAttempt attempt, long startedAt, long deadline) {
    }

    /**
     * 항목 하나의 복사 시도.
     *
     * <p>워커와 Runner 중 먼저 settle한 쪽이 결과를 확정합니다. Runner가 타임아웃으로 먼저 확정하면
     * 워커는 자신의 결과를 버리고, 이미 저장된 복사본은 {@link CopyTask#discard(Copied)}로 되돌립니다.</p>
     */
    private static final class CopyAttempt {

        private final PromotableItem item;
        private final AtomicBoolean settled = new AtomicBoolean();
        private final CountDownLatch finished = new CountDownLatch(1);
        private volatile boolean started;

        private CopyAttempt(PromotableItem item) {
            this.item = item;
        }

        PromotableItem item() {
            return item;
        }

        boolean isStarted() {
            return started;
        }

        boolean settleByRunner() {
            return settled.compareAndSet(false, true);
        }

        boolean awaitFinished(long timeoutNanos) throws InterruptedException {
            return finished.await(timeoutNanos, TimeUnit.NANOSECONDS);
        }

        CopyOutcome run(CopyTask task) {
            started = true;
            try {
                CopyOutcome outcome = task.copy(item);
                if (settled.compareAndSet(false, true)) {
                    return outcome;
                }
                if (outcome instanceof Copied copied) {
                    discardLate(task, copied);
                }
                return null;
            } catch (RuntimeException e) {
                if (settled.compareAndSet(false, true)) {
                    throw e;
                }
                log.warn("Copy of item {} failed after its timeout was reported: {}", item.getId(), e.getMessage(), e);
                return null;
            } finally {
                finished.countDown();
            }
        }

        private void discardLate(CopyTask task, Copied copied) {
            // cancel(true)로 남은 인터럽트가 저장소 호출을 방해하지 않도록 잠시 해제
            boolean interrupted = Thread.interrupted();
            try {
                task.discard(copied);
            } catch (RuntimeException e) {
                log.error("Late copy {} of item {} could not be discarded: {}",
                    copied.newId(), item.getId(), e.getMessage(), e);
            } finally {
                if (interrupted) {
                    Thread.currentThread().interrupt();
                }
            }
        }
    }

    private static final class CopyWorkerThreadFactory implements ThreadFactory {

        private final AtomicInteger sequence = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "promotion-copy-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
