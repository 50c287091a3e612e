package com.ryuqq.promotion.testkit.contract;

import com.ryuqq.promotion.application.orchestrator.PromotionResult;
import com.ryuqq.promotion.core.model.ContentKind;
import com.ryuqq.promotion.core.model.Environment;
import com.ryuqq.promotion.core.model.ItemId;
import com.ryuqq.promotion.core.model.PromotableItem;
import com.ryuqq.promotion.core.model.PromotionId;
import com.ryuqq.promotion.core.statemachine.PromotionState;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for concurrent Execute calls and operator abort.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Concurrent Execute for the same (kind, source, target) never duplicates an item</li>
 *   <li>Abort stops items that have not started, the running item completes</li>
 *   <li>Running promotions are listed only while Execute is in progress</li>
 * </ul>
 *
 * @author Promotion Team
 * @since 1.0.0
 */
class ConcurrencyContractTest extends AbstractPromotionContractTest {

    @Test
    void testConcurrentExecuteOfSameTriple_NoDuplicates() throws Exception {
        // Given
        for (int i = 1; i <= 10; i++) {
            seedApprovedConfig("c" + i, Environment.DEV);
        }
        int callers = 4;
        ExecutorService executorService = Executors.newFixedThreadPool(callers);
        CountDownLatch startLatch = new CountDownLatch(1);
        List<Future<PromotionResult>> futures = new ArrayList<>();

        // When
        for (int i = 0; i < callers; i++) {
            futures.add(executorService.submit(() -> {
                startLatch.await();
                return execute(ContentKind.CONFIG, "dev", "stage");
            }));
        }
        startLatch.countDown();

        int totalSuccess = 0;
        for (Future<PromotionResult> future : futures) {
            PromotionResult result = future.get(10, TimeUnit.SECONDS);
            assertEquals(PromotionState.SUCCESS, result.status());
            totalSuccess += result.successCount();
        }
        executorService.shutdown();

        // Then
        assertEquals(10, totalSuccess);
        assertItemCount(ContentKind.CONFIG, Environment.STAGE, 10);
        Set<ItemId> sources = new HashSet<>();
        for (PromotableItem item : items.findAll(ContentKind.CONFIG, Environment.STAGE)) {
            assertTrue(sources.add(item.getSourceIdOrNull()), "duplicate copy of " + item.getSourceIdOrNull());
        }
    }

    @Test
    void testAbortDuringExecute_SkipsItemsNotStarted() {
        // Given: abort requested while the first payload is being read
        seedApprovedAudio("a1", Environment.DEV);
        seedApprovedAudio("a2", Environment.DEV);
        seedApprovedAudio("a3", Environment.DEV);
        AtomicBoolean aborted = new AtomicBoolean();
        objectStore.beforeRead((bucket, key) -> {
            if (aborted.compareAndSet(false, true)) {
                List<PromotionId> running = orchestrator.runningPromotions();
                assertEquals(1, running.size());
                assertTrue(orchestrator.abort(running.get(0), "bad batch"));
            }
        });

        // When
        PromotionResult result = execute(ContentKind.AUDIO_RESOURCE, "dev", "stage");

        // Then
        assertEquals(PromotionState.PARTIAL_SUCCESS, result.status());
        assertEquals(1, result.successCount());
        assertEquals(2, result.errorCount());
        assertEquals("[ABORTED] Promotion aborted before item started: bad batch", result.errors().get("a2"));
        assertEquals("[ABORTED] Promotion aborted before item started: bad batch", result.errors().get("a3"));
        assertItemCount(ContentKind.AUDIO_RESOURCE, Environment.STAGE, 1);
    }

    @Test
    void testRunningPromotions_EmptyOutsideExecute() {
        seedApprovedConfig("c1", Environment.DEV);

        PromotionResult result = execute(ContentKind.CONFIG, "dev", "stage");

        assertTrue(orchestrator.runningPromotions().isEmpty());
        assertFalse(orchestrator.abort(result.promotionId(), "too late"));
    }
}
