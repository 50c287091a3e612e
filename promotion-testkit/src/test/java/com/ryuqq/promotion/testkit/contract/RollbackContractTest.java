package com.ryuqq.promotion.testkit.contract;

import com.ryuqq.promotion.application.orchestrator.PromotionResult;
import com.ryuqq.promotion.application.orchestrator.RollbackException;
import com.ryuqq.promotion.application.orchestrator.RollbackResult;
import com.ryuqq.promotion.core.model.ActorId;
import com.ryuqq.promotion.core.model.ContentKind;
import com.ryuqq.promotion.core.model.Environment;
import com.ryuqq.promotion.core.model.ItemId;
import com.ryuqq.promotion.core.model.PromotionId;
import com.ryuqq.promotion.core.model.PromotionRecord;
import com.ryuqq.promotion.core.model.PromotionStatus;
import com.ryuqq.promotion.core.spi.StoreNames;
import com.ryuqq.promotion.core.statemachine.PromotionState;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for Rollback.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Rollback deletes exactly the created ids and marks the record ROLLED_BACK</li>
 *   <li>Second rollback of the same promotion is rejected</li>
 *   <li>Failed promotions cannot be rolled back</li>
 *   <li>Per-id deletion failures are reported, progress on other ids is kept</li>
 *   <li>The rollback window is advisory only</li>
 * </ul>
 *
 * @author Promotion Team
 * @since 1.0.0
 */
class RollbackContractTest extends AbstractPromotionContractTest {

    private static final ActorId OPERATOR = ActorId.of("on-call");

    @Test
    void testRollback_DeletesExactlyCreatedIds() {
        // Given: one item already in stage before the promotion
        seedApprovedConfig("existing", Environment.STAGE);
        seedApprovedConfig("c1", Environment.DEV);
        seedApprovedConfig("c2", Environment.DEV);
        PromotionResult promotion = execute(ContentKind.CONFIG, "dev", "stage");
        assertItemCount(ContentKind.CONFIG, Environment.STAGE, 3);

        // When
        RollbackResult rollback = orchestrator.rollback(promotion.promotionId(), OPERATOR);

        // Then
        assertTrue(rollback.isComplete());
        assertEquals(promotion.createdIds(), rollback.deletedIds());
        assertItemCount(ContentKind.CONFIG, Environment.STAGE, 1);
        assertTrue(items.findById(ItemId.of("existing")).isPresent());
        assertPromotionState(promotion.promotionId(), PromotionState.ROLLED_BACK);

        PromotionRecord record = orchestrator.findPromotion(promotion.promotionId()).orElseThrow();
        assertEquals(OPERATOR, record.getRolledBackByOrNull());
        assertEquals(START, record.getRolledBackAtOrNull());
    }

    @Test
    void testRollback_KeepsSourceBookkeepingAndPayloads() {
        seedApprovedAudio("a1", Environment.DEV);
        seedApprovedDocument("d1", Environment.DEV);
        PromotionResult audio = execute(ContentKind.AUDIO_RESOURCE, "dev", "stage");
        PromotionResult documents = execute(ContentKind.DOCUMENT, "dev", "stage");

        orchestrator.rollback(audio.promotionId(), OPERATOR);
        orchestrator.rollback(documents.promotionId(), OPERATOR);

        assertEquals(PromotionStatus.PROMOTED, loadItem(ItemId.of("a1")).getPromotionStatus());
        assertPayloadPresent(Environment.STAGE, "a1.mp3");
        assertTrue(vectors.contains(StoreNames.collectionName(DOCS_COLLECTION, Environment.STAGE), ItemId.of("d1")));
    }

    @Test
    void testSecondRollback_Rejected() {
        seedApprovedConfig("c1", Environment.DEV);
        PromotionResult promotion = execute(ContentKind.CONFIG, "dev", "stage");
        orchestrator.rollback(promotion.promotionId(), OPERATOR);

        RollbackException exception = assertThrows(RollbackException.class,
            () -> orchestrator.rollback(promotion.promotionId(), OPERATOR));

        assertEquals(promotion.promotionId(), exception.getPromotionId());
        assertTrue(exception.getMessage().contains("already rolled back"));
    }

    @Test
    void testRollbackOfFailedPromotion_Rejected() {
        seedApprovedConfig("c1", Environment.DEV);
        PromotionResult rejected = execute(ContentKind.CONFIG, "dev", "dev");

        assertThrows(RollbackException.class, () -> orchestrator.rollback(rejected.promotionId(), OPERATOR));
        assertPromotionState(rejected.promotionId(), PromotionState.FAILED);
    }

    @Test
    void testRollbackOfUnknownPromotion_Rejected() {
        RollbackException exception = assertThrows(RollbackException.class,
            () -> orchestrator.rollback(PromotionId.of("missing"), OPERATOR));

        assertTrue(exception.getMessage().contains("not found"));
    }

    @Test
    void testRollbackWithDeletionFailures_ReportsFailuresAndKeepsProgress() {
        // Given
        seedApprovedConfig("c1", Environment.DEV);
        seedApprovedConfig("c2", Environment.DEV);
        seedApprovedConfig("c3", Environment.DEV);
        PromotionResult promotion = execute(ContentKind.CONFIG, "dev", "stage");
        List<ItemId> created = promotion.createdIds();
        contentStore.failDeleteOf(created.get(0));
        items.delete(created.get(1));

        // When
        RollbackResult rollback = orchestrator.rollback(promotion.promotionId(), OPERATOR);

        // Then
        assertFalse(rollback.isComplete());
        assertEquals(List.of(created.get(2)), rollback.deletedIds());
        assertEquals(2, rollback.failures().size());
        assertEquals("Item not found in target environment", rollback.failures().get(created.get(1)));
        assertTrue(rollback.failures().get(created.get(0)).contains("Simulated delete failure"));
        assertPromotionState(promotion.promotionId(), PromotionState.ROLLED_BACK);
        assertItemCount(ContentKind.CONFIG, Environment.STAGE, 1);
    }

    @Test
    void testRollbackAfterWindow_StillPerformed() {
        seedApprovedConfig("c1", Environment.DEV);
        PromotionResult promotion = execute(ContentKind.CONFIG, "dev", "stage");
        clock.advance(Duration.ofHours(73));

        RollbackResult rollback = orchestrator.rollback(promotion.promotionId(), OPERATOR);

        assertTrue(rollback.isComplete());
        assertEquals(START.plus(Duration.ofHours(73)), rollback.rolledBackAt());
        assertPromotionState(promotion.promotionId(), PromotionState.ROLLED_BACK);
    }

    @Test
    void testPartialSuccess_CanBeRolledBack() {
        seedApprovedAudio("a1", Environment.DEV);
        seedApprovedAudio("a2", Environment.DEV);
        objectStore.failReadsOf("a2.mp3");
        PromotionResult promotion = execute(ContentKind.AUDIO_RESOURCE, "dev", "stage");
        assertEquals(PromotionState.PARTIAL_SUCCESS, promotion.status());

        RollbackResult rollback = orchestrator.rollback(promotion.promotionId(), OPERATOR);

        assertEquals(1, rollback.deletedIds().size());
        assertItemCount(ContentKind.AUDIO_RESOURCE, Environment.STAGE, 0);
    }
}
