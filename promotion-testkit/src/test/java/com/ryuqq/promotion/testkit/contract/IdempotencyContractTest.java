package com.ryuqq.promotion.testkit.contract;

import com.ryuqq.promotion.application.orchestrator.ExecuteRequest;
import com.ryuqq.promotion.application.orchestrator.PromotionResult;
import com.ryuqq.promotion.application.preview.PromotionPreview;
import com.ryuqq.promotion.core.model.ContentKind;
import com.ryuqq.promotion.core.model.Environment;
import com.ryuqq.promotion.core.model.ItemId;
import com.ryuqq.promotion.core.model.PromotableItem;
import com.ryuqq.promotion.core.statemachine.PromotionState;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for item-level idempotency and result counting.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Re-running Execute after a full promotion copies nothing</li>
 *   <li>successCount + errorCount equals the number of items Preview reports</li>
 *   <li>Draft and test-data items are never selected</li>
 *   <li>An explicit id set narrows the eligible set</li>
 * </ul>
 *
 * @author Promotion Team
 * @since 1.0.0
 */
class IdempotencyContractTest extends AbstractPromotionContractTest {

    @Test
    void testRerunAfterFullPromotion_PromotesNothing() {
        // Given
        seedApprovedConfig("c1", Environment.DEV);
        seedApprovedConfig("c2", Environment.DEV);
        PromotionResult first = execute(ContentKind.CONFIG, "dev", "stage");
        assertEquals(2, first.successCount());

        // When
        PromotionResult second = execute(ContentKind.CONFIG, "dev", "stage");

        // Then
        assertEquals(PromotionState.SUCCESS, second.status());
        assertEquals(0, second.successCount());
        assertEquals(0, second.errorCount());
        assertItemCount(ContentKind.CONFIG, Environment.STAGE, 2);
    }

    @Test
    void testCounts_MatchPreviewOfSameEligibleSet() {
        // Given: eligible, draft, test-data and failing items mixed
        seedApprovedAudio("a1", Environment.DEV);
        seedApprovedAudio("a2", Environment.DEV);
        seedApprovedAudio("a3", Environment.DEV);
        seedApprovedAudio("a4", Environment.DEV);
        PromotableItem flagged = loadItem(ItemId.of("a4"));
        flagged.markAsTestData("fixture");
        items.update(flagged);
        objectStore.failReadsOf("a3.mp3");

        // When
        PromotionPreview preview = orchestrator.preview(ContentKind.AUDIO_RESOURCE, "dev", "stage", null);
        PromotionResult result = execute(ContentKind.AUDIO_RESOURCE, "dev", "stage");

        // Then
        assertTrue(preview.isValid());
        assertEquals(3, preview.totalCount());
        assertEquals(preview.totalCount(), result.totalProcessed());
        assertEquals(result.successCount() + result.errorCount(), result.totalProcessed());
        assertEquals(result.errorCount(), result.errors().size());
    }

    @Test
    void testDraftItems_NotSelected() {
        seedDraftConfig("draft", Environment.DEV);
        seedApprovedConfig("c1", Environment.DEV);

        PromotionResult result = execute(ContentKind.CONFIG, "dev", "stage");

        assertEquals(1, result.successCount());
        assertEquals(List.of(ItemId.of("c1")),
            result.itemsPromoted().stream().map(item -> item.sourceId()).toList());
    }

    @Test
    void testExplicitIds_NarrowEligibleSet() {
        seedApprovedConfig("c1", Environment.DEV);
        seedApprovedConfig("c2", Environment.DEV);
        seedDraftConfig("draft", Environment.DEV);

        PromotionResult result = orchestrator.execute(ExecuteRequest.of(ContentKind.CONFIG, "dev", "stage", ACTOR)
            .withItemIds(Set.of(ItemId.of("c2"), ItemId.of("draft"))));

        assertEquals(1, result.successCount());
        assertEquals(0, result.errorCount());
        assertItemCount(ContentKind.CONFIG, Environment.STAGE, 1);
    }

    @Test
    void testPromotedCopy_CanBePromotedFurther() {
        // Given: dev → stage
        seedApprovedConfig("c1", Environment.DEV);
        execute(ContentKind.CONFIG, "dev", "stage");

        // When: promoted copies are PROMOTED, not APPROVED, so stage → prod selects nothing
        PromotionResult result = execute(ContentKind.CONFIG, "stage", "prod");

        // Then
        assertEquals(0, result.totalProcessed());
        assertItemCount(ContentKind.CONFIG, Environment.PROD, 0);
    }
}
