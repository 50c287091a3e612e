/**
 * Promotion orchestration: preview, execute, rollback and the audit trail queries.
 *
 * <p>Every {@link com.ryuqq.promotion.core.model.PromotionRecord} state change goes through
 * {@link com.ryuqq.promotion.core.statemachine.StateTransition} and is persisted as a new snapshot.</p>
 *
 * @since 1.0.0
 * @author Promotion Team
 */
package com.ryuqq.promotion.application.orchestrator;
