/**
 * Per-item copy outcomes.
 *
 * <p>{@link com.ryuqq.promotion.core.outcome.CopyOutcome} is a sealed interface with two cases,
 * {@link com.ryuqq.promotion.core.outcome.Copied} and {@link com.ryuqq.promotion.core.outcome.CopyFailed}.
 * Item-level failures are values, never exceptions visible to the caller of Execute.</p>
 *
 * @since 1.0.0
 * @author Promotion Team
 */
package com.ryuqq.promotion.core.outcome;
