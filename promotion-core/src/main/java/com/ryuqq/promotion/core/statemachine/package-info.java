/**
 * Promotion record state machine package.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.promotion.core.statemachine.PromotionState} - Promotion lifecycle states (enum)</li>
 *   <li>{@link com.ryuqq.promotion.core.statemachine.StateTransition} - State transition validation and execution</li>
 * </ul>
 *
 * <h2>State Transition Rules</h2>
 * <pre>
 * PENDING → IN_PROGRESS
 * IN_PROGRESS → SUCCESS | PARTIAL_SUCCESS | FAILED
 * SUCCESS | PARTIAL_SUCCESS → ROLLED_BACK (explicit rollback only)
 *
 * Forbidden:
 * - FAILED → * (nothing was copied, nothing to roll back)
 * - ROLLED_BACK → *
 * </pre>
 *
 * @since 1.0.0
 * @author Promotion Team
 */
package com.ryuqq.promotion.core.statemachine;
