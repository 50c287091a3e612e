/**
 * Per-item copy across the record store, object store and vector index, and the runners
 * that drive it.
 *
 * <p>{@link com.ryuqq.promotion.application.copy.ItemCopier} always writes the payload before
 * the record. {@link com.ryuqq.promotion.application.copy.CopyRunner} implementations deliver
 * every outcome to a single consumer on the calling thread.</p>
 *
 * @since 1.0.0
 * @author Promotion Team
 */
package com.ryuqq.promotion.application.copy;
