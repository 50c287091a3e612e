/**
 * Protection hooks for item copies.
 *
 * <p>{@link com.ryuqq.promotion.core.protection.TimeoutPolicy} bounds a single item copy.
 * A timeout is recorded as an ordinary item-level error, never as a job-level abort.</p>
 *
 * @since 1.0.0
 * @author Promotion Team
 */
package com.ryuqq.promotion.core.protection;
