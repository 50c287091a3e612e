/**
 * Promotion path validation.
 *
 * <p>{@link com.ryuqq.promotion.core.validation.PathValidator} encodes the fixed environment set and the
 * configured allow-list of {@link com.ryuqq.promotion.core.validation.PromotionPath}s. Rejections are
 * returned as {@link com.ryuqq.promotion.core.validation.PathValidation} values, never thrown.</p>
 *
 * @since 1.0.0
 * @author Promotion Team
 */
package com.ryuqq.promotion.core.validation;
