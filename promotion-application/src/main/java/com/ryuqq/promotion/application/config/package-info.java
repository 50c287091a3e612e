/**
 * Promotion configuration.
 *
 * <p>{@link com.ryuqq.promotion.application.config.PromotionConfig} is an immutable record;
 * {@link com.ryuqq.promotion.application.config.PromotionConfigLoader} builds it from
 * {@code promotion.properties}.</p>
 *
 * @since 1.0.0
 * @author Promotion Team
 */
package com.ryuqq.promotion.application.config;
