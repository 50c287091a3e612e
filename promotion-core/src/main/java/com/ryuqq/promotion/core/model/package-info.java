/**
 * Promotion domain model.
 *
 * <p>Value objects ({@link com.ryuqq.promotion.core.model.ItemId},
 * {@link com.ryuqq.promotion.core.model.PromotionId}, {@link com.ryuqq.promotion.core.model.ActorId}),
 * the environment enum, the polymorphic {@link com.ryuqq.promotion.core.model.PromotableItem}
 * hierarchy with its capability interfaces, and the append-only
 * {@link com.ryuqq.promotion.core.model.PromotionRecord} audit entity.</p>
 *
 * <h2>Capabilities</h2>
 * <ul>
 *   <li>{@link com.ryuqq.promotion.core.model.HasPayload} - binary payload in the object store</li>
 *   <li>{@link com.ryuqq.promotion.core.model.HasVectorPoints} - points in the vector index keyed by item id</li>
 *   <li>{@link com.ryuqq.promotion.core.model.HasSize} - byte size reported in previews</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Promotion Team
 */
package com.ryuqq.promotion.core.model;
