/**
 * Service Provider Interfaces for the three backing stores and the audit record store.
 *
 * <p>This package defines the contracts consumed by the promotion engine. Concrete implementations
 * live in adapter modules (e.g., {@code promotion-adapter-inmemory}) or in the host application.</p>
 *
 * <h2>Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.promotion.core.spi.ContentStore} - relational content records (find/insert/update/delete)</li>
 *   <li>{@link com.ryuqq.promotion.core.spi.PromotionRecordStore} - append-only promotion audit records</li>
 *   <li>{@link com.ryuqq.promotion.core.spi.ObjectStore} - byte-level get/put on environment-prefixed buckets</li>
 *   <li>{@link com.ryuqq.promotion.core.spi.VectorIndex} - point copy between environment-suffixed collections</li>
 * </ul>
 *
 * <h2>Consistency</h2>
 * <p>No distributed transaction spans these stores. Cross-store consistency relies on copy ordering
 * (payload before record) and per-item independence.</p>
 *
 * @since 1.0.0
 * @author Promotion Team
 */
package com.ryuqq.promotion.core.spi;
