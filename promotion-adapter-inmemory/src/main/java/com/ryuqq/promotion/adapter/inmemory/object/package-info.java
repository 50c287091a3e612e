/**
 * In-memory binary object store.
 *
 * @since 1.0.0
 * @author Promotion Team
 */
package com.ryuqq.promotion.adapter.inmemory.object;
