/**
 * In-memory content store.
 *
 * @since 1.0.0
 * @author Promotion Team
 */
package com.ryuqq.promotion.adapter.inmemory.content;
