/**
 * Read-only promotion preview.
 *
 * @since 1.0.0
 * @author Promotion Team
 */
package com.ryuqq.promotion.application.preview;
