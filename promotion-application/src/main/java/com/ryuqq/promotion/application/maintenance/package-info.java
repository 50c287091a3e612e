/**
 * Maintenance jobs that keep promotion eligibility accurate.
 *
 * @since 1.0.0
 * @author Promotion Team
 */
package com.ryuqq.promotion.application.maintenance;
