/**
 * Tier-based permission checking.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.aiorchestrator.core.permission;
