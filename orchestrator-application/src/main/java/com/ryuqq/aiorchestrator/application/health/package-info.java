/**
 * Health recovery API.
 *
 * <p>The recovery signal for UNAVAILABLE models is pluggable. Implementations live in the
 * adapter-runner module and are driven by its health monitor.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.aiorchestrator.application.health;
