/**
 * Query outcome package.
 *
 * <p>This package defines the sealed result hierarchy returned by
 * {@code ModelOrchestrator.submit}, giving callers an explicit success/failure value
 * instead of an exception.</p>
 *
 * <h2>Outcome Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.aiorchestrator.core.outcome.Ok} - Canonical response</li>
 *   <li>{@link com.ryuqq.aiorchestrator.core.outcome.Fail} - Typed error kind and message</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.aiorchestrator.core.outcome;
