/**
 * Typed error taxonomy.
 *
 * <p>Every caller-visible failure is an
 * {@link com.ryuqq.aiorchestrator.core.exception.OrchestrationException} subtype carrying an
 * {@link com.ryuqq.aiorchestrator.core.exception.ErrorKind}.
 * {@link com.ryuqq.aiorchestrator.core.exception.AdapterException} is internal to the
 * adapter boundary and is always re-mapped before it reaches a caller.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.aiorchestrator.core.exception;
