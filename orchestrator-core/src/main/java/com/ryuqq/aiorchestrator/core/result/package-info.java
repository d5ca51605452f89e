/**
 * Canonical result payloads.
 *
 * <p>Each backend kind produces exactly one payload type. The mapping is fixed by
 * {@link com.ryuqq.aiorchestrator.core.result.ResultPayload#typeFor} and enforced by the schema layer.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.aiorchestrator.core.result;
