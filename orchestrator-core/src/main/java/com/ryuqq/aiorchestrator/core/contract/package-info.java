/**
 * Query contract.
 *
 * <ul>
 *   <li>{@link com.ryuqq.aiorchestrator.core.contract.QueryRequest} - Caller request (input, tier, optional model, hint, parameters, timeout)</li>
 *   <li>{@link com.ryuqq.aiorchestrator.core.contract.QueryResponse} - Canonical response</li>
 *   <li>{@link com.ryuqq.aiorchestrator.core.contract.QueryInput} - Free text or structured payload</li>
 *   <li>{@link com.ryuqq.aiorchestrator.core.contract.QueryOption} - Recognized parameter names</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.aiorchestrator.core.contract;
