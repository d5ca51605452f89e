/**
 * Schema layer.
 *
 * <p>Backend-agnostic validation of requests, result payloads and registration entries.
 * Every violation is reported as a
 * {@link com.ryuqq.aiorchestrator.core.exception.SchemaValidationException}.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.aiorchestrator.core.schema.SchemaValidator} - Request / payload / descriptor validation</li>
 *   <li>{@link com.ryuqq.aiorchestrator.core.schema.DescriptorSchema} - Registration entry to descriptor</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.aiorchestrator.core.schema;
