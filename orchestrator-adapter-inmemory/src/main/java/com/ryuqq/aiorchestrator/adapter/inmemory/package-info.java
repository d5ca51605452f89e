/**
 * In-memory SPI adapters.
 *
 * <p>Reference implementations of the registry and interaction-log SPIs, suitable for
 * single-process deployments and contract tests.</p>
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.aiorchestrator.adapter.inmemory.registry.InMemoryModelRegistry}:
 *       Snapshot-swap implementation of {@link com.ryuqq.aiorchestrator.core.spi.ModelRegistry}</li>
 *   <li>{@link com.ryuqq.aiorchestrator.adapter.inmemory.log.InMemoryInteractionLog}:
 *       Bounded implementation of {@link com.ryuqq.aiorchestrator.core.spi.InteractionLog}</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Registry state is not shared across processes</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.aiorchestrator.adapter.inmemory;
