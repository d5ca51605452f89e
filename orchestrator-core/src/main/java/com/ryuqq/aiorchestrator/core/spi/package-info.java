/**
 * Service Provider Interfaces.
 *
 * <h2>SPIs</h2>
 * <ul>
 *   <li>{@link com.ryuqq.aiorchestrator.core.spi.ModelRegistry} - Model catalog with health state</li>
 *   <li>{@link com.ryuqq.aiorchestrator.core.spi.BackendAdapter} - One adapter per backend family</li>
 *   <li>{@link com.ryuqq.aiorchestrator.core.spi.InteractionLog} - Usage log and statistics</li>
 *   <li>{@link com.ryuqq.aiorchestrator.core.spi.HealthListener} - Health transition callback</li>
 * </ul>
 *
 * <h2>Implementations</h2>
 * <ul>
 *   <li>orchestrator-adapter-inmemory: registry and interaction log</li>
 *   <li>orchestrator-adapter-backend: Ollama and classifier adapters</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.aiorchestrator.core.spi;
