/**
 * Backend adapters: one {@link com.ryuqq.aiorchestrator.core.spi.BackendAdapter} per backend kind.
 *
 * <ul>
 *   <li>{@code ollama}: general-model, vision and code-analysis adapters over the Ollama HTTP API</li>
 *   <li>{@code classifier}: in-process trained classifiers behind {@code ClassifierRuntime}</li>
 * </ul>
 *
 * <p>Adapters translate every backend-native failure into
 * {@link com.ryuqq.aiorchestrator.core.exception.AdapterException}; nothing else crosses the boundary.</p>
 */
package com.ryuqq.aiorchestrator.adapter.backend;
