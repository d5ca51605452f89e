/**
 * Model catalog value objects.
 *
 * <p>This package defines the immutable building blocks shared by every other package:</p>
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.aiorchestrator.core.model.ModelId} - Registry identifier</li>
 *   <li>{@link com.ryuqq.aiorchestrator.core.model.TaskType} - Capability / task-type tag</li>
 *   <li>{@link com.ryuqq.aiorchestrator.core.model.Tier} - Ordered caller privilege level</li>
 *   <li>{@link com.ryuqq.aiorchestrator.core.model.BackendKind} - Closed set of backend families</li>
 *   <li>{@link com.ryuqq.aiorchestrator.core.model.HealthState} - Backend health</li>
 * </ul>
 *
 * <h2>Records</h2>
 * <ul>
 *   <li>{@link com.ryuqq.aiorchestrator.core.model.ModelDescriptor} - Registry entry</li>
 *   <li>{@link com.ryuqq.aiorchestrator.core.model.Message} - Chat message</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.aiorchestrator.core.model;
