package com.ryuqq.aiorchestrator.core.spi;

import com.ryuqq.aiorchestrator.core.exception.DuplicateModelException;
import com.ryuqq.aiorchestrator.core.exception.UnknownModelException;
import com.ryuqq.aiorchestrator.core.model.HealthState;
import com.ryuqq.aiorchestrator.core.model.ModelDescriptor;
import com.ryuqq.aiorchestrator.core.model.ModelId;
import com.ryuqq.aiorchestrator.core.model.TaskType;

import java.util.List;

/**
 * Model catalog SPI.
 *
 * <p>The registry owns every {@link ModelDescriptor} for the lifetime of the process.
 * Descriptors are created at startup (or by explicit registration) and removed only by
 * explicit deregistration; nothing is evicted implicitly.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Unique identifier → descriptor mapping</li>
 *   <li>Capability lookup with a deterministic preference order (seed for auto-selection)</li>
 *   <li>Atomic health-state transitions visible to the next selection</li>
 *   <li>Health-change notification for failure tracking and monitoring</li>
 * </ul>
 *
 * <p><strong>Capability Ordering:</strong></p>
 * <pre>
 * 1. health rank    HEALTHY &lt; DEGRADED &lt; UNAVAILABLE
 * 2. required tier  descending
 * 3. registration   ascending (re-registration moves a model to the end)
 * </pre>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: reads must be safe under concurrent register/deregister/setHealth</li>
 *   <li>Read-mostly: readers must never observe a half-updated descriptor</li>
 *   <li>No lock may be held by the caller while a backend dispatch is in flight</li>
 * </ul>
 *
 * <p>Components receive the registry explicitly; there is no global instance.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ModelRegistry {

    /**
     * Registers a descriptor.
     *
     * @param descriptor the descriptor to add
     * @throws DuplicateModelException if the identifier is already registered
     * @throws com.ryuqq.aiorchestrator.core.exception.SchemaValidationException if the descriptor is malformed
     * @throws IllegalArgumentException if descriptor is null
     */
    void register(ModelDescriptor descriptor);

    /**
     * Removes a descriptor.
     *
     * <p>In-flight calls are unaffected: they captured the descriptor by value.</p>
     *
     * @param modelId the identifier to remove
     * @return the removed descriptor
     * @throws UnknownModelException if the identifier is not registered
     */
    ModelDescriptor deregister(ModelId modelId);

    /**
     * Looks up a descriptor.
     *
     * @param modelId the identifier
     * @return the current descriptor (a value snapshot)
     * @throws UnknownModelException if the identifier is not registered
     */
    ModelDescriptor lookup(ModelId modelId);

    /**
     * Returns the descriptors declaring a capability, in capability ordering.
     *
     * @param taskType the capability tag
     * @return ordered descriptors (empty if none)
     */
    List<ModelDescriptor> listByCapability(TaskType taskType);

    /**
     * Returns every descriptor in registration order.
     *
     * @return all descriptors
     */
    List<ModelDescriptor> listAll();

    /**
     * Sets the health state of a model.
     *
     * <p>Idempotent: setting the current state again is a no-op and does not notify listeners.
     * The transition is atomic and immediately visible to subsequent lookups.</p>
     *
     * @param modelId the identifier
     * @param state the new state
     * @return the descriptor after the transition
     * @throws UnknownModelException if the identifier is not registered
     */
    ModelDescriptor setHealth(ModelId modelId, HealthState state);

    /**
     * Sets the health state only if the model is currently in the expected state.
     *
     * <p>The comparison and the transition happen as one atomic step, so a concurrent writer
     * cannot be overwritten with a state computed from a stale read. Listeners are notified
     * only when the transition takes place.</p>
     *
     * @param modelId the identifier
     * @param expected the state the model must be in
     * @param next the new state
     * @return true if the model was in {@code expected} and is now in {@code next}
     * @throws UnknownModelException if the identifier is not registered
     */
    boolean compareAndSetHealth(ModelId modelId, HealthState expected, HealthState next);

    /**
     * Checks registration.
     *
     * @param modelId the identifier
     * @return true if registered
     */
    boolean contains(ModelId modelId);

    /**
     * @return number of registered models
     */
    int size();

    /**
     * Adds a listener notified after every effective health transition and after every
     * registration or deregistration.
     *
     * @param listener the listener
     */
    void addHealthListener(HealthListener listener);
}
