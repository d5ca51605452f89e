package com.ryuqq.aiorchestrator.application.health;

import com.ryuqq.aiorchestrator.core.model.ModelDescriptor;
import com.ryuqq.aiorchestrator.core.model.ModelId;
import com.ryuqq.aiorchestrator.core.spi.BackendAdapter;

import java.time.Instant;

/**
 * Recovery policy for UNAVAILABLE models.
 *
 * <p>An UNAVAILABLE model stays excluded from auto-selection until a recovery signal marks it
 * HEALTHY. This interface decides, per scan, whether a given model has recovered.</p>
 *
 * <p><strong>Recovery Flow:</strong></p>
 * <pre>
 * scan() starts
 *   ↓
 * for each UNAVAILABLE model:
 *   1. policy.shouldRecover(descriptor, adapter, now)
 *   2. true  → registry.setHealth(id, HEALTHY)  (failure counter resets on the transition)
 *      false → stays UNAVAILABLE
 * </pre>
 *
 * <p><strong>Built-in Policies:</strong></p>
 * <ul>
 *   <li>Manual: never recovers on its own; only an operator action marks the model healthy</li>
 *   <li>Interval probe: calls {@link BackendAdapter#probe(ModelDescriptor)} at most once per interval</li>
 * </ul>
 *
 * <p><strong>Thread Safety:</strong> a policy may be invoked from the monitoring thread while
 * queries run concurrently; implementations keeping per-model state must be thread-safe.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface HealthRecoveryPolicy {

    /**
     * Decides whether an UNAVAILABLE model has recovered.
     *
     * <p>Implementations must not throw for an unreachable backend; a failed probe is simply
     * {@code false}.</p>
     *
     * @param descriptor the UNAVAILABLE model
     * @param adapter the adapter serving the model's backend kind (never null)
     * @param now current time of the scan
     * @return true to mark the model HEALTHY
     */
    boolean shouldRecover(ModelDescriptor descriptor, BackendAdapter adapter, Instant now);

    /**
     * Called when a model is marked UNAVAILABLE, so time-based policies can reset their clock.
     *
     * @param modelId the model that just became UNAVAILABLE
     * @param at transition time
     */
    default void onUnavailable(ModelId modelId, Instant at) {
        // no state by default
    }
}
