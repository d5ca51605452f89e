package com.ryuqq.aiorchestrator.core.spi;

import com.ryuqq.aiorchestrator.core.contract.QueryRequest;
import com.ryuqq.aiorchestrator.core.exception.AdapterException;
import com.ryuqq.aiorchestrator.core.model.BackendKind;
import com.ryuqq.aiorchestrator.core.model.ModelDescriptor;
import com.ryuqq.aiorchestrator.core.result.ResultPayload;

/**
 * Backend adapter SPI.
 *
 * <p>One adapter per {@link BackendKind}. An adapter translates a canonical request into the
 * backend's native call and the native result back into the canonical payload for its kind.</p>
 *
 * <p><strong>Contract:</strong></p>
 * <ul>
 *   <li>Stateless with respect to orchestration (no routing, no health bookkeeping)</li>
 *   <li>No backend-native exception crosses the boundary: every failure is an {@link AdapterException}</li>
 *   <li>Backend-specific low-level retry (e.g. one reconnect) is internal and invisible</li>
 *   <li>Must respond to thread interruption where the underlying I/O allows it
 *       (the orchestrator cancels timed-out calls best-effort)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface BackendAdapter {

    /**
     * @return the backend family this adapter serves
     */
    BackendKind backendKind();

    /**
     * Invokes the model described by {@code descriptor}.
     *
     * @param descriptor the selected model (captured by value at selection time)
     * @param request the validated canonical request
     * @return canonical payload for {@link #backendKind()}
     * @throws AdapterException normalized failure
     */
    ResultPayload invoke(ModelDescriptor descriptor, QueryRequest request) throws AdapterException;

    /**
     * Lightweight liveness check used by health recovery.
     *
     * <p>The default implementation reports the backend as reachable; adapters with a cheap
     * health endpoint should override it.</p>
     *
     * @param descriptor the model to probe
     * @return true if the backend answered
     */
    default boolean probe(ModelDescriptor descriptor) {
        return true;
    }
}
