package com.ryuqq.aiorchestrator.testkit.contract;

import com.ryuqq.aiorchestrator.core.contract.QueryRequest;
import com.ryuqq.aiorchestrator.core.exception.AdapterException;
import com.ryuqq.aiorchestrator.core.model.BackendKind;
import com.ryuqq.aiorchestrator.core.model.ModelDescriptor;
import com.ryuqq.aiorchestrator.core.model.ModelId;
import com.ryuqq.aiorchestrator.core.result.ChatResult;
import com.ryuqq.aiorchestrator.core.result.ClassificationResult;
import com.ryuqq.aiorchestrator.core.result.CodeAnalysisResult;
import com.ryuqq.aiorchestrator.core.result.ResultPayload;
import com.ryuqq.aiorchestrator.core.result.VisionResult;
import com.ryuqq.aiorchestrator.core.spi.BackendAdapter;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scriptable in-process BackendAdapter for testing purposes.
 *
 * <p>Each model can be scripted independently; unscripted models return a canonical
 * payload for this adapter's backend kind.</p>
 *
 * <p><strong>Features:</strong></p>
 * <ul>
 *   <li>Per-model responses and failures (transient, permanent, malformed)</li>
 *   <li>Per-model latency (interruptible, so caller timeouts cancel it)</li>
 *   <li>Per-model invocation counters</li>
 *   <li>Probe result toggle for recovery tests</li>
 * </ul>
 *
 * <p>Thread-safe: scripts and counters use concurrent collections.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class StubBackendAdapter implements BackendAdapter {

    private final BackendKind backendKind;
    private final Map<ModelId, Behavior> behaviors = new ConcurrentHashMap<>();
    private final Map<ModelId, Duration> latencies = new ConcurrentHashMap<>();
    private final Map<ModelId, AtomicInteger> invocations = new ConcurrentHashMap<>();
    private final AtomicInteger totalInvocations = new AtomicInteger();
    private final AtomicBoolean probeResult = new AtomicBoolean(true);

    /**
     * Creates a stub for the given backend kind.
     *
     * @param backendKind the backend kind this stub serves
     */
    public StubBackendAdapter(BackendKind backendKind) {
        if (backendKind == null) {
            throw new IllegalArgumentException("backendKind cannot be null");
        }
        this.backendKind = backendKind;
    }

    @Override
    public BackendKind backendKind() {
        return backendKind;
    }

    @Override
    public ResultPayload invoke(ModelDescriptor descriptor, QueryRequest request) throws AdapterException {
        invocations.computeIfAbsent(descriptor.id(), id -> new AtomicInteger()).incrementAndGet();
        totalInvocations.incrementAndGet();

        Duration latency = latencies.get(descriptor.id());
        if (latency != null) {
            try {
                Thread.sleep(latency.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw AdapterException.transientFailure("stub call cancelled", e);
            }
        }

        Behavior behavior = behaviors.get(descriptor.id());
        if (behavior == null) {
            return defaultPayload(descriptor);
        }
        return behavior.apply(descriptor);
    }

    @Override
    public boolean probe(ModelDescriptor descriptor) {
        return probeResult.get();
    }

    /**
     * Scripts a successful response.
     *
     * @param modelId the model
     * @param payload the payload to return
     * @return this stub
     */
    public StubBackendAdapter respondWith(ModelId modelId, ResultPayload payload) {
        behaviors.put(modelId, descriptor -> payload);
        return this;
    }

    /**
     * Scripts a transient failure (timeout, connection refused, 5xx).
     */
    public StubBackendAdapter failTransiently(ModelId modelId) {
        behaviors.put(modelId, descriptor -> {
            throw AdapterException.transientFailure("stub transient failure for " + modelId.getValue(), null);
        });
        return this;
    }

    /**
     * Scripts a permanent failure (backend rejected the request).
     */
    public StubBackendAdapter failPermanently(ModelId modelId) {
        behaviors.put(modelId, descriptor -> {
            throw AdapterException.permanentFailure("stub permanent failure for " + modelId.getValue(), null);
        });
        return this;
    }

    /**
     * Scripts a response that cannot be converted to the canonical shape.
     */
    public StubBackendAdapter respondMalformed(ModelId modelId) {
        behaviors.put(modelId, descriptor -> {
            throw AdapterException.malformedResponse("stub malformed response for " + modelId.getValue(), null);
        });
        return this;
    }

    /**
     * Adds latency before the scripted behavior.
     */
    public StubBackendAdapter delay(ModelId modelId, Duration latency) {
        latencies.put(modelId, latency);
        return this;
    }

    /**
     * Removes any script and latency for the model (back to the default payload).
     */
    public StubBackendAdapter reset(ModelId modelId) {
        behaviors.remove(modelId);
        latencies.remove(modelId);
        return this;
    }

    public void setProbeResult(boolean alive) {
        probeResult.set(alive);
    }

    /**
     * Returns how many times the model was invoked through this stub.
     */
    public int invocations(ModelId modelId) {
        AtomicInteger counter = invocations.get(modelId);
        return counter == null ? 0 : counter.get();
    }

    public int totalInvocations() {
        return totalInvocations.get();
    }

    private ResultPayload defaultPayload(ModelDescriptor descriptor) {
        switch (backendKind) {
            case GENERAL_MODEL:
                return ChatResult.of("stub reply from " + descriptor.id().getValue());
            case CLASSIFIER:
                return new ClassificationResult("positive", 0.9, Map.of("positive", 0.9, "negative", 0.1));
            case VISION:
                return new VisionResult("stub description", List.of("stub"), null);
            case CODE_ANALYSIS:
            default:
                return new CodeAnalysisResult(List.of(), List.of(), 80.0, CodeAnalysisResult.Complexity.LOW);
        }
    }

    @FunctionalInterface
    private interface Behavior {
        ResultPayload apply(ModelDescriptor descriptor) throws AdapterException;
    }
}
