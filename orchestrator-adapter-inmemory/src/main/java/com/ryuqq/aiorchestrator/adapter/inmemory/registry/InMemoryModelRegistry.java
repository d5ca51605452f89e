package com.ryuqq.aiorchestrator.adapter.inmemory.registry;

import com.ryuqq.aiorchestrator.core.exception.DuplicateModelException;
import com.ryuqq.aiorchestrator.core.exception.UnknownModelException;
import com.ryuqq.aiorchestrator.core.model.HealthState;
import com.ryuqq.aiorchestrator.core.model.ModelDescriptor;
import com.ryuqq.aiorchestrator.core.model.ModelId;
import com.ryuqq.aiorchestrator.core.model.TaskType;
import com.ryuqq.aiorchestrator.core.schema.SchemaValidator;
import com.ryuqq.aiorchestrator.core.spi.HealthListener;
import com.ryuqq.aiorchestrator.core.spi.ModelRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link ModelRegistry} SPI.
 *
 * <p>Reads are lock-free over an immutable {@link Snapshot}. Writers are serialized on a
 * single monitor, build a new snapshot and publish it with one atomic swap, so a reader
 * sees either the whole update or none of it.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>snapshot:</strong> AtomicReference&lt;Snapshot&gt; - ModelId → Entry(descriptor, sequence), registration order</li>
 *   <li><strong>sequence:</strong> monotonically increasing registration counter (guarded by writeLock)</li>
 *   <li><strong>listeners:</strong> CopyOnWriteArrayList&lt;HealthListener&gt; - notified after each effective transition and each (de)registration</li>
 * </ul>
 *
 * <p><strong>Performance Characteristics:</strong></p>
 * <ul>
 *   <li><strong>lookup / contains:</strong> O(1), no locking</li>
 *   <li><strong>listByCapability:</strong> O(N log N) over the current snapshot</li>
 *   <li><strong>register / deregister / setHealth / compareAndSetHealth:</strong> O(N) copy under the write lock</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * ModelRegistry registry = new InMemoryModelRegistry();
 * registry.register(ModelDescriptor.of(ModelId.of("llama2"), BackendKind.GENERAL_MODEL,
 *     Tier.BASIC, List.of(TaskType.CHAT, TaskType.ANALYZE)));
 *
 * List&lt;ModelDescriptor&gt; candidates = registry.listByCapability(TaskType.CHAT);
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryModelRegistry implements ModelRegistry {

    private static final Logger log = LoggerFactory.getLogger(InMemoryModelRegistry.class);

    /**
     * Capability ordering: health rank, required tier descending, registration sequence.
     */
    private static final Comparator<Entry> CAPABILITY_ORDER = Comparator
        .comparingInt((Entry entry) -> entry.descriptor.healthState().rank())
        .thenComparing(Comparator.comparingInt((Entry entry) -> entry.descriptor.requiredTier().level()).reversed())
        .thenComparingLong(entry -> entry.sequence);

    private final AtomicReference<Snapshot> snapshot = new AtomicReference<>(Snapshot.EMPTY);
    private final Object writeLock = new Object();
    private final List<HealthListener> listeners = new CopyOnWriteArrayList<>();
    private long sequence;

    @Override
    public void register(ModelDescriptor descriptor) {
        if (descriptor == null) {
            throw new IllegalArgumentException("descriptor cannot be null");
        }
        SchemaValidator.validateDescriptor(descriptor);

        synchronized (writeLock) {
            Snapshot current = snapshot.get();
            if (current.entries.containsKey(descriptor.id())) {
                throw new DuplicateModelException(descriptor.id());
            }
            Map<ModelId, Entry> next = new LinkedHashMap<>(current.entries);
            next.put(descriptor.id(), new Entry(descriptor, ++sequence));
            snapshot.set(new Snapshot(next));
        }
        log.info("Model registered: {} (kind={}, requiredTier={}, capabilities={})",
            descriptor.id().getValue(), descriptor.backendKind().wireName(),
            descriptor.requiredTier(), capabilityNames(descriptor));
        notifyListeners("registration", descriptor.id(), listener -> listener.onRegistered(descriptor.id()));
    }

    @Override
    public ModelDescriptor deregister(ModelId modelId) {
        requireId(modelId);
        Entry removed;
        synchronized (writeLock) {
            Snapshot current = snapshot.get();
            removed = current.entries.get(modelId);
            if (removed == null) {
                throw new UnknownModelException(modelId);
            }
            Map<ModelId, Entry> next = new LinkedHashMap<>(current.entries);
            next.remove(modelId);
            snapshot.set(new Snapshot(next));
        }
        log.info("Model deregistered: {}", modelId.getValue());
        notifyListeners("deregistration", modelId, listener -> listener.onDeregistered(modelId));
        return removed.descriptor;
    }

    @Override
    public ModelDescriptor lookup(ModelId modelId) {
        requireId(modelId);
        Entry entry = snapshot.get().entries.get(modelId);
        if (entry == null) {
            throw new UnknownModelException(modelId);
        }
        return entry.descriptor;
    }

    @Override
    public List<ModelDescriptor> listByCapability(TaskType taskType) {
        if (taskType == null) {
            throw new IllegalArgumentException("taskType cannot be null");
        }
        return snapshot.get().entries.values().stream()
            .filter(entry -> entry.descriptor.hasCapability(taskType))
            .sorted(CAPABILITY_ORDER)
            .map(entry -> entry.descriptor)
            .collect(Collectors.toUnmodifiableList());
    }

    @Override
    public List<ModelDescriptor> listAll() {
        return snapshot.get().entries.values().stream()
            .map(entry -> entry.descriptor)
            .collect(Collectors.toUnmodifiableList());
    }

    @Override
    public ModelDescriptor setHealth(ModelId modelId, HealthState state) {
        requireId(modelId);
        requireState(state, "state");

        Transition transition;
        synchronized (writeLock) {
            transition = transition(modelId, null, state);
        }
        publish(modelId, transition);
        return transition.descriptor;
    }

    @Override
    public boolean compareAndSetHealth(ModelId modelId, HealthState expected, HealthState next) {
        requireId(modelId);
        requireState(expected, "expected");
        requireState(next, "next");

        Transition transition;
        synchronized (writeLock) {
            transition = transition(modelId, expected, next);
        }
        publish(modelId, transition);
        return transition.previous == expected && transition.descriptor.healthState() == next;
    }

    /**
     * Applies a health change under the write lock.
     *
     * @param expected required current state, or null for an unconditional change
     */
    private Transition transition(ModelId modelId, HealthState expected, HealthState state) {
        Snapshot current = snapshot.get();
        Entry entry = current.entries.get(modelId);
        if (entry == null) {
            throw new UnknownModelException(modelId);
        }
        HealthState previous = entry.descriptor.healthState();
        if (expected != null && previous != expected) {
            return new Transition(entry.descriptor, previous, false);
        }
        if (previous == state) {
            return new Transition(entry.descriptor, previous, false);
        }
        ModelDescriptor updated = entry.descriptor.withHealth(state);
        Map<ModelId, Entry> next = new LinkedHashMap<>(current.entries);
        next.put(modelId, new Entry(updated, entry.sequence));
        snapshot.set(new Snapshot(next));
        return new Transition(updated, previous, true);
    }

    private void publish(ModelId modelId, Transition transition) {
        if (!transition.changed) {
            return;
        }
        HealthState current = transition.descriptor.healthState();
        log.info("Model health changed: {} {} -> {}", modelId.getValue(), transition.previous, current);
        notifyListeners("health", modelId, listener -> listener.onTransition(modelId, transition.previous, current));
    }

    @Override
    public boolean contains(ModelId modelId) {
        return modelId != null && snapshot.get().entries.containsKey(modelId);
    }

    @Override
    public int size() {
        return snapshot.get().entries.size();
    }

    @Override
    public void addHealthListener(HealthListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        listeners.add(listener);
    }

    private void notifyListeners(String event, ModelId modelId, Consumer<HealthListener> notification) {
        for (HealthListener listener : listeners) {
            try {
                notification.accept(listener);
            } catch (RuntimeException e) {
                log.error("Registry listener failed on {} event for {}", event, modelId.getValue(), e);
            }
        }
    }

    private static void requireId(ModelId modelId) {
        if (modelId == null) {
            throw new IllegalArgumentException("modelId cannot be null");
        }
    }

    private static void requireState(HealthState state, String name) {
        if (state == null) {
            throw new IllegalArgumentException(name + " cannot be null");
        }
    }

    private static List<String> capabilityNames(ModelDescriptor descriptor) {
        List<String> names = new ArrayList<>();
        descriptor.capabilities().forEach(capability -> names.add(capability.getValue()));
        return names;
    }

    /**
     * Registered descriptor with its registration sequence number.
     */
    private static final class Entry {
        final ModelDescriptor descriptor;
        final long sequence;

        Entry(ModelDescriptor descriptor, long sequence) {
            this.descriptor = descriptor;
            this.sequence = sequence;
        }
    }

    /**
     * Outcome of a health change made under the write lock.
     */
    private static final class Transition {
        final ModelDescriptor descriptor;
        final HealthState previous;
        final boolean changed;

        Transition(ModelDescriptor descriptor, HealthState previous, boolean changed) {
            this.descriptor = descriptor;
            this.previous = previous;
            this.changed = changed;
        }
    }

    /**
     * Immutable registry state published by writers.
     */
    private static final class Snapshot {
        static final Snapshot EMPTY = new Snapshot(new LinkedHashMap<>());

        final Map<ModelId, Entry> entries;

        /**
         * @param entries freshly built map owned by the snapshot from now on
         */
        Snapshot(Map<ModelId, Entry> entries) {
            this.entries = Collections.unmodifiableMap(entries);
        }
    }
}
