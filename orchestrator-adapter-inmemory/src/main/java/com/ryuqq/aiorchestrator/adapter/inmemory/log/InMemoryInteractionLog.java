package com.ryuqq.aiorchestrator.adapter.inmemory.log;

import com.ryuqq.aiorchestrator.core.spi.InteractionLog;
import com.ryuqq.aiorchestrator.core.spi.InteractionRecord;
import com.ryuqq.aiorchestrator.core.spi.InteractionStats;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * In-memory implementation of {@link InteractionLog} SPI.
 *
 * <p>Keeps the most recent {@code capacity} records (oldest evicted first) while the
 * success/failure counters stay cumulative for the lifetime of the instance.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>{@link #stats()} and {@link #recent(int)} are consistent with each other only under the same lock</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryInteractionLog implements InteractionLog {

    public static final int DEFAULT_CAPACITY = 1000;

    private final int capacity;
    private final Deque<InteractionRecord> records = new ArrayDeque<>();
    private long total;
    private long successful;

    public InMemoryInteractionLog() {
        this(DEFAULT_CAPACITY);
    }

    /**
     * @param capacity 보관할 최대 기록 수 (1 이상)
     */
    public InMemoryInteractionLog(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive (current: " + capacity + ")");
        }
        this.capacity = capacity;
    }

    @Override
    public synchronized void record(InteractionRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        if (records.size() == capacity) {
            records.removeFirst();
        }
        records.addLast(record);
        total++;
        if (record.success()) {
            successful++;
        }
    }

    @Override
    public synchronized List<InteractionRecord> recent(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit cannot be negative");
        }
        List<InteractionRecord> result = new ArrayList<>(Math.min(limit, records.size()));
        Iterator<InteractionRecord> newestFirst = records.descendingIterator();
        while (newestFirst.hasNext() && result.size() < limit) {
            result.add(newestFirst.next());
        }
        return result;
    }

    @Override
    public synchronized InteractionStats stats() {
        return new InteractionStats(total, successful, total - successful);
    }

    public synchronized int size() {
        return records.size();
    }

    public int capacity() {
        return capacity;
    }
}
