package com.ryuqq.aiorchestrator.core.spi;

import java.util.List;

/**
 * 아무것도 기록하지 않는 InteractionLog.
 */
final class NoOpInteractionLog implements InteractionLog {

    static final NoOpInteractionLog INSTANCE = new NoOpInteractionLog();

    private NoOpInteractionLog() {
    }

    @Override
    public void record(InteractionRecord record) {
        // NoOp
    }

    @Override
    public List<InteractionRecord> recent(int limit) {
        return List.of();
    }

    @Override
    public InteractionStats stats() {
        return InteractionStats.empty();
    }
}
