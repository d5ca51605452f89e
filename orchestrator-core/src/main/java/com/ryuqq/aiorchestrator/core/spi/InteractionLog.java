package com.ryuqq.aiorchestrator.core.spi;

import java.util.List;

/**
 * 질의 사용 기록 SPI.
 *
 * <p>모든 질의(성공/실패)가 기록됩니다. 구현체는 thread-safe해야 하며,
 * {@link #record(InteractionRecord)}는 호출 경로에서 실행되므로 블로킹하지 않아야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface InteractionLog {

    void record(InteractionRecord record);

    /**
     * 최근 기록 조회 (최신순).
     *
     * @param limit 최대 개수
     * @return 기록 목록
     */
    List<InteractionRecord> recent(int limit);

    InteractionStats stats();

    /**
     * 기록하지 않는 구현.
     */
    static InteractionLog noop() {
        return NoOpInteractionLog.INSTANCE;
    }
}
