package com.ryuqq.aiorchestrator.core.contract;

import java.time.Duration;
import java.time.Instant;

/**
 * 질의 시간 메타데이터.
 *
 * @param startedAt 요청 수락 시각
 * @param elapsed 전체 소요 시간 (재시도 포함)
 * @param attempts 어댑터 호출 횟수 (1 이상)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Timing(
    Instant startedAt,
    Duration elapsed,
    int attempts
) {

    public Timing {
        if (startedAt == null) {
            throw new IllegalArgumentException("startedAt cannot be null");
        }
        if (elapsed == null || elapsed.isNegative()) {
            throw new IllegalArgumentException("elapsed must be non-negative");
        }
        if (attempts < 1) {
            throw new IllegalArgumentException("attempts must be positive (current: " + attempts + ")");
        }
    }
}
