package com.ryuqq.aiorchestrator.core.spi;

/**
 * 누적 사용 통계.
 *
 * @param total 전체 질의 수
 * @param successful 성공 수
 * @param failed 실패 수
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record InteractionStats(
    long total,
    long successful,
    long failed
) {

    public InteractionStats {
        if (total < 0 || successful < 0 || failed < 0) {
            throw new IllegalArgumentException("counters must be non-negative");
        }
        if (successful + failed != total) {
            throw new IllegalArgumentException(
                "successful + failed must equal total (" + successful + " + " + failed + " != " + total + ")");
        }
    }

    public static InteractionStats empty() {
        return new InteractionStats(0, 0, 0);
    }

    /**
     * 성공률 (백분율).
     *
     * @return 0.0~100.0, 질의가 없으면 0.0
     */
    public double successRate() {
        return total == 0 ? 0.0 : successful * 100.0 / total;
    }
}
