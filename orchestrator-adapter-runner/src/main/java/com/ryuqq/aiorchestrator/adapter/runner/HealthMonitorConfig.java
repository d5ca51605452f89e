package com.ryuqq.aiorchestrator.adapter.runner;

/**
 * HealthMonitor 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>scanIntervalMs: 스캔 주기 (기본 30000ms)</li>
 *   <li>batchSize: 스캔당 최대 복구 시도 수 (기본 50)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param scanIntervalMs 스캔 주기 (밀리초, 양수여야 함)
 * @param batchSize 배치 크기 (1 이상이어야 함)
 */
public record HealthMonitorConfig(
    long scanIntervalMs,
    int batchSize
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: scanIntervalMs=30000ms, batchSize=50</p>
     */
    public HealthMonitorConfig() {
        this(30000, 50);
    }

    public HealthMonitorConfig {
        if (scanIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "scanIntervalMs must be positive (current: " + scanIntervalMs + ")"
            );
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException(
                "batchSize must be positive (current: " + batchSize + ")"
            );
        }
    }

    /**
     * scanIntervalMs만 변경한 새 인스턴스 생성.
     */
    public HealthMonitorConfig withScanIntervalMs(long scanIntervalMs) {
        return new HealthMonitorConfig(scanIntervalMs, batchSize);
    }

    /**
     * batchSize만 변경한 새 인스턴스 생성.
     */
    public HealthMonitorConfig withBatchSize(int batchSize) {
        return new HealthMonitorConfig(scanIntervalMs, batchSize);
    }
}
