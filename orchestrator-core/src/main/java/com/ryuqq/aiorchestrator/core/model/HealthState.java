package com.ryuqq.aiorchestrator.core.model;

/**
 * 모델 백엔드 상태.
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * HEALTHY
 *   │
 *   ▼ (일시적 실패)
 * DEGRADED ──► (성공) ──► HEALTHY
 *   │
 *   ▼ (연속 실패 임계값 도달)
 * UNAVAILABLE
 *   │
 *   ▼ (외부 복구 신호만)
 * HEALTHY
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum HealthState {

    HEALTHY(0),
    DEGRADED(1),
    UNAVAILABLE(2);

    private final int rank;

    HealthState(int rank) {
        this.rank = rank;
    }

    /**
     * 선택 우선순위 (작을수록 우선).
     *
     * @return 정렬 순위
     */
    public int rank() {
        return rank;
    }

    /**
     * 자동 선택 후보가 될 수 있는지 확인.
     *
     * @return UNAVAILABLE이 아니면 true
     */
    public boolean isSelectable() {
        return this != UNAVAILABLE;
    }
}
