package com.ryuqq.aiorchestrator.core.spi;

import com.ryuqq.aiorchestrator.core.model.HealthState;
import com.ryuqq.aiorchestrator.core.model.ModelId;

/**
 * 모델 상태 전이 리스너.
 *
 * <p>레지스트리가 상태 교체, 등록, 등록 해제를 마친 직후 호출됩니다. 구현체는 빠르게 반환해야 하며
 * 레지스트리를 다시 변경해서는 안 됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface HealthListener {

    /**
     * 상태 전이 통지.
     *
     * @param modelId 모델
     * @param previous 이전 상태
     * @param current 현재 상태
     */
    void onTransition(ModelId modelId, HealthState previous, HealthState current);

    /**
     * 모델 등록 통지.
     *
     * @param modelId 새로 등록된 모델
     */
    default void onRegistered(ModelId modelId) {
    }

    /**
     * 모델 등록 해제 통지.
     *
     * @param modelId 제거된 모델
     */
    default void onDeregistered(ModelId modelId) {
    }
}
