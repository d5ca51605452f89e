package com.ryuqq.aiorchestrator.core.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * 레지스트리 항목: 하나의 모델 백엔드에 대한 식별, 권한, capability 정보.
 *
 * <p><strong>불변성:</strong> 모든 필드는 생성 후 변경 불가입니다.
 * 상태 변경은 {@link #withHealth(HealthState)}로 새 인스턴스를 만들어 레지스트리가 교체합니다.
 * requiredTier를 바꾸는 메서드는 제공하지 않습니다 (deregister 후 재등록만 허용).</p>
 *
 * <p>진행 중인 호출은 선택 시점의 descriptor를 값으로 보관하므로,
 * 이후의 deregister나 상태 변경에 영향을 받지 않습니다.</p>
 *
 * @param id 모델 식별자
 * @param backendKind 백엔드 종류 (어댑터 및 결과 형태 결정)
 * @param requiredTier 호출에 필요한 최소 등급
 * @param capabilities 지원 작업 유형 (선언 순서 유지)
 * @param healthState 현재 상태
 * @param metadata 선택적 메타데이터 (예: context_window, accuracy, description)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ModelDescriptor(
    ModelId id,
    BackendKind backendKind,
    Tier requiredTier,
    Set<TaskType> capabilities,
    HealthState healthState,
    Map<String, Object> metadata
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null인 경우
     */
    public ModelDescriptor {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (backendKind == null) {
            throw new IllegalArgumentException("backendKind cannot be null");
        }
        if (requiredTier == null) {
            throw new IllegalArgumentException("requiredTier cannot be null");
        }
        if (capabilities == null) {
            throw new IllegalArgumentException("capabilities cannot be null");
        }
        if (healthState == null) {
            throw new IllegalArgumentException("healthState cannot be null");
        }
        capabilities = Collections.unmodifiableSet(new LinkedHashSet<>(capabilities));
        metadata = metadata == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * HEALTHY 상태, 메타데이터 없는 descriptor 생성.
     *
     * @param id 모델 식별자
     * @param backendKind 백엔드 종류
     * @param requiredTier 필요 등급
     * @param capabilities 지원 작업 유형
     * @return ModelDescriptor 인스턴스
     */
    public static ModelDescriptor of(ModelId id, BackendKind backendKind, Tier requiredTier,
                                     Collection<TaskType> capabilities) {
        if (capabilities == null) {
            throw new IllegalArgumentException("capabilities cannot be null");
        }
        return new ModelDescriptor(id, backendKind, requiredTier,
            new LinkedHashSet<>(capabilities), HealthState.HEALTHY, null);
    }

    /**
     * 상태만 바꾼 새 인스턴스 생성.
     *
     * @param newState 새 상태
     * @return 상태가 교체된 descriptor (같은 상태면 this)
     */
    public ModelDescriptor withHealth(HealthState newState) {
        if (newState == null) {
            throw new IllegalArgumentException("newState cannot be null");
        }
        if (newState == healthState) {
            return this;
        }
        return new ModelDescriptor(id, backendKind, requiredTier, capabilities, newState, metadata);
    }

    /**
     * 메타데이터를 교체한 새 인스턴스 생성.
     */
    public ModelDescriptor withMetadata(Map<String, Object> newMetadata) {
        return new ModelDescriptor(id, backendKind, requiredTier, capabilities, healthState, newMetadata);
    }

    public boolean hasCapability(TaskType taskType) {
        return taskType != null && capabilities.contains(taskType);
    }
}
