package com.ryuqq.aiorchestrator.adapter.runner;

import com.ryuqq.aiorchestrator.core.exception.BackendUnavailableException;
import com.ryuqq.aiorchestrator.core.exception.NoAuthorizedModelException;
import com.ryuqq.aiorchestrator.core.exception.PermissionDeniedException;
import com.ryuqq.aiorchestrator.core.model.HealthState;
import com.ryuqq.aiorchestrator.core.model.ModelDescriptor;
import com.ryuqq.aiorchestrator.core.model.ModelId;
import com.ryuqq.aiorchestrator.core.model.TaskType;
import com.ryuqq.aiorchestrator.core.model.Tier;
import com.ryuqq.aiorchestrator.core.permission.TierChecker;
import com.ryuqq.aiorchestrator.core.spi.ModelRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 모델 선택기.
 *
 * <p><strong>자동 선택:</strong></p>
 * <pre>
 * 1. registry.listByCapability(taskType) → 후보 (레지스트리 정렬)
 * 2. 제외 목록(이번 호출에서 실패한 모델) 제거
 * 3. TierChecker 통과 + UNAVAILABLE 아님
 * 4. 비어 있으면 NoAuthorizedModelException (작업 유형을 낮추지 않음)
 * 5. SelectionPolicy에 따라 첫 번째 후보
 * </pre>
 *
 * <p><strong>명시적 선택:</strong> lookup → 권한 검사 → UNAVAILABLE 검사. 대체 모델을 고르지 않습니다.</p>
 *
 * <p>같은 레지스트리 상태와 같은 요청에 대해 항상 같은 모델을 선택합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ModelSelector {

    private static final Logger log = LoggerFactory.getLogger(ModelSelector.class);

    private static final Comparator<ModelDescriptor> LEAST_PRIVILEGE_ORDER = Comparator
        .comparingInt((ModelDescriptor descriptor) -> descriptor.healthState().rank())
        .thenComparingInt(descriptor -> descriptor.requiredTier().level());

    private final ModelRegistry registry;
    private final TierChecker tierChecker;
    private final SelectionPolicy policy;

    /**
     * 생성자.
     *
     * @param registry 모델 레지스트리
     * @param tierChecker 권한 검사기
     * @param policy 정렬 정책
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ModelSelector(ModelRegistry registry, TierChecker tierChecker, SelectionPolicy policy) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (tierChecker == null) {
            throw new IllegalArgumentException("tierChecker cannot be null");
        }
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        this.registry = registry;
        this.tierChecker = tierChecker;
        this.policy = policy;
    }

    /**
     * 작업 유형 기반 자동 선택.
     *
     * @param taskType 작업 유형
     * @param callerTier 호출자 등급
     * @param excluded 제외할 모델 (재선택 시 직전 실패 모델)
     * @return 선택된 descriptor (선택 시점 스냅샷)
     * @throws NoAuthorizedModelException 후보가 없는 경우
     */
    public ModelDescriptor selectAuto(TaskType taskType, Tier callerTier, Set<ModelId> excluded) {
        List<ModelDescriptor> candidates = candidates(taskType, callerTier, excluded);
        if (candidates.isEmpty()) {
            throw new NoAuthorizedModelException(taskType, callerTier);
        }
        ModelDescriptor selected = candidates.get(0);
        log.debug("Auto-selected {} for task '{}' at tier {} ({} candidates, policy={})",
            selected.id().getValue(), taskType.getValue(), callerTier, candidates.size(), policy);
        return selected;
    }

    /**
     * 자동 선택 후보 목록 (정책 정렬 적용).
     *
     * @param taskType 작업 유형
     * @param callerTier 호출자 등급
     * @param excluded 제외할 모델
     * @return 선택 가능한 후보 (비어 있을 수 있음)
     */
    public List<ModelDescriptor> candidates(TaskType taskType, Tier callerTier, Set<ModelId> excluded) {
        List<ModelDescriptor> authorized = registry.listByCapability(taskType).stream()
            .filter(descriptor -> excluded == null || !excluded.contains(descriptor.id()))
            .filter(descriptor -> descriptor.healthState().isSelectable())
            .filter(descriptor -> tierChecker.authorize(callerTier, descriptor))
            .collect(Collectors.toList());

        if (policy == SelectionPolicy.LEAST_PRIVILEGE) {
            // stable sort keeps registration order among equal keys
            authorized.sort(LEAST_PRIVILEGE_ORDER);
        }
        return authorized;
    }

    /**
     * 명시적 선택.
     *
     * @param modelId 요청한 모델
     * @param callerTier 호출자 등급
     * @return descriptor (선택 시점 스냅샷)
     * @throws com.ryuqq.aiorchestrator.core.exception.UnknownModelException 등록되지 않은 모델
     * @throws PermissionDeniedException 등급 부족
     * @throws BackendUnavailableException 모델이 UNAVAILABLE 상태
     */
    public ModelDescriptor selectExplicit(ModelId modelId, Tier callerTier) {
        ModelDescriptor descriptor = registry.lookup(modelId);
        if (!tierChecker.authorize(callerTier, descriptor)) {
            log.debug("Explicit selection of {} denied for tier {}", modelId.getValue(), callerTier);
            throw new PermissionDeniedException(modelId, callerTier, descriptor.requiredTier());
        }
        if (descriptor.healthState() == HealthState.UNAVAILABLE) {
            throw new BackendUnavailableException(modelId,
                "Model " + modelId.getValue() + " is unavailable");
        }
        return descriptor;
    }
}
