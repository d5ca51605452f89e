package com.ryuqq.aiorchestrator.core.permission;

import com.ryuqq.aiorchestrator.core.model.ModelDescriptor;
import com.ryuqq.aiorchestrator.core.model.Tier;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 등급 기반 권한 검사기.
 *
 * <p>순수 함수입니다: 결과는 (callerTier, descriptor)에만 의존하며 부수 효과가 없습니다.
 * 오케스트레이터 외부(예: 웹 레이어의 모델 목록 필터링)에서도 그대로 사용할 수 있습니다.</p>
 *
 * <p><strong>Fail closed:</strong> null이거나 정의되지 않은 등급이 하나라도 관여하면 거부합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TierChecker {

    /**
     * 접근 허용 여부.
     *
     * @param callerTier 호출자 등급
     * @param descriptor 대상 모델
     * @return callerTier &gt;= descriptor.requiredTier인 경우에만 true
     */
    public boolean authorize(Tier callerTier, ModelDescriptor descriptor) {
        if (callerTier == null || descriptor == null) {
            return false;
        }
        return callerTier.isAtLeast(descriptor.requiredTier());
    }

    /**
     * 정수 등급 수준으로 접근 허용 여부 확인.
     *
     * <p>외부 시스템이 등급을 숫자로만 보관하는 경우에 사용합니다.
     * 정의되지 않은 수준(예: -1, 99)은 항상 거부됩니다.</p>
     *
     * @param callerLevel 호출자 등급 수준
     * @param descriptor 대상 모델
     * @return 허용 여부
     */
    public boolean authorize(int callerLevel, ModelDescriptor descriptor) {
        return Tier.fromLevel(callerLevel)
            .map(tier -> authorize(tier, descriptor))
            .orElse(false);
    }

    /**
     * 허용된 모델만 순서를 유지하며 필터링.
     *
     * @param callerTier 호출자 등급
     * @param descriptors 후보 목록
     * @return 허용된 descriptor 목록 (새 리스트)
     */
    public List<ModelDescriptor> filterAuthorized(Tier callerTier, List<ModelDescriptor> descriptors) {
        if (descriptors == null || descriptors.isEmpty()) {
            return List.of();
        }
        return descriptors.stream()
            .filter(descriptor -> authorize(callerTier, descriptor))
            .collect(Collectors.toList());
    }
}
