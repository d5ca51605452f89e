package com.ryuqq.aiorchestrator.core.exception;

import com.ryuqq.aiorchestrator.core.model.ModelId;
import com.ryuqq.aiorchestrator.core.model.Tier;

/**
 * 호출자 등급 부족.
 *
 * <p>명시적 선택이든 자동 선택이든 등급 검사는 우회되지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class PermissionDeniedException extends OrchestrationException {

    private final ModelId modelId;
    private final Tier callerTier;
    private final Tier requiredTier;

    public PermissionDeniedException(ModelId modelId, Tier callerTier, Tier requiredTier) {
        super(ErrorKind.PERMISSION_DENIED, String.format(
            "Insufficient permissions for %s. Tier %s required (caller has %s)",
            modelId.getValue(), requiredTier, callerTier));
        this.modelId = modelId;
        this.callerTier = callerTier;
        this.requiredTier = requiredTier;
    }

    public ModelId modelId() {
        return modelId;
    }

    /**
     * 호출자 등급 (알 수 없는 등급이었다면 null).
     */
    public Tier callerTier() {
        return callerTier;
    }

    public Tier requiredTier() {
        return requiredTier;
    }
}
