package com.ryuqq.aiorchestrator.core.exception;

import com.ryuqq.aiorchestrator.core.model.ModelId;

/**
 * 백엔드 사용 불가.
 *
 * <p>명시적 선택 호출의 백엔드가 실패했거나, 자동 선택의 재시도까지 실패한 경우 발생합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class BackendUnavailableException extends OrchestrationException {

    private final ModelId modelId;

    public BackendUnavailableException(ModelId modelId, String message) {
        this(modelId, message, null);
    }

    public BackendUnavailableException(ModelId modelId, String message, Throwable cause) {
        super(ErrorKind.BACKEND_UNAVAILABLE, message, cause);
        this.modelId = modelId;
    }

    /**
     * 마지막으로 실패한 모델.
     */
    public ModelId modelId() {
        return modelId;
    }
}
