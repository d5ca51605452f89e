package com.ryuqq.aiorchestrator.core.exception;

import com.ryuqq.aiorchestrator.core.model.ModelId;

/**
 * 등록되지 않은 모델 식별자 참조.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class UnknownModelException extends OrchestrationException {

    private final ModelId modelId;

    public UnknownModelException(ModelId modelId) {
        super(ErrorKind.UNKNOWN_MODEL, "Model not found: " + (modelId == null ? "null" : modelId.getValue()));
        this.modelId = modelId;
    }

    public ModelId modelId() {
        return modelId;
    }
}
