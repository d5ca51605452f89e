package com.ryuqq.aiorchestrator.core.exception;

import com.ryuqq.aiorchestrator.core.model.ModelId;

/**
 * 이미 등록된 식별자로 등록 시도.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class DuplicateModelException extends OrchestrationException {

    private final ModelId modelId;

    public DuplicateModelException(ModelId modelId) {
        super(ErrorKind.DUPLICATE_MODEL, "Model already registered: " + modelId.getValue());
        this.modelId = modelId;
    }

    public ModelId modelId() {
        return modelId;
    }
}
