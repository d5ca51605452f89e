package com.ryuqq.aiorchestrator.core.exception;

import com.ryuqq.aiorchestrator.core.model.TaskType;
import com.ryuqq.aiorchestrator.core.model.Tier;

/**
 * 자동 선택 후보 없음.
 *
 * <p>작업 유형을 낮추거나 관련 없는 모델로 대체하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class NoAuthorizedModelException extends OrchestrationException {

    private final TaskType taskType;
    private final Tier callerTier;

    public NoAuthorizedModelException(TaskType taskType, Tier callerTier) {
        super(ErrorKind.NO_AUTHORIZED_MODEL, String.format(
            "No healthy model authorized for task '%s' at tier %s", taskType.getValue(), callerTier));
        this.taskType = taskType;
        this.callerTier = callerTier;
    }

    public TaskType taskType() {
        return taskType;
    }

    public Tier callerTier() {
        return callerTier;
    }
}
