package com.ryuqq.aiorchestrator.adapter.runner;

import com.ryuqq.aiorchestrator.core.contract.QueryInput;
import com.ryuqq.aiorchestrator.core.contract.QueryRequest;
import com.ryuqq.aiorchestrator.core.exception.SchemaValidationException;
import com.ryuqq.aiorchestrator.core.model.TaskType;

/**
 * 자동 선택용 작업 유형 결정.
 *
 * <p>hint가 있으면 그대로 사용하고, 없으면 입력 형태로 추론합니다.
 * 추론할 수 없는 구조화 입력은 거부합니다 (임의로 추측하지 않음).</p>
 *
 * <ul>
 *   <li>자유 텍스트 → chat</li>
 *   <li>"image" 필드 → vision</li>
 *   <li>"code" 필드 → code-analysis</li>
 *   <li>"features" 필드 → classify</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TaskTypeResolver {

    static final String IMAGE_FIELD = "image";
    static final String CODE_FIELD = "code";
    static final String FEATURES_FIELD = "features";

    private TaskTypeResolver() {
    }

    /**
     * @param request 검증된 요청
     * @return 작업 유형
     * @throws SchemaValidationException 구조화 입력에서 작업 유형을 추론할 수 없는 경우
     */
    public static TaskType resolve(QueryRequest request) {
        if (request.taskTypeHint() != null) {
            return request.taskTypeHint();
        }
        QueryInput input = request.input();
        if (input instanceof QueryInput.Text) {
            return TaskType.CHAT;
        }
        QueryInput.Structured structured = (QueryInput.Structured) input;
        if (structured.has(IMAGE_FIELD)) {
            return TaskType.VISION;
        }
        if (structured.has(CODE_FIELD)) {
            return TaskType.CODE_ANALYSIS;
        }
        if (structured.has(FEATURES_FIELD)) {
            return TaskType.CLASSIFY;
        }
        throw new SchemaValidationException("taskType",
            "cannot infer a task type from structured input with fields " + structured.fields().keySet()
                + "; provide a task type hint");
    }
}
