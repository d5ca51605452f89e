package com.ryuqq.aiorchestrator.core.contract;

import com.ryuqq.aiorchestrator.core.model.ModelId;
import com.ryuqq.aiorchestrator.core.model.TaskType;
import com.ryuqq.aiorchestrator.core.model.Tier;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * 오케스트레이터 질의 요청.
 *
 * <p>요청 객체는 호출 단위로 생성되고 호출자가 소유합니다.
 * 오케스트레이터는 호출이 끝난 뒤 요청을 보관하지 않습니다.</p>
 *
 * <p>필드 검증은 생성 시점이 아니라 {@code SchemaValidator.validateRequest}에서 수행되며,
 * 위반 시 {@code SchemaValidationException}으로 보고됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * QueryRequest request = QueryRequest.builder(QueryInput.text("What is 2+2?"), Tier.BASIC)
 *     .parameters(Map.of("temperature", 0.2))
 *     .timeout(Duration.ofSeconds(5))
 *     .build();
 * </pre>
 *
 * @param input 원본 입력
 * @param callerTier 호출자 등급
 * @param modelId 명시적 모델 식별자 (선택, null 가능)
 * @param taskTypeHint 작업 유형 hint (선택, null 가능)
 * @param parameters 옵션 파라미터 (null이면 빈 파라미터)
 * @param timeout 호출 타임아웃 (선택, null이면 설정 기본값)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record QueryRequest(
    QueryInput input,
    Tier callerTier,
    ModelId modelId,
    TaskType taskTypeHint,
    QueryParameters parameters,
    Duration timeout
) {

    public QueryRequest {
        if (parameters == null) {
            parameters = QueryParameters.empty();
        }
    }

    /**
     * 자유 텍스트 자동 선택 요청 생성.
     *
     * @param text 질의 텍스트
     * @param callerTier 호출자 등급
     * @return QueryRequest 인스턴스
     */
    public static QueryRequest of(String text, Tier callerTier) {
        return new QueryRequest(QueryInput.text(text), callerTier, null, null, null, null);
    }

    public static Builder builder(QueryInput input, Tier callerTier) {
        return new Builder(input, callerTier);
    }

    public Optional<ModelId> explicitModel() {
        return Optional.ofNullable(modelId);
    }

    public Optional<TaskType> taskType() {
        return Optional.ofNullable(taskTypeHint);
    }

    public Optional<Duration> callTimeout() {
        return Optional.ofNullable(timeout);
    }

    public boolean isExplicitSelection() {
        return modelId != null;
    }

    /**
     * QueryRequest 빌더.
     */
    public static final class Builder {

        private final QueryInput input;
        private final Tier callerTier;
        private ModelId modelId;
        private TaskType taskTypeHint;
        private QueryParameters parameters = QueryParameters.empty();
        private Duration timeout;

        private Builder(QueryInput input, Tier callerTier) {
            this.input = input;
            this.callerTier = callerTier;
        }

        public Builder model(ModelId modelId) {
            this.modelId = modelId;
            return this;
        }

        public Builder model(String modelId) {
            this.modelId = ModelId.of(modelId);
            return this;
        }

        public Builder taskType(TaskType taskTypeHint) {
            this.taskTypeHint = taskTypeHint;
            return this;
        }

        public Builder parameters(Map<String, Object> parameters) {
            this.parameters = QueryParameters.of(parameters);
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public QueryRequest build() {
            return new QueryRequest(input, callerTier, modelId, taskTypeHint, parameters, timeout);
        }
    }
}
