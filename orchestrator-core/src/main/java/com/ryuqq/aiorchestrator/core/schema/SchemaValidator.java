package com.ryuqq.aiorchestrator.core.schema;

import com.ryuqq.aiorchestrator.core.contract.QueryInput;
import com.ryuqq.aiorchestrator.core.contract.QueryOption;
import com.ryuqq.aiorchestrator.core.contract.QueryParameters;
import com.ryuqq.aiorchestrator.core.contract.QueryRequest;
import com.ryuqq.aiorchestrator.core.contract.QueryResponse;
import com.ryuqq.aiorchestrator.core.exception.SchemaValidationException;
import com.ryuqq.aiorchestrator.core.model.BackendKind;
import com.ryuqq.aiorchestrator.core.model.ModelDescriptor;
import com.ryuqq.aiorchestrator.core.result.ChatResult;
import com.ryuqq.aiorchestrator.core.result.ClassificationResult;
import com.ryuqq.aiorchestrator.core.result.CodeAnalysisResult;
import com.ryuqq.aiorchestrator.core.result.ResultPayload;
import com.ryuqq.aiorchestrator.core.result.VisionResult;

import java.util.Map;

/**
 * 정규 형태 검증기.
 *
 * <p>모든 메서드는 검증을 통과한 입력을 그대로 반환하고, 위반 시
 * {@link SchemaValidationException}을 던집니다. 특정 백엔드 런타임에 대해서는 알지 못합니다.</p>
 *
 * <p><strong>검증 대상:</strong></p>
 * <ul>
 *   <li>결과 payload: 필수 필드, 값 범위, backend kind ↔ payload 타입 대응</li>
 *   <li>요청: 입력, 호출자 등급, 파라미터 이름/타입/범위, 타임아웃</li>
 *   <li>모델 descriptor: capability 비어 있지 않음</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SchemaValidator {

    private static final double MIN_TEMPERATURE = 0.0;
    private static final double MAX_TEMPERATURE = 2.0;
    private static final int MAX_TOKENS_LIMIT = 32768;
    private static final double MAX_QUALITY_SCORE = 100.0;

    private SchemaValidator() {
    }

    /**
     * 결과 payload를 기대 형태에 대해 검증.
     *
     * @param payload 검증할 payload
     * @param expectedKind payload를 생산한 모델의 backend kind
     * @return 검증된 payload
     * @throws SchemaValidationException 형태 또는 값이 잘못된 경우
     */
    public static ResultPayload validate(ResultPayload payload, BackendKind expectedKind) {
        if (expectedKind == null) {
            throw new SchemaValidationException("backendKind", "expected backend kind is missing");
        }
        if (payload == null) {
            throw new SchemaValidationException("payload", "result payload is missing");
        }
        Class<? extends ResultPayload> expectedType = ResultPayload.typeFor(expectedKind);
        if (!expectedType.isInstance(payload)) {
            throw new SchemaValidationException("payload", String.format(
                "backend kind %s must produce %s but produced %s",
                expectedKind.wireName(), expectedType.getSimpleName(), payload.getClass().getSimpleName()));
        }

        if (payload instanceof ChatResult) {
            validateChat((ChatResult) payload);
        } else if (payload instanceof ClassificationResult) {
            validateClassification((ClassificationResult) payload);
        } else if (payload instanceof VisionResult) {
            validateVision((VisionResult) payload);
        } else if (payload instanceof CodeAnalysisResult) {
            validateCodeAnalysis((CodeAnalysisResult) payload);
        }
        return payload;
    }

    /**
     * 응답 전체 검증 (응답 모델과 descriptor 일치 + payload 형태).
     *
     * @param response 응답
     * @param descriptor 응답을 생산한 모델
     * @return 검증된 응답
     */
    public static QueryResponse validateResponse(QueryResponse response, ModelDescriptor descriptor) {
        if (response == null) {
            throw new SchemaValidationException("response", "response is missing");
        }
        if (descriptor == null) {
            throw new SchemaValidationException("descriptor", "producing model descriptor is missing");
        }
        if (!response.modelId().equals(descriptor.id())) {
            throw new SchemaValidationException("modelId",
                "response model " + response.modelId().getValue() + " does not match " + descriptor.id().getValue());
        }
        validate(response.payload(), descriptor.backendKind());
        return response;
    }

    /**
     * 요청 검증.
     *
     * @param request 요청
     * @return 검증된 요청
     * @throws SchemaValidationException 필수 필드 누락, 파라미터 오류 등
     */
    public static QueryRequest validateRequest(QueryRequest request) {
        if (request == null) {
            throw new SchemaValidationException("request", "request is missing");
        }
        if (request.callerTier() == null) {
            throw new SchemaValidationException("callerTier", "caller tier is required");
        }
        QueryInput input = request.input();
        if (input == null) {
            throw new SchemaValidationException("input", "raw input is required");
        }
        if (input instanceof QueryInput.Text) {
            String text = ((QueryInput.Text) input).value();
            if (text == null || text.isBlank()) {
                throw new SchemaValidationException("input", "text input cannot be blank");
            }
        } else if (input instanceof QueryInput.Structured) {
            if (((QueryInput.Structured) input).fields().isEmpty()) {
                throw new SchemaValidationException("input", "structured input cannot be empty");
            }
        }
        if (request.timeout() != null && (request.timeout().isZero() || request.timeout().isNegative())) {
            throw new SchemaValidationException("timeout", "timeout must be positive (current: " + request.timeout() + ")");
        }
        validateParameters(request.parameters());
        return request;
    }

    /**
     * 파라미터 이름, 타입, 범위 검증.
     *
     * @param parameters 파라미터
     * @return 검증된 파라미터
     */
    public static QueryParameters validateParameters(QueryParameters parameters) {
        if (parameters == null) {
            return QueryParameters.empty();
        }
        for (Map.Entry<String, Object> entry : parameters.asMap().entrySet()) {
            String key = entry.getKey();
            QueryOption option = QueryOption.fromKey(key)
                .orElseThrow(() -> new SchemaValidationException(key, "unrecognized parameter"));
            Object value = entry.getValue();
            if (value == null) {
                throw new SchemaValidationException(key, "value cannot be null");
            }
            switch (option) {
                case TEMPERATURE:
                    if (!(value instanceof Number)) {
                        throw new SchemaValidationException(key, "must be a number");
                    }
                    double temperature = ((Number) value).doubleValue();
                    if (Double.isNaN(temperature) || temperature < MIN_TEMPERATURE || temperature > MAX_TEMPERATURE) {
                        throw new SchemaValidationException(key,
                            "must be between " + MIN_TEMPERATURE + " and " + MAX_TEMPERATURE + " (current: " + temperature + ")");
                    }
                    break;
                case MAX_TOKENS:
                    if (!(value instanceof Integer) && !(value instanceof Long) && !(value instanceof Short)) {
                        throw new SchemaValidationException(key, "must be an integer");
                    }
                    long maxTokens = ((Number) value).longValue();
                    if (maxTokens < 1 || maxTokens > MAX_TOKENS_LIMIT) {
                        throw new SchemaValidationException(key,
                            "must be between 1 and " + MAX_TOKENS_LIMIT + " (current: " + maxTokens + ")");
                    }
                    break;
                case SYSTEM_PROMPT:
                    if (!(value instanceof String) || ((String) value).isBlank()) {
                        throw new SchemaValidationException(key, "must be a non-blank string");
                    }
                    break;
                default:
                    if (!(value instanceof String)) {
                        throw new SchemaValidationException(key, "must be a string");
                    }
                    break;
            }
        }
        return parameters;
    }

    /**
     * 등록 대상 descriptor 검증.
     *
     * @param descriptor 모델 descriptor
     * @return 검증된 descriptor
     */
    public static ModelDescriptor validateDescriptor(ModelDescriptor descriptor) {
        if (descriptor == null) {
            throw new SchemaValidationException("descriptor", "descriptor is missing");
        }
        if (descriptor.capabilities().isEmpty()) {
            throw new SchemaValidationException("capabilities",
                "model " + descriptor.id().getValue() + " must declare at least one capability");
        }
        return descriptor;
    }

    private static void validateChat(ChatResult chat) {
        if (chat.message() == null) {
            throw new SchemaValidationException("message", "chat message is missing");
        }
        if (chat.message().sender() == null) {
            throw new SchemaValidationException("message.sender", "sender is missing");
        }
        if (chat.message().content() == null) {
            throw new SchemaValidationException("message.content", "content is missing");
        }
        if (chat.promptTokens() < 0 || chat.completionTokens() < 0) {
            throw new SchemaValidationException("tokens", "token counts must be non-negative");
        }
    }

    private static void validateClassification(ClassificationResult classification) {
        String predicted = classification.predictedClass();
        if (predicted == null || predicted.isBlank()) {
            throw new SchemaValidationException("predictedClass", "predicted class is missing");
        }
        requireProbability("confidence", classification.score());
        for (Map.Entry<String, Double> entry : classification.probabilities().entrySet()) {
            if (entry.getValue() == null) {
                throw new SchemaValidationException("probabilities." + entry.getKey(), "probability is missing");
            }
            requireProbability("probabilities." + entry.getKey(), entry.getValue());
        }
        if (!classification.probabilities().isEmpty() && !classification.probabilities().containsKey(predicted)) {
            throw new SchemaValidationException("predictedClass",
                "predicted class '" + predicted + "' is not among the reported probabilities");
        }
    }

    private static void validateVision(VisionResult vision) {
        if (vision.description() == null || vision.description().isBlank()) {
            throw new SchemaValidationException("description", "image description is missing");
        }
    }

    private static void validateCodeAnalysis(CodeAnalysisResult analysis) {
        if (analysis.complexity() == null) {
            throw new SchemaValidationException("complexity", "complexity is missing");
        }
        double score = analysis.qualityScore();
        if (Double.isNaN(score) || score < 0.0 || score > MAX_QUALITY_SCORE) {
            throw new SchemaValidationException("qualityScore",
                "must be between 0 and " + MAX_QUALITY_SCORE + " (current: " + score + ")");
        }
    }

    private static void requireProbability(String field, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new SchemaValidationException(field, "must be between 0.0 and 1.0 (current: " + value + ")");
        }
    }
}
