package com.ryuqq.aiorchestrator.core.contract;

import com.ryuqq.aiorchestrator.core.model.ModelId;
import com.ryuqq.aiorchestrator.core.result.ResultPayload;

import java.util.List;
import java.util.OptionalDouble;

/**
 * 오케스트레이터 질의 응답.
 *
 * <p>부분적으로 채워진 응답은 만들 수 없습니다. 모든 필수 필드는 생성자에서 검증되며,
 * payload 형태와 backend kind의 대응은 SchemaValidator가 추가로 보장합니다.</p>
 *
 * @param modelId 실제로 응답한 모델
 * @param payload 결과 payload
 * @param timing 시간 메타데이터
 * @param failedOver 최종 모델 이전에 일시적 실패한 모델 목록 (보통 비어 있음)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record QueryResponse(
    ModelId modelId,
    ResultPayload payload,
    Timing timing,
    List<ModelId> failedOver
) {

    public QueryResponse {
        if (modelId == null) {
            throw new IllegalArgumentException("modelId cannot be null");
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        if (timing == null) {
            throw new IllegalArgumentException("timing cannot be null");
        }
        failedOver = failedOver == null ? List.of() : List.copyOf(failedOver);
    }

    /**
     * 결과 신뢰도 (분류 결과 등 해당하는 경우).
     */
    public OptionalDouble confidence() {
        return payload.confidence();
    }

    /**
     * payload를 지정 타입으로 조회.
     *
     * @param type 기대 payload 타입
     * @return 캐스팅된 payload
     * @throws IllegalStateException 타입이 다른 경우
     */
    public <T extends ResultPayload> T payloadAs(Class<T> type) {
        if (!type.isInstance(payload)) {
            throw new IllegalStateException(
                "payload is " + payload.getClass().getSimpleName() + ", not " + type.getSimpleName());
        }
        return type.cast(payload);
    }
}
