package com.ryuqq.aiorchestrator.core.result;

import com.ryuqq.aiorchestrator.core.model.BackendKind;

import java.util.OptionalDouble;

/**
 * 모델 실행 결과 payload.
 *
 * <p>결과 형태는 모델의 {@link BackendKind}로 결정됩니다:</p>
 * <ul>
 *   <li>{@link BackendKind#GENERAL_MODEL} → {@link ChatResult}</li>
 *   <li>{@link BackendKind#CLASSIFIER} → {@link ClassificationResult}</li>
 *   <li>{@link BackendKind#VISION} → {@link VisionResult}</li>
 *   <li>{@link BackendKind#CODE_ANALYSIS} → {@link CodeAnalysisResult}</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 새로운 결과 형태는 이 패키지에서만 추가할 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface ResultPayload
    permits ChatResult, ClassificationResult, VisionResult, CodeAnalysisResult {

    /**
     * 이 payload를 생산해야 하는 백엔드 종류.
     *
     * @return 대응 BackendKind
     */
    BackendKind backendKind();

    /**
     * 신뢰도 (해당하는 경우).
     *
     * @return 0.0~1.0 범위의 신뢰도 또는 empty
     */
    default OptionalDouble confidence() {
        return OptionalDouble.empty();
    }

    /**
     * 백엔드 종류에 대응하는 payload 타입 조회.
     *
     * @param kind 백엔드 종류
     * @return payload 클래스
     * @throws IllegalArgumentException kind가 null인 경우
     */
    static Class<? extends ResultPayload> typeFor(BackendKind kind) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        switch (kind) {
            case GENERAL_MODEL:
                return ChatResult.class;
            case CLASSIFIER:
                return ClassificationResult.class;
            case VISION:
                return VisionResult.class;
            case CODE_ANALYSIS:
                return CodeAnalysisResult.class;
            default:
                throw new IllegalArgumentException("Unsupported backend kind: " + kind);
        }
    }
}
