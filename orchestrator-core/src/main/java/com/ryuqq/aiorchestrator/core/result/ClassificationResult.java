package com.ryuqq.aiorchestrator.core.result;

import com.ryuqq.aiorchestrator.core.model.BackendKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * 분류기 예측 결과.
 *
 * <p>범위 검증(신뢰도 0~1, predictedClass가 확률 목록에 포함되는지 등)은
 * {@code SchemaValidator}가 담당합니다. 생성자는 null 방어만 수행합니다.</p>
 *
 * @param predictedClass 예측 클래스
 * @param score 예측 클래스의 신뢰도
 * @param probabilities 클래스별 확률 (비어 있을 수 있음)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ClassificationResult(
    String predictedClass,
    double score,
    Map<String, Double> probabilities
) implements ResultPayload {

    public ClassificationResult {
        probabilities = probabilities == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(probabilities));
    }

    @Override
    public BackendKind backendKind() {
        return BackendKind.CLASSIFIER;
    }

    @Override
    public OptionalDouble confidence() {
        return OptionalDouble.of(score);
    }
}
