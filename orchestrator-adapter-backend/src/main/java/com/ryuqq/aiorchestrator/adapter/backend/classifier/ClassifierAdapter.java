package com.ryuqq.aiorchestrator.adapter.backend.classifier;

import com.ryuqq.aiorchestrator.core.contract.QueryInput;
import com.ryuqq.aiorchestrator.core.contract.QueryRequest;
import com.ryuqq.aiorchestrator.core.exception.AdapterException;
import com.ryuqq.aiorchestrator.core.model.BackendKind;
import com.ryuqq.aiorchestrator.core.model.ModelDescriptor;
import com.ryuqq.aiorchestrator.core.model.ModelId;
import com.ryuqq.aiorchestrator.core.result.ClassificationResult;
import com.ryuqq.aiorchestrator.core.result.ResultPayload;
import com.ryuqq.aiorchestrator.core.spi.BackendAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * classifier 어댑터.
 *
 * <p>모델 식별자별로 등록된 {@link ClassifierRuntime}에 위임합니다.
 * 확률이 가장 높은 클래스가 예측 클래스이고, 그 확률이 신뢰도입니다.</p>
 *
 * <ul>
 *   <li>runtime 미등록: PERMANENT</li>
 *   <li>입력 형태 미지원: PERMANENT</li>
 *   <li>빈 확률 분포: MALFORMED_RESPONSE</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ClassifierAdapter implements BackendAdapter {

    private static final Logger log = LoggerFactory.getLogger(ClassifierAdapter.class);

    static final String FEATURES_FIELD = "features";
    static final String TEXT_FIELD = "text";

    private final Map<ModelId, ClassifierRuntime> runtimes = new ConcurrentHashMap<>();

    public ClassifierAdapter() {
    }

    public ClassifierAdapter(Map<ModelId, ? extends ClassifierRuntime> runtimes) {
        if (runtimes == null) {
            throw new IllegalArgumentException("runtimes cannot be null");
        }
        runtimes.forEach(this::register);
    }

    /**
     * runtime 등록 (같은 모델이면 교체).
     *
     * @param modelId 모델 식별자
     * @param runtime 학습된 분류기
     */
    public void register(ModelId modelId, ClassifierRuntime runtime) {
        if (modelId == null) {
            throw new IllegalArgumentException("modelId cannot be null");
        }
        if (runtime == null) {
            throw new IllegalArgumentException("runtime cannot be null");
        }
        runtimes.put(modelId, runtime);
        log.info("Classifier runtime registered for {}", modelId.getValue());
    }

    @Override
    public BackendKind backendKind() {
        return BackendKind.CLASSIFIER;
    }

    @Override
    public ResultPayload invoke(ModelDescriptor descriptor, QueryRequest request) throws AdapterException {
        ClassifierRuntime runtime = runtimes.get(descriptor.id());
        if (runtime == null) {
            throw AdapterException.permanentFailure(
                "no classifier runtime loaded for " + descriptor.id().getValue(), null);
        }

        Map<String, Double> probabilities;
        try {
            probabilities = predict(runtime, request.input());
        } catch (UnsupportedOperationException e) {
            throw AdapterException.permanentFailure(e.getMessage(), e);
        }
        return argMax(probabilities);
    }

    @Override
    public boolean probe(ModelDescriptor descriptor) {
        return runtimes.containsKey(descriptor.id());
    }

    private static Map<String, Double> predict(ClassifierRuntime runtime, QueryInput input) throws AdapterException {
        if (input instanceof QueryInput.Structured) {
            Map<String, Object> fields = ((QueryInput.Structured) input).fields();
            Object features = fields.get(FEATURES_FIELD);
            if (features instanceof Map) {
                return runtime.predict(featureMap((Map<?, ?>) features));
            }
            Object text = fields.get(TEXT_FIELD);
            return runtime.predict(text != null ? text.toString() : input.promptText());
        }
        return runtime.predict(input.promptText());
    }

    private static Map<String, Object> featureMap(Map<?, ?> features) throws AdapterException {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : features.entrySet()) {
            if (!(entry.getKey() instanceof String)) {
                throw AdapterException.permanentFailure("feature names must be strings (got " + entry.getKey() + ")",
                    null);
            }
            copy.put((String) entry.getKey(), entry.getValue());
        }
        return copy;
    }

    private static ClassificationResult argMax(Map<String, Double> probabilities) throws AdapterException {
        if (probabilities == null || probabilities.isEmpty()) {
            throw AdapterException.malformedResponse("classifier returned no class probabilities", null);
        }
        Map.Entry<String, Double> best = null;
        for (Map.Entry<String, Double> entry : probabilities.entrySet()) {
            if (entry.getValue() == null) {
                throw AdapterException.malformedResponse("classifier returned no probability for " + entry.getKey(),
                    null);
            }
            if (best == null || entry.getValue() > best.getValue()) {
                best = entry;
            }
        }
        return new ClassificationResult(best.getKey(), best.getValue(), probabilities);
    }
}
