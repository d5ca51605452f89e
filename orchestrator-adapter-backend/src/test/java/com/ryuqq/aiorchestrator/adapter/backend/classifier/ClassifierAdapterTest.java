package com.ryuqq.aiorchestrator.adapter.backend.classifier;

import com.ryuqq.aiorchestrator.core.contract.QueryInput;
import com.ryuqq.aiorchestrator.core.contract.QueryRequest;
import com.ryuqq.aiorchestrator.core.exception.AdapterException;
import com.ryuqq.aiorchestrator.core.model.BackendKind;
import com.ryuqq.aiorchestrator.core.model.ModelDescriptor;
import com.ryuqq.aiorchestrator.core.model.ModelId;
import com.ryuqq.aiorchestrator.core.model.TaskType;
import com.ryuqq.aiorchestrator.core.model.Tier;
import com.ryuqq.aiorchestrator.core.result.ClassificationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClassifierAdapterTest {

    private static final ModelId SPAM = ModelId.of("spam-detector");
    private static final ModelDescriptor SPAM_DETECTOR = ModelDescriptor.of(SPAM, BackendKind.CLASSIFIER,
        Tier.NEURAL, List.of(TaskType.CLASSIFY));

    private ClassifierAdapter adapter;

    @BeforeEach
    void setUp() {
        adapter = new ClassifierAdapter();
    }

    private static Map<String, Double> distribution(double spam, double ham) {
        Map<String, Double> probabilities = new LinkedHashMap<>();
        probabilities.put("spam", spam);
        probabilities.put("ham", ham);
        return probabilities;
    }

    @Test
    void invoke_최대_확률_클래스가_예측_클래스() throws Exception {
        // given
        adapter.register(SPAM, text -> text.contains("free") ? distribution(0.92, 0.08) : distribution(0.1, 0.9));

        // when
        ClassificationResult result = (ClassificationResult) adapter.invoke(SPAM_DETECTOR,
            QueryRequest.of("claim your free prize", Tier.NEURAL));

        // then
        assertThat(result.predictedClass()).isEqualTo("spam");
        assertThat(result.score()).isEqualTo(0.92);
        assertThat(result.probabilities()).containsOnlyKeys("spam", "ham");
        assertThat(result.confidence()).hasValue(0.92);
    }

    @Test
    void invoke_features_입력은_feature_예측_사용() throws Exception {
        // given
        adapter.register(SPAM, new ClassifierRuntime() {
            @Override
            public Map<String, Double> predict(String text) {
                return distribution(0.5, 0.5);
            }

            @Override
            public Map<String, Double> predict(Map<String, Object> features) {
                return ((Number) features.get("links")).intValue() > 3 ? distribution(0.8, 0.2) : distribution(0.3, 0.7);
            }
        });
        QueryRequest request = QueryRequest.builder(
            new QueryInput.Structured(Map.of("features", Map.of("links", 5))), Tier.NEURAL).build();

        // when
        ClassificationResult result = (ClassificationResult) adapter.invoke(SPAM_DETECTOR, request);

        // then
        assertThat(result.predictedClass()).isEqualTo("spam");
    }

    @Test
    void invoke_feature_미지원_분류기는_PERMANENT() {
        // given
        adapter.register(SPAM, text -> distribution(0.5, 0.5));
        QueryRequest request = QueryRequest.builder(
            new QueryInput.Structured(Map.of("features", Map.of("links", 5))), Tier.NEURAL).build();

        // when & then
        assertThatThrownBy(() -> adapter.invoke(SPAM_DETECTOR, request))
            .isInstanceOf(AdapterException.class)
            .satisfies(e -> assertThat(((AdapterException) e).failure()).isEqualTo(AdapterException.Failure.PERMANENT));
    }

    @Test
    void invoke_문자열이_아닌_feature_이름은_PERMANENT() {
        // given
        adapter.register(SPAM, new ClassifierRuntime() {
            @Override
            public Map<String, Double> predict(String text) {
                return distribution(0.5, 0.5);
            }

            @Override
            public Map<String, Double> predict(Map<String, Object> features) {
                return features.keySet().iterator().next().isEmpty() ? distribution(0.1, 0.9) : distribution(0.9, 0.1);
            }
        });
        QueryRequest request = QueryRequest.builder(
            new QueryInput.Structured(Map.of("features", Map.of(42, "links"))), Tier.NEURAL).build();

        // when & then
        assertThatThrownBy(() -> adapter.invoke(SPAM_DETECTOR, request))
            .isInstanceOf(AdapterException.class)
            .hasMessageContaining("42")
            .satisfies(e -> assertThat(((AdapterException) e).failure()).isEqualTo(AdapterException.Failure.PERMANENT));
    }

    @Test
    void invoke_runtime_미등록은_PERMANENT() {
        assertThatThrownBy(() -> adapter.invoke(SPAM_DETECTOR, QueryRequest.of("hi", Tier.NEURAL)))
            .isInstanceOf(AdapterException.class)
            .hasMessageContaining("spam-detector");
    }

    @Test
    void invoke_빈_분포는_MALFORMED_RESPONSE() {
        // given
        adapter.register(SPAM, text -> Map.of());

        // when & then
        assertThatThrownBy(() -> adapter.invoke(SPAM_DETECTOR, QueryRequest.of("hi", Tier.NEURAL)))
            .isInstanceOf(AdapterException.class)
            .satisfies(e -> assertThat(((AdapterException) e).failure())
                .isEqualTo(AdapterException.Failure.MALFORMED_RESPONSE));
    }

    @Test
    void probe_runtime_등록_여부() {
        // given
        assertThat(adapter.probe(SPAM_DETECTOR)).isFalse();

        // when
        adapter.register(SPAM, text -> distribution(0.5, 0.5));

        // then
        assertThat(adapter.probe(SPAM_DETECTOR)).isTrue();
        assertThat(adapter.backendKind()).isEqualTo(BackendKind.CLASSIFIER);
    }
}
