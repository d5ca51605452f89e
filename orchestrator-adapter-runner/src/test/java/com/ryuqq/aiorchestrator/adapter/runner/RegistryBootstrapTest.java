package com.ryuqq.aiorchestrator.adapter.runner;

import com.ryuqq.aiorchestrator.adapter.inmemory.registry.InMemoryModelRegistry;
import com.ryuqq.aiorchestrator.core.exception.DuplicateModelException;
import com.ryuqq.aiorchestrator.core.exception.SchemaValidationException;
import com.ryuqq.aiorchestrator.core.model.BackendKind;
import com.ryuqq.aiorchestrator.core.model.ModelDescriptor;
import com.ryuqq.aiorchestrator.core.model.ModelId;
import com.ryuqq.aiorchestrator.core.model.TaskType;
import com.ryuqq.aiorchestrator.core.model.Tier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RegistryBootstrapTest {

    private InMemoryModelRegistry registry;
    private RegistryBootstrap bootstrap;

    @BeforeEach
    void setUp() {
        registry = new InMemoryModelRegistry();
        bootstrap = new RegistryBootstrap(registry);
    }

    private static Map<String, Object> entry(String id, String kind, int tier, List<String> capabilities) {
        return Map.of("id", id, "backendKind", kind, "requiredTier", tier, "capabilities", capabilities);
    }

    @Test
    void registerAll_설정_목록_순서대로_등록() {
        // when
        List<ModelDescriptor> registered = bootstrap.registerAll(List.of(
            entry("llama2", "general-model", 1, List.of("chat", "generate")),
            entry("spam-detector", "classifier", 2, List.of("classify")),
            entry("llava", "vision", 3, List.of("vision"))
        ));

        // then
        assertThat(registered).extracting(ModelDescriptor::id)
            .containsExactly(ModelId.of("llama2"), ModelId.of("spam-detector"), ModelId.of("llava"));
        assertThat(registry.size()).isEqualTo(3);
        assertThat(registry.lookup(ModelId.of("llava")).backendKind()).isEqualTo(BackendKind.VISION);
        assertThat(registry.lookup(ModelId.of("spam-detector")).requiredTier()).isEqualTo(Tier.NEURAL);
        assertThat(registry.listByCapability(TaskType.GENERATE)).hasSize(1);
    }

    @Test
    void registerAll_잘못된_항목_있으면_아무것도_등록하지_않음() {
        // when & then
        assertThatThrownBy(() -> bootstrap.registerAll(List.of(
            entry("llama2", "general-model", 1, List.of("chat")),
            entry("broken", "quantum", 1, List.of("chat"))
        ))).isInstanceOf(SchemaValidationException.class);
        assertThat(registry.size()).isZero();
    }

    @Test
    void registerAll_중복_식별자는_DuplicateModelException() {
        // when & then
        assertThatThrownBy(() -> bootstrap.registerAll(List.of(
            entry("llama2", "general-model", 1, List.of("chat")),
            entry("llama2", "general-model", 0, List.of("chat"))
        ))).isInstanceOf(DuplicateModelException.class);
    }
}
