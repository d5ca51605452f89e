package com.ryuqq.aiorchestrator.application.catalog;

import com.ryuqq.aiorchestrator.core.model.BackendKind;
import com.ryuqq.aiorchestrator.core.model.HealthState;
import com.ryuqq.aiorchestrator.core.model.ModelDescriptor;
import com.ryuqq.aiorchestrator.core.model.ModelId;
import com.ryuqq.aiorchestrator.core.model.TaskType;
import com.ryuqq.aiorchestrator.core.model.Tier;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ModelView 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ModelViewTest {

    private static final ModelDescriptor LLAVA = ModelDescriptor.of(
        ModelId.of("llava"), BackendKind.VISION, Tier.VISION, List.of(TaskType.VISION));

    @Test
    void forTier_사용_가능_표시() {
        // when
        ModelView view = ModelView.forTier(LLAVA, true);

        // then
        assertThat(view.getModelId()).isEqualTo(ModelId.of("llava"));
        assertThat(view.getBackendKind()).isEqualTo(BackendKind.VISION);
        assertThat(view.getRequiredTier()).isEqualTo(Tier.VISION);
        assertThat(view.getCapabilities()).containsExactly(TaskType.VISION);
        assertThat(view.getHealthState()).isEqualTo(HealthState.HEALTHY);
        assertThat(view.isAuthorized()).isTrue();
    }

    @Test
    void unchecked_authorized는_false() {
        // when
        ModelView view = ModelView.unchecked(LLAVA);

        // then
        assertThat(view.isAuthorized()).isFalse();
    }

    @Test
    void getDescription_메타데이터_없으면_식별자() {
        // given
        ModelView plain = ModelView.unchecked(LLAVA);
        ModelView described = ModelView.unchecked(LLAVA.withMetadata(Map.of("description", "Image analysis")));

        // then
        assertThat(plain.getDescription()).isEqualTo("llava");
        assertThat(described.getDescription()).isEqualTo("Image analysis");
    }

    @Test
    void equals_같은_descriptor와_플래그() {
        assertThat(ModelView.forTier(LLAVA, true)).isEqualTo(ModelView.forTier(LLAVA, true));
        assertThat(ModelView.forTier(LLAVA, true)).isNotEqualTo(ModelView.forTier(LLAVA, false));
    }

    @Test
    void 생성_실패_null_descriptor() {
        assertThatThrownBy(() -> ModelView.unchecked(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("descriptor cannot be null");
    }
}
