package com.ryuqq.aiorchestrator.adapter.runner;

import com.ryuqq.aiorchestrator.core.exception.BackendUnavailableException;
import com.ryuqq.aiorchestrator.core.exception.NoAuthorizedModelException;
import com.ryuqq.aiorchestrator.core.exception.PermissionDeniedException;
import com.ryuqq.aiorchestrator.core.exception.UnknownModelException;
import com.ryuqq.aiorchestrator.core.model.BackendKind;
import com.ryuqq.aiorchestrator.core.model.HealthState;
import com.ryuqq.aiorchestrator.core.model.ModelDescriptor;
import com.ryuqq.aiorchestrator.core.model.ModelId;
import com.ryuqq.aiorchestrator.core.model.TaskType;
import com.ryuqq.aiorchestrator.core.model.Tier;
import com.ryuqq.aiorchestrator.core.permission.TierChecker;
import com.ryuqq.aiorchestrator.core.spi.ModelRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

/**
 * ModelSelector 유닛 테스트.
 *
 * <p>레지스트리는 capability 정렬(health, 요구 등급 내림차순, 등록 순서)을 반환한다고 가정합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class ModelSelectorTest {

    @Mock
    private ModelRegistry registry;

    private static final ModelDescriptor A = chat("a", Tier.GUEST);
    private static final ModelDescriptor B = chat("b", Tier.NEURAL);

    private static ModelDescriptor chat(String id, Tier tier) {
        return ModelDescriptor.of(ModelId.of(id), BackendKind.GENERAL_MODEL, tier, List.of(TaskType.CHAT));
    }

    private ModelSelector selector(SelectionPolicy policy) {
        return new ModelSelector(registry, new TierChecker(), policy);
    }

    // ============================================================
    // 1. 자동 선택 정렬
    // ============================================================

    @Test
    void selectAuto_LEAST_PRIVILEGE_tier1_호출자는_A() {
        // given
        when(registry.listByCapability(TaskType.CHAT)).thenReturn(List.of(B, A));

        // when
        ModelDescriptor selected = selector(SelectionPolicy.LEAST_PRIVILEGE).selectAuto(TaskType.CHAT, Tier.BASIC, Set.of());

        // then
        assertThat(selected).isEqualTo(A);
    }

    @Test
    void selectAuto_LEAST_PRIVILEGE_tier3_호출자도_A() {
        // given
        when(registry.listByCapability(TaskType.CHAT)).thenReturn(List.of(B, A));

        // when
        ModelDescriptor selected = selector(SelectionPolicy.LEAST_PRIVILEGE).selectAuto(TaskType.CHAT, Tier.VISION, Set.of());

        // then
        assertThat(selected).isEqualTo(A);
    }

    @Test
    void selectAuto_REGISTRY_ORDER_tier3_호출자는_B() {
        // given
        when(registry.listByCapability(TaskType.CHAT)).thenReturn(List.of(B, A));

        // when
        ModelDescriptor selected = selector(SelectionPolicy.REGISTRY_ORDER).selectAuto(TaskType.CHAT, Tier.VISION, Set.of());

        // then
        assertThat(selected).isEqualTo(B);
    }

    @Test
    void selectAuto_REGISTRY_ORDER_tier1_호출자는_A() {
        // given
        when(registry.listByCapability(TaskType.CHAT)).thenReturn(List.of(B, A));

        // when & then
        assertThat(selector(SelectionPolicy.REGISTRY_ORDER).selectAuto(TaskType.CHAT, Tier.BASIC, Set.of())).isEqualTo(A);
    }

    @Test
    void selectAuto_DEGRADED보다_HEALTHY_우선() {
        // given
        ModelDescriptor degradedA = A.withHealth(HealthState.DEGRADED);
        when(registry.listByCapability(TaskType.CHAT)).thenReturn(List.of(B, degradedA));

        // when
        ModelDescriptor selected = selector(SelectionPolicy.LEAST_PRIVILEGE).selectAuto(TaskType.CHAT, Tier.ADMIN, Set.of());

        // then
        assertThat(selected).isEqualTo(B);
    }

    @Test
    void selectAuto_UNAVAILABLE_모델_제외() {
        // given
        when(registry.listByCapability(TaskType.CHAT)).thenReturn(List.of(B, A.withHealth(HealthState.UNAVAILABLE)));

        // when
        ModelDescriptor selected = selector(SelectionPolicy.LEAST_PRIVILEGE).selectAuto(TaskType.CHAT, Tier.ADMIN, Set.of());

        // then
        assertThat(selected).isEqualTo(B);
    }

    @Test
    void selectAuto_제외_목록_모델_건너뜀() {
        // given
        when(registry.listByCapability(TaskType.CHAT)).thenReturn(List.of(B, A));

        // when
        ModelDescriptor selected = selector(SelectionPolicy.LEAST_PRIVILEGE)
            .selectAuto(TaskType.CHAT, Tier.ADMIN, Set.of(ModelId.of("a")));

        // then
        assertThat(selected).isEqualTo(B);
    }

    @Test
    void selectAuto_권한_있는_후보_없으면_NoAuthorizedModelException() {
        // given
        when(registry.listByCapability(TaskType.CHAT)).thenReturn(List.of(B));

        // when & then
        assertThatThrownBy(() -> selector(SelectionPolicy.LEAST_PRIVILEGE).selectAuto(TaskType.CHAT, Tier.GUEST, Set.of()))
            .isInstanceOf(NoAuthorizedModelException.class)
            .hasMessageContaining("chat");
    }

    @Test
    void selectAuto_capability_없으면_NoAuthorizedModelException() {
        // given
        when(registry.listByCapability(TaskType.VISION)).thenReturn(List.of());

        // when & then
        assertThatThrownBy(() -> selector(SelectionPolicy.LEAST_PRIVILEGE).selectAuto(TaskType.VISION, Tier.ADMIN, Set.of()))
            .isInstanceOf(NoAuthorizedModelException.class);
    }

    // ============================================================
    // 2. 명시적 선택
    // ============================================================

    @Test
    void selectExplicit_권한_있으면_descriptor_반환() {
        // given
        when(registry.lookup(ModelId.of("b"))).thenReturn(B);

        // when & then
        assertThat(selector(SelectionPolicy.LEAST_PRIVILEGE).selectExplicit(ModelId.of("b"), Tier.NEURAL)).isEqualTo(B);
    }

    @Test
    void selectExplicit_등급_부족하면_PermissionDeniedException() {
        // given
        when(registry.lookup(ModelId.of("b"))).thenReturn(B);

        // when & then
        assertThatThrownBy(() -> selector(SelectionPolicy.LEAST_PRIVILEGE).selectExplicit(ModelId.of("b"), Tier.GUEST))
            .isInstanceOf(PermissionDeniedException.class)
            .satisfies(e -> assertThat(((PermissionDeniedException) e).requiredTier()).isEqualTo(Tier.NEURAL));
    }

    @Test
    void selectExplicit_UNAVAILABLE이면_BackendUnavailableException() {
        // given
        when(registry.lookup(ModelId.of("a"))).thenReturn(A.withHealth(HealthState.UNAVAILABLE));

        // when & then
        assertThatThrownBy(() -> selector(SelectionPolicy.LEAST_PRIVILEGE).selectExplicit(ModelId.of("a"), Tier.ADMIN))
            .isInstanceOf(BackendUnavailableException.class);
    }

    @Test
    void selectExplicit_없는_모델_UnknownModelException_전파() {
        // given
        when(registry.lookup(ModelId.of("ghost"))).thenThrow(new UnknownModelException(ModelId.of("ghost")));

        // when & then
        assertThatThrownBy(() -> selector(SelectionPolicy.LEAST_PRIVILEGE).selectExplicit(ModelId.of("ghost"), Tier.ADMIN))
            .isInstanceOf(UnknownModelException.class);
    }

    @Test
    void 생성_실패_null_registry() {
        assertThatThrownBy(() -> new ModelSelector(null, new TierChecker(), SelectionPolicy.LEAST_PRIVILEGE))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("registry cannot be null");
    }
}
