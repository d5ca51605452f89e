package com.ryuqq.aiorchestrator.adapter.runner;

import com.ryuqq.aiorchestrator.adapter.inmemory.registry.InMemoryModelRegistry;
import com.ryuqq.aiorchestrator.application.health.HealthRecoveryPolicy;
import com.ryuqq.aiorchestrator.core.exception.UnknownModelException;
import com.ryuqq.aiorchestrator.core.model.BackendKind;
import com.ryuqq.aiorchestrator.core.model.HealthState;
import com.ryuqq.aiorchestrator.core.model.ModelDescriptor;
import com.ryuqq.aiorchestrator.core.model.ModelId;
import com.ryuqq.aiorchestrator.core.model.TaskType;
import com.ryuqq.aiorchestrator.core.model.Tier;
import com.ryuqq.aiorchestrator.core.spi.BackendAdapter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * HealthMonitor 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class HealthMonitorTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");
    private static final ModelId LLAMA = ModelId.of("llama2");
    private static final ModelId MISTRAL = ModelId.of("mistral");

    @Mock
    private BackendAdapter chatAdapter;

    @Mock
    private HealthRecoveryPolicy policy;

    private InMemoryModelRegistry registry;
    private HealthMonitor monitor;

    @BeforeEach
    void setUp() {
        when(chatAdapter.backendKind()).thenReturn(BackendKind.GENERAL_MODEL);
        registry = new InMemoryModelRegistry();
        registry.register(ModelDescriptor.of(LLAMA, BackendKind.GENERAL_MODEL, Tier.BASIC, List.of(TaskType.CHAT)));
        registry.register(ModelDescriptor.of(MISTRAL, BackendKind.GENERAL_MODEL, Tier.BASIC, List.of(TaskType.CHAT)));
        monitor = new HealthMonitor(registry, new BackendRouter(List.of(chatAdapter)), policy,
            new HealthMonitorConfig(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    // ============================================================
    // 1. 스캔
    // ============================================================

    @Test
    void scan_UNAVAILABLE_없으면_0() {
        // when
        int recovered = monitor.scan();

        // then
        assertThat(recovered).isZero();
        verify(policy, never()).shouldRecover(any(), any(), any());
    }

    @Test
    void scan_정책이_허용하면_HEALTHY로_복구() {
        // given
        registry.setHealth(LLAMA, HealthState.UNAVAILABLE);
        when(policy.shouldRecover(any(), eq(chatAdapter), eq(NOW))).thenReturn(true);

        // when
        int recovered = monitor.scan();

        // then
        assertThat(recovered).isEqualTo(1);
        assertThat(registry.lookup(LLAMA).healthState()).isEqualTo(HealthState.HEALTHY);
    }

    @Test
    void scan_정책이_거부하면_UNAVAILABLE_유지() {
        // given
        registry.setHealth(LLAMA, HealthState.UNAVAILABLE);
        when(policy.shouldRecover(any(), any(), any())).thenReturn(false);

        // when
        int recovered = monitor.scan();

        // then
        assertThat(recovered).isZero();
        assertThat(registry.lookup(LLAMA).healthState()).isEqualTo(HealthState.UNAVAILABLE);
    }

    @Test
    void scan_개별_모델_실패가_다른_모델_복구를_막지_않음() {
        // given
        registry.setHealth(LLAMA, HealthState.UNAVAILABLE);
        registry.setHealth(MISTRAL, HealthState.UNAVAILABLE);
        when(policy.shouldRecover(any(), any(), any())).thenAnswer(invocation -> {
            ModelDescriptor descriptor = invocation.getArgument(0);
            if (descriptor.id().equals(LLAMA)) {
                throw new IllegalStateException("probe exploded");
            }
            return true;
        });

        // when
        int recovered = monitor.scan();

        // then
        assertThat(recovered).isEqualTo(1);
        assertThat(registry.lookup(LLAMA).healthState()).isEqualTo(HealthState.UNAVAILABLE);
        assertThat(registry.lookup(MISTRAL).healthState()).isEqualTo(HealthState.HEALTHY);
    }

    @Test
    void scan_batchSize만큼만_처리() {
        // given
        monitor = new HealthMonitor(registry, new BackendRouter(List.of(chatAdapter)), policy,
            new HealthMonitorConfig().withBatchSize(1), Clock.fixed(NOW, ZoneOffset.UTC));
        registry.setHealth(LLAMA, HealthState.UNAVAILABLE);
        registry.setHealth(MISTRAL, HealthState.UNAVAILABLE);
        when(policy.shouldRecover(any(), any(), any())).thenReturn(true);

        // when
        int recovered = monitor.scan();

        // then
        assertThat(recovered).isEqualTo(1);
    }

    @Test
    void scan_batchSize보다_많으면_스캔마다_순환하여_복구되지_않는_모델이_독점하지_않음() {
        // given: 먼저 등록된 LLAMA는 계속 복구 불가, MISTRAL은 복구 가능
        monitor = new HealthMonitor(registry, new BackendRouter(List.of(chatAdapter)), policy,
            new HealthMonitorConfig().withBatchSize(1), Clock.fixed(NOW, ZoneOffset.UTC));
        registry.setHealth(LLAMA, HealthState.UNAVAILABLE);
        registry.setHealth(MISTRAL, HealthState.UNAVAILABLE);
        when(policy.shouldRecover(any(), any(), any()))
            .thenAnswer(invocation -> ((ModelDescriptor) invocation.getArgument(0)).id().equals(MISTRAL));

        // when
        int first = monitor.scan();
        int second = monitor.scan();

        // then
        assertThat(first + second).isEqualTo(1);
        assertThat(registry.lookup(MISTRAL).healthState()).isEqualTo(HealthState.HEALTHY);
        assertThat(registry.lookup(LLAMA).healthState()).isEqualTo(HealthState.UNAVAILABLE);
    }

    // ============================================================
    // 2. 리스너 및 수동 복구
    // ============================================================

    @Test
    void UNAVAILABLE_전환시_정책에_시각_전달() {
        // when
        registry.setHealth(LLAMA, HealthState.UNAVAILABLE);

        // then
        verify(policy).onUnavailable(LLAMA, NOW);
    }

    @Test
    void markHealthy_운영자_수동_복구() {
        // given
        registry.setHealth(LLAMA, HealthState.UNAVAILABLE);

        // when
        ModelDescriptor updated = monitor.markHealthy(LLAMA);

        // then
        assertThat(updated.healthState()).isEqualTo(HealthState.HEALTHY);
    }

    @Test
    void markHealthy_없는_모델은_UnknownModelException() {
        assertThatThrownBy(() -> monitor.markHealthy(ModelId.of("ghost")))
            .isInstanceOf(UnknownModelException.class);
    }

    @Test
    void start_두_번_호출하면_IllegalStateException() {
        // given
        monitor.start();

        try {
            // when & then
            assertThatThrownBy(() -> monitor.start()).isInstanceOf(IllegalStateException.class);
        } finally {
            monitor.stop();
        }
    }
}
