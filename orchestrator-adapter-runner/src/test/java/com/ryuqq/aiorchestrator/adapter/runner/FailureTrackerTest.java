package com.ryuqq.aiorchestrator.adapter.runner;

import com.ryuqq.aiorchestrator.adapter.inmemory.registry.InMemoryModelRegistry;
import com.ryuqq.aiorchestrator.core.exception.UnknownModelException;
import com.ryuqq.aiorchestrator.core.model.BackendKind;
import com.ryuqq.aiorchestrator.core.model.HealthState;
import com.ryuqq.aiorchestrator.core.model.ModelDescriptor;
import com.ryuqq.aiorchestrator.core.model.ModelId;
import com.ryuqq.aiorchestrator.core.model.TaskType;
import com.ryuqq.aiorchestrator.core.model.Tier;
import com.ryuqq.aiorchestrator.core.spi.ModelRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * FailureTracker 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class FailureTrackerTest {

    private static final ModelId LLAMA = ModelId.of("llama2");
    private static final ModelDescriptor HEALTHY = ModelDescriptor.of(LLAMA, BackendKind.GENERAL_MODEL, Tier.BASIC,
        List.of(TaskType.CHAT));

    @Mock
    private ModelRegistry registry;

    private FailureTracker tracker;

    @BeforeEach
    void setUp() {
        tracker = new FailureTracker(registry, 3);
    }

    @Test
    void 생성시_레지스트리_리스너_등록() {
        verify(registry).addHealthListener(tracker);
    }

    @Test
    void recordTransientFailure_임계값_미만이면_HEALTHY에서_DEGRADED로_조건부_전환() {
        // given
        when(registry.compareAndSetHealth(LLAMA, HealthState.HEALTHY, HealthState.DEGRADED)).thenReturn(true);

        // when
        int failures = tracker.recordTransientFailure(LLAMA);

        // then
        assertThat(failures).isEqualTo(1);
        verify(registry).compareAndSetHealth(LLAMA, HealthState.HEALTHY, HealthState.DEGRADED);
        verify(registry, never()).setHealth(any(), any());
        verify(registry, never()).lookup(any());
    }

    @Test
    void recordTransientFailure_임계값_도달하면_UNAVAILABLE() {
        // when
        tracker.recordTransientFailure(LLAMA);
        tracker.recordTransientFailure(LLAMA);
        int failures = tracker.recordTransientFailure(LLAMA);

        // then
        assertThat(failures).isEqualTo(3);
        verify(registry).setHealth(LLAMA, HealthState.UNAVAILABLE);
    }

    @Test
    void recordTransientFailure_이미_UNAVAILABLE이면_DEGRADED로_되돌리지_않음() {
        // given
        InMemoryModelRegistry realRegistry = new InMemoryModelRegistry();
        realRegistry.register(HEALTHY);
        realRegistry.setHealth(LLAMA, HealthState.UNAVAILABLE);
        FailureTracker realTracker = new FailureTracker(realRegistry, 5);

        // when
        realTracker.recordTransientFailure(LLAMA);

        // then
        assertThat(realRegistry.lookup(LLAMA).healthState()).isEqualTo(HealthState.UNAVAILABLE);
    }

    @Test
    void recordTransientFailure_등록_해제된_모델_예외_없이_카운터_제거() {
        // given
        when(registry.compareAndSetHealth(LLAMA, HealthState.HEALTHY, HealthState.DEGRADED))
            .thenThrow(new UnknownModelException(LLAMA));

        // when & then
        assertThatCode(() -> tracker.recordTransientFailure(LLAMA)).doesNotThrowAnyException();
        assertThat(tracker.consecutiveFailures(LLAMA)).isZero();
    }

    @Test
    void recordSuccess_카운터_초기화_및_DEGRADED_조건부_복원() {
        // given
        tracker.recordTransientFailure(LLAMA);

        // when
        tracker.recordSuccess(LLAMA);

        // then
        assertThat(tracker.consecutiveFailures(LLAMA)).isZero();
        verify(registry).compareAndSetHealth(LLAMA, HealthState.DEGRADED, HealthState.HEALTHY);
        verify(registry, never()).setHealth(any(), any());
    }

    @Test
    void recordSuccess_UNAVAILABLE은_복원하지_않음() {
        // given
        InMemoryModelRegistry realRegistry = new InMemoryModelRegistry();
        realRegistry.register(HEALTHY);
        realRegistry.setHealth(LLAMA, HealthState.UNAVAILABLE);
        FailureTracker realTracker = new FailureTracker(realRegistry, 3);

        // when
        realTracker.recordSuccess(LLAMA);

        // then
        assertThat(realRegistry.lookup(LLAMA).healthState()).isEqualTo(HealthState.UNAVAILABLE);
    }

    @Test
    void recordSuccess_동시에_UNAVAILABLE로_전환된_모델은_HEALTHY로_덮어쓰지_않음() throws Exception {
        // given
        InMemoryModelRegistry realRegistry = new InMemoryModelRegistry();
        realRegistry.register(HEALTHY);
        FailureTracker realTracker = new FailureTracker(realRegistry, 1_000_000);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        int rounds = 2_000;

        try {
            for (int i = 0; i < rounds; i++) {
                realRegistry.setHealth(LLAMA, HealthState.DEGRADED);
                CountDownLatch start = new CountDownLatch(1);
                Future<?> success = pool.submit(() -> {
                    start.await();
                    realTracker.recordSuccess(LLAMA);
                    return null;
                });
                Future<?> outage = pool.submit(() -> {
                    start.await();
                    realRegistry.setHealth(LLAMA, HealthState.UNAVAILABLE);
                    return null;
                });
                start.countDown();
                success.get(5, TimeUnit.SECONDS);
                outage.get(5, TimeUnit.SECONDS);

                // then
                assertThat(realRegistry.lookup(LLAMA).healthState()).as("round %d", i)
                    .isEqualTo(HealthState.UNAVAILABLE);
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void onTransition_HEALTHY_전환시_카운터_초기화() {
        // given
        tracker.recordTransientFailure(LLAMA);
        tracker.recordTransientFailure(LLAMA);

        // when
        tracker.onTransition(LLAMA, HealthState.UNAVAILABLE, HealthState.HEALTHY);

        // then
        assertThat(tracker.consecutiveFailures(LLAMA)).isZero();
    }

    @Test
    void onDeregistered_카운터_제거() {
        // given
        tracker.recordTransientFailure(LLAMA);
        tracker.recordTransientFailure(LLAMA);

        // when
        tracker.onDeregistered(LLAMA);

        // then
        assertThat(tracker.consecutiveFailures(LLAMA)).isZero();
    }

    @Test
    void 재등록된_모델은_이전_실패_횟수를_물려받지_않음() {
        // given
        InMemoryModelRegistry realRegistry = new InMemoryModelRegistry();
        realRegistry.register(HEALTHY);
        FailureTracker realTracker = new FailureTracker(realRegistry, 3);
        realTracker.recordTransientFailure(LLAMA);
        realTracker.recordTransientFailure(LLAMA);
        realRegistry.deregister(LLAMA);
        realRegistry.register(HEALTHY);

        // when
        int failures = realTracker.recordTransientFailure(LLAMA);

        // then
        assertThat(failures).isEqualTo(1);
        assertThat(realRegistry.lookup(LLAMA).healthState()).isEqualTo(HealthState.DEGRADED);
    }

    @Test
    void 등록_해제_중_기록된_실패도_재등록_후_남지_않음() {
        // given
        InMemoryModelRegistry realRegistry = new InMemoryModelRegistry();
        realRegistry.register(HEALTHY);
        FailureTracker realTracker = new FailureTracker(realRegistry, 3);
        realTracker.recordTransientFailure(LLAMA);
        realRegistry.deregister(LLAMA);
        realTracker.recordTransientFailure(LLAMA);

        // when
        realRegistry.register(HEALTHY);

        // then
        assertThat(realTracker.consecutiveFailures(LLAMA)).isZero();
    }

    @Test
    void 생성_실패_threshold_0() {
        assertThatThrownBy(() -> new FailureTracker(registry, 0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("threshold must be positive");
    }
}
