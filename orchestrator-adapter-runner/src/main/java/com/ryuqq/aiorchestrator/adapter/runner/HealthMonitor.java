package com.ryuqq.aiorchestrator.adapter.runner;

import com.ryuqq.aiorchestrator.application.health.HealthRecoveryPolicy;
import com.ryuqq.aiorchestrator.core.exception.UnknownModelException;
import com.ryuqq.aiorchestrator.core.model.HealthState;
import com.ryuqq.aiorchestrator.core.model.ModelDescriptor;
import com.ryuqq.aiorchestrator.core.model.ModelId;
import com.ryuqq.aiorchestrator.core.spi.BackendAdapter;
import com.ryuqq.aiorchestrator.core.spi.ModelRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * UNAVAILABLE 모델 복구 컴포넌트.
 *
 * <p>UNAVAILABLE 모델을 스캔하고, {@link HealthRecoveryPolicy}가 복구를 허용하면
 * HEALTHY로 전환합니다. 전환 시 연속 실패 카운터는 FailureTracker가 초기화합니다.</p>
 *
 * <p><strong>복구 시나리오:</strong></p>
 * <pre>
 * 1. 연속 실패 임계값 도달 → UNAVAILABLE (자동 선택에서 제외)
 * 2. HealthMonitor가 주기적 스캔 (예: 30초마다)
 * 3. 정책 판단:
 *    - ManualRecoveryPolicy: 복구 안 함 (운영자가 markHealthy 호출)
 *    - IntervalProbePolicy: 간격마다 adapter.probe() → 성공 시 복구
 * 4. HEALTHY 전환 → 다음 선택부터 후보에 포함
 * </pre>
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>UNAVAILABLE 모델 스캔 및 복구</li>
 *   <li>개별 모델 복구 실패가 다른 모델 복구를 방해하지 않음</li>
 *   <li>UNAVAILABLE 모델이 batchSize보다 많으면 스캔마다 순환하여 처리</li>
 *   <li>운영자 수동 복구 진입점</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class HealthMonitor {

    private static final Logger log = LoggerFactory.getLogger(HealthMonitor.class);

    private final ModelRegistry registry;
    private final BackendRouter router;
    private final HealthRecoveryPolicy policy;
    private final HealthMonitorConfig config;
    private final Clock clock;
    private final AtomicInteger scanOffset = new AtomicInteger();
    private ScheduledExecutorService scheduler;

    public HealthMonitor(ModelRegistry registry, BackendRouter router, HealthRecoveryPolicy policy,
                         HealthMonitorConfig config) {
        this(registry, router, policy, config, Clock.systemUTC());
    }

    /**
     * 생성자. 레지스트리에 상태 리스너로 등록됩니다.
     *
     * @param registry 모델 레지스트리
     * @param router 어댑터 라우팅 테이블
     * @param policy 복구 정책
     * @param config 설정
     * @param clock 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public HealthMonitor(ModelRegistry registry, BackendRouter router, HealthRecoveryPolicy policy,
                         HealthMonitorConfig config, Clock clock) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (router == null) {
            throw new IllegalArgumentException("router cannot be null");
        }
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.registry = registry;
        this.router = router;
        this.policy = policy;
        this.config = config;
        this.clock = clock;
        registry.addHealthListener((modelId, previous, current) -> {
            if (current == HealthState.UNAVAILABLE) {
                policy.onUnavailable(modelId, clock.instant());
            }
        });
    }

    /**
     * UNAVAILABLE 모델 스캔 및 복구.
     *
     * <p>주기적으로 호출되어야 합니다 ({@link #start()} 또는 외부 스케줄러).</p>
     *
     * @return 복구된 모델 수
     */
    public int scan() {
        List<ModelDescriptor> unavailable = nextBatch(registry.listAll().stream()
            .filter(descriptor -> descriptor.healthState() == HealthState.UNAVAILABLE)
            .collect(Collectors.toList()));
        if (unavailable.isEmpty()) {
            return 0;
        }
        log.debug("Health monitor scan started: {} unavailable", unavailable.size());

        Instant now = clock.instant();
        int recovered = 0;
        for (ModelDescriptor descriptor : unavailable) {
            if (tryRecover(descriptor, now)) {
                recovered++;
            }
        }

        log.info("Health monitor scan completed: {} recovered out of {} unavailable", recovered, unavailable.size());
        return recovered;
    }

    /**
     * 운영자 수동 복구.
     *
     * @param modelId 복구할 모델
     * @return 전환 후 descriptor
     * @throws UnknownModelException 등록되지 않은 모델
     */
    public ModelDescriptor markHealthy(ModelId modelId) {
        ModelDescriptor updated = registry.setHealth(modelId, HealthState.HEALTHY);
        log.info("Model {} marked HEALTHY by operator", modelId.getValue());
        return updated;
    }

    /**
     * 주기적 스캔 시작 (scanIntervalMs 간격, 데몬 스레드).
     *
     * @throws IllegalStateException 이미 시작된 경우
     */
    public synchronized void start() {
        if (scheduler != null) {
            throw new IllegalStateException("HealthMonitor already started");
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "health-monitor");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleWithFixedDelay(this::scanSafely,
            config.scanIntervalMs(), config.scanIntervalMs(), TimeUnit.MILLISECONDS);
        log.info("Health monitor started (scanIntervalMs={})", config.scanIntervalMs());
    }

    /**
     * 주기적 스캔 중지.
     */
    public synchronized void stop() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
            log.info("Health monitor stopped");
        }
    }

    private void scanSafely() {
        try {
            scan();
        } catch (RuntimeException e) {
            // an exception would cancel the scheduled task
            log.error("Health monitor scan failed", e);
        }
    }

    /**
     * batchSize를 넘는 경우 스캔마다 시작 위치를 옮겨 모든 UNAVAILABLE 모델이 차례로 검사되도록 합니다.
     */
    private List<ModelDescriptor> nextBatch(List<ModelDescriptor> unavailable) {
        int size = unavailable.size();
        if (size <= config.batchSize()) {
            return unavailable;
        }
        int start = Math.floorMod(scanOffset.getAndAdd(config.batchSize()), size);
        List<ModelDescriptor> batch = new ArrayList<>(config.batchSize());
        for (int i = 0; i < config.batchSize(); i++) {
            batch.add(unavailable.get((start + i) % size));
        }
        return batch;
    }

    private boolean tryRecover(ModelDescriptor descriptor, Instant now) {
        Optional<BackendAdapter> adapter = router.find(descriptor.backendKind());
        if (adapter.isEmpty()) {
            log.warn("No adapter for {} ({}); cannot probe", descriptor.id().getValue(),
                descriptor.backendKind().wireName());
            return false;
        }
        try {
            if (!policy.shouldRecover(descriptor, adapter.get(), now)) {
                return false;
            }
            registry.setHealth(descriptor.id(), HealthState.HEALTHY);
            log.info("Model {} recovered", descriptor.id().getValue());
            return true;
        } catch (UnknownModelException e) {
            log.debug("Model {} deregistered during recovery", descriptor.id().getValue());
            return false;
        } catch (RuntimeException e) {
            log.error("Failed to recover {} in health monitor scan", descriptor.id().getValue(), e);
            return false;
        }
    }
}
