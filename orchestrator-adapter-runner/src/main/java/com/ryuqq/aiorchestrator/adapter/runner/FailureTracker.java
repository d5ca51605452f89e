package com.ryuqq.aiorchestrator.adapter.runner;

import com.ryuqq.aiorchestrator.core.exception.UnknownModelException;
import com.ryuqq.aiorchestrator.core.model.HealthState;
import com.ryuqq.aiorchestrator.core.model.ModelId;
import com.ryuqq.aiorchestrator.core.spi.HealthListener;
import com.ryuqq.aiorchestrator.core.spi.ModelRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 모델별 연속 실패 카운터와 상태 정책.
 *
 * <p><strong>상태 정책:</strong></p>
 * <ul>
 *   <li>일시적 실패: 카운터 증가 → 임계값 미만이면 DEGRADED, 도달하면 UNAVAILABLE</li>
 *   <li>성공: 카운터 초기화, DEGRADED면 HEALTHY로 복원 (UNAVAILABLE은 유지)</li>
 *   <li>외부 복구로 HEALTHY 전환 시: 카운터 초기화 (레지스트리 리스너)</li>
 *   <li>등록 또는 등록 해제 시: 카운터 제거 (재등록된 모델은 0부터 시작)</li>
 * </ul>
 *
 * <p>DEGRADED 전환과 복원은 {@link ModelRegistry#compareAndSetHealth}로 수행되어
 * 동시에 기록된 UNAVAILABLE을 덮어쓰지 않습니다.</p>
 *
 * <p>영구 실패와 스키마 위반은 이 클래스에 전달되지 않습니다 (상태 변화 없음).</p>
 *
 * <p>호출 중 모델이 등록 해제된 경우 상태 변경은 무시되고 debug 로그만 남깁니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class FailureTracker implements HealthListener {

    private static final Logger log = LoggerFactory.getLogger(FailureTracker.class);

    private final ModelRegistry registry;
    private final int threshold;
    private final ConcurrentHashMap<ModelId, AtomicInteger> consecutiveFailures = new ConcurrentHashMap<>();

    /**
     * 생성자. 레지스트리에 상태 리스너로 등록됩니다.
     *
     * @param registry 모델 레지스트리
     * @param threshold UNAVAILABLE 전환 연속 실패 횟수
     * @throws IllegalArgumentException registry가 null이거나 threshold가 양수가 아닌 경우
     */
    public FailureTracker(ModelRegistry registry, int threshold) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (threshold <= 0) {
            throw new IllegalArgumentException("threshold must be positive (current: " + threshold + ")");
        }
        this.registry = registry;
        this.threshold = threshold;
        registry.addHealthListener(this);
    }

    /**
     * 일시적 실패 기록.
     *
     * @param modelId 실패한 모델
     * @return 기록 후 연속 실패 횟수
     */
    public int recordTransientFailure(ModelId modelId) {
        int failures = consecutiveFailures.computeIfAbsent(modelId, id -> new AtomicInteger()).incrementAndGet();
        try {
            if (failures >= threshold) {
                registry.setHealth(modelId, HealthState.UNAVAILABLE);
                log.warn("Model {} marked UNAVAILABLE after {} consecutive failures", modelId.getValue(), failures);
            } else if (registry.compareAndSetHealth(modelId, HealthState.HEALTHY, HealthState.DEGRADED)) {
                log.warn("Model {} degraded ({}/{} consecutive failures)", modelId.getValue(), failures, threshold);
            }
        } catch (UnknownModelException e) {
            consecutiveFailures.remove(modelId);
            log.debug("Model {} deregistered before its failure could be recorded", modelId.getValue());
        }
        return failures;
    }

    /**
     * 성공 기록.
     *
     * @param modelId 성공한 모델
     */
    public void recordSuccess(ModelId modelId) {
        AtomicInteger counter = consecutiveFailures.get(modelId);
        if (counter != null) {
            counter.set(0);
        }
        try {
            registry.compareAndSetHealth(modelId, HealthState.DEGRADED, HealthState.HEALTHY);
        } catch (UnknownModelException e) {
            log.debug("Model {} deregistered before its recovery could be recorded", modelId.getValue());
        }
    }

    /**
     * 현재 연속 실패 횟수.
     */
    public int consecutiveFailures(ModelId modelId) {
        AtomicInteger counter = consecutiveFailures.get(modelId);
        return counter == null ? 0 : counter.get();
    }

    public int threshold() {
        return threshold;
    }

    @Override
    public void onTransition(ModelId modelId, HealthState previous, HealthState current) {
        if (current == HealthState.HEALTHY) {
            consecutiveFailures.remove(modelId);
        }
    }

    @Override
    public void onRegistered(ModelId modelId) {
        consecutiveFailures.remove(modelId);
    }

    @Override
    public void onDeregistered(ModelId modelId) {
        consecutiveFailures.remove(modelId);
    }
}
