package com.ryuqq.aiorchestrator.adapter.runner;

import com.ryuqq.aiorchestrator.application.health.HealthRecoveryPolicy;
import com.ryuqq.aiorchestrator.core.model.ModelDescriptor;
import com.ryuqq.aiorchestrator.core.model.ModelId;
import com.ryuqq.aiorchestrator.core.spi.BackendAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 주기적 probe 복구 정책.
 *
 * <p>UNAVAILABLE 전환 후 probeInterval이 지날 때마다 어댑터의 probe를 한 번 호출하고,
 * 성공하면 복구합니다. 실패하면 다음 간격까지 다시 시도하지 않습니다.</p>
 *
 * <p><strong>예시 (probeInterval = 60초):</strong></p>
 * <pre>
 * t=0    UNAVAILABLE 전환
 * t=30   scan → 대기 (간격 미도달)
 * t=60   scan → probe 실패
 * t=90   scan → 대기
 * t=120  scan → probe 성공 → HEALTHY
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class IntervalProbePolicy implements HealthRecoveryPolicy {

    private static final Logger log = LoggerFactory.getLogger(IntervalProbePolicy.class);

    private final Duration probeInterval;
    private final ConcurrentHashMap<ModelId, Instant> lastAttempt = new ConcurrentHashMap<>();

    /**
     * @param probeInterval probe 간격 (양수)
     * @throws IllegalArgumentException probeInterval이 null이거나 양수가 아닌 경우
     */
    public IntervalProbePolicy(Duration probeInterval) {
        if (probeInterval == null || probeInterval.isZero() || probeInterval.isNegative()) {
            throw new IllegalArgumentException("probeInterval must be positive (current: " + probeInterval + ")");
        }
        this.probeInterval = probeInterval;
    }

    @Override
    public boolean shouldRecover(ModelDescriptor descriptor, BackendAdapter adapter, Instant now) {
        Instant previous = lastAttempt.get(descriptor.id());
        if (previous != null && now.isBefore(previous.plus(probeInterval))) {
            return false;
        }
        lastAttempt.put(descriptor.id(), now);

        boolean alive;
        try {
            alive = adapter.probe(descriptor);
        } catch (RuntimeException e) {
            log.warn("Probe for {} failed with an exception", descriptor.id().getValue(), e);
            alive = false;
        }
        if (alive) {
            lastAttempt.remove(descriptor.id());
        }
        log.debug("Probe for {}: {}", descriptor.id().getValue(), alive ? "alive" : "unreachable");
        return alive;
    }

    @Override
    public void onUnavailable(ModelId modelId, Instant at) {
        lastAttempt.put(modelId, at);
    }

    public Duration probeInterval() {
        return probeInterval;
    }
}
