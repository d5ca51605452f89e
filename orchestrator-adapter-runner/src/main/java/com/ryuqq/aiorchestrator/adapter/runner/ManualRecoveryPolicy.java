package com.ryuqq.aiorchestrator.adapter.runner;

import com.ryuqq.aiorchestrator.application.health.HealthRecoveryPolicy;
import com.ryuqq.aiorchestrator.core.model.ModelDescriptor;
import com.ryuqq.aiorchestrator.core.spi.BackendAdapter;

import java.time.Instant;

/**
 * 수동 복구 정책.
 *
 * <p>스캔으로는 복구하지 않습니다. 운영자가 {@link HealthMonitor#markHealthy}를 호출해야
 * UNAVAILABLE 모델이 다시 선택 대상이 됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ManualRecoveryPolicy implements HealthRecoveryPolicy {

    @Override
    public boolean shouldRecover(ModelDescriptor descriptor, BackendAdapter adapter, Instant now) {
        return false;
    }
}
