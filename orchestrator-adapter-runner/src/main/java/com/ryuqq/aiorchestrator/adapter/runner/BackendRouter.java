package com.ryuqq.aiorchestrator.adapter.runner;

import com.ryuqq.aiorchestrator.core.exception.BackendUnavailableException;
import com.ryuqq.aiorchestrator.core.model.BackendKind;
import com.ryuqq.aiorchestrator.core.model.ModelDescriptor;
import com.ryuqq.aiorchestrator.core.spi.BackendAdapter;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * BackendKind → BackendAdapter 라우팅 테이블.
 *
 * <p>종류마다 어댑터는 최대 하나입니다. 생성 후 변경되지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class BackendRouter {

    private final Map<BackendKind, BackendAdapter> adapters;

    /**
     * 생성자.
     *
     * @param adapters 어댑터 목록
     * @throws IllegalArgumentException null이 있거나 같은 종류의 어댑터가 둘 이상인 경우
     */
    public BackendRouter(Collection<? extends BackendAdapter> adapters) {
        if (adapters == null) {
            throw new IllegalArgumentException("adapters cannot be null");
        }
        Map<BackendKind, BackendAdapter> table = new EnumMap<>(BackendKind.class);
        for (BackendAdapter adapter : adapters) {
            if (adapter == null || adapter.backendKind() == null) {
                throw new IllegalArgumentException("adapter and its backendKind cannot be null");
            }
            BackendAdapter previous = table.put(adapter.backendKind(), adapter);
            if (previous != null) {
                throw new IllegalArgumentException(
                    "Duplicate adapter for backend kind " + adapter.backendKind().wireName());
            }
        }
        this.adapters = Collections.unmodifiableMap(table);
    }

    public Optional<BackendAdapter> find(BackendKind kind) {
        return Optional.ofNullable(adapters.get(kind));
    }

    /**
     * descriptor의 backend kind에 대응하는 어댑터.
     *
     * @param descriptor 선택된 모델
     * @return 어댑터
     * @throws BackendUnavailableException 어댑터가 구성되지 않은 경우
     */
    public BackendAdapter route(ModelDescriptor descriptor) {
        BackendAdapter adapter = adapters.get(descriptor.backendKind());
        if (adapter == null) {
            throw new BackendUnavailableException(descriptor.id(),
                "No adapter configured for backend kind " + descriptor.backendKind().wireName());
        }
        return adapter;
    }

    public boolean supports(BackendKind kind) {
        return adapters.containsKey(kind);
    }
}
