package com.ryuqq.aiorchestrator.adapter.runner;

import com.ryuqq.aiorchestrator.core.model.ModelDescriptor;
import com.ryuqq.aiorchestrator.core.schema.DescriptorSchema;
import com.ryuqq.aiorchestrator.core.spi.ModelRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 배포 설정 목록으로 레지스트리 초기화.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. 모든 항목을 DescriptorSchema로 검증/변환 (하나라도 실패하면 아무것도 등록하지 않음)
 * 2. 목록 순서대로 register (등록 순서 = 동률 시 선택 우선순위)
 * </pre>
 *
 * <p>중복 식별자는 register 단계에서 DuplicateModelException으로 실패하며,
 * 그 이전 항목들은 등록된 상태로 남습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RegistryBootstrap {

    private static final Logger log = LoggerFactory.getLogger(RegistryBootstrap.class);

    private final ModelRegistry registry;

    public RegistryBootstrap(ModelRegistry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        this.registry = registry;
    }

    /**
     * 항목 목록 등록.
     *
     * @param entries 설정 항목 (id, backendKind, requiredTier, capabilities, metadata)
     * @return 등록된 descriptor 목록 (입력 순서)
     * @throws com.ryuqq.aiorchestrator.core.exception.SchemaValidationException 항목 형식 오류
     * @throws com.ryuqq.aiorchestrator.core.exception.DuplicateModelException 중복 식별자
     */
    public List<ModelDescriptor> registerAll(List<? extends Map<String, ?>> entries) {
        if (entries == null) {
            throw new IllegalArgumentException("entries cannot be null");
        }
        List<ModelDescriptor> descriptors = new ArrayList<>(entries.size());
        for (Map<String, ?> entry : entries) {
            descriptors.add(DescriptorSchema.fromEntry(entry));
        }
        for (ModelDescriptor descriptor : descriptors) {
            registry.register(descriptor);
        }
        log.info("Registry bootstrap completed: {} models registered", descriptors.size());
        return descriptors;
    }
}
