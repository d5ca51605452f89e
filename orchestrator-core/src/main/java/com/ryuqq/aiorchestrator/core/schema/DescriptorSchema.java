package com.ryuqq.aiorchestrator.core.schema;

import com.ryuqq.aiorchestrator.core.exception.SchemaValidationException;
import com.ryuqq.aiorchestrator.core.model.BackendKind;
import com.ryuqq.aiorchestrator.core.model.HealthState;
import com.ryuqq.aiorchestrator.core.model.ModelDescriptor;
import com.ryuqq.aiorchestrator.core.model.ModelId;
import com.ryuqq.aiorchestrator.core.model.TaskType;
import com.ryuqq.aiorchestrator.core.model.Tier;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * 배포 설정 목록의 항목(맵)을 {@link ModelDescriptor}로 변환하는 스키마.
 *
 * <p>파일 형식 파싱은 하지 않습니다. 호출자가 YAML/JSON 등을 맵으로 읽은 뒤 전달합니다.</p>
 *
 * <p><strong>항목 형식:</strong></p>
 * <pre>
 * {
 *   "id": "llama2",
 *   "backendKind": "general-model",          // general-model | classifier | vision | code-analysis
 *   "requiredTier": 1,                       // 0~4 또는 "BASIC"
 *   "capabilities": ["chat", "analyze"],
 *   "metadata": {"context_window": 4096}     // 선택
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class DescriptorSchema {

    public static final String FIELD_ID = "id";
    public static final String FIELD_BACKEND_KIND = "backendKind";
    public static final String FIELD_REQUIRED_TIER = "requiredTier";
    public static final String FIELD_CAPABILITIES = "capabilities";
    public static final String FIELD_METADATA = "metadata";

    private DescriptorSchema() {
    }

    /**
     * 설정 항목을 검증하고 HEALTHY 상태의 descriptor로 변환.
     *
     * @param entry 설정 항목
     * @return ModelDescriptor
     * @throws SchemaValidationException 필드 누락, 타입 오류, 알 수 없는 enum 값
     */
    public static ModelDescriptor fromEntry(Map<String, ?> entry) {
        if (entry == null) {
            throw new SchemaValidationException(null, "registration entry is missing");
        }

        ModelId id = parseId(entry.get(FIELD_ID));
        BackendKind kind = parseBackendKind(entry.get(FIELD_BACKEND_KIND));
        Tier tier = parseTier(entry.get(FIELD_REQUIRED_TIER));
        Set<TaskType> capabilities = parseCapabilities(entry.get(FIELD_CAPABILITIES));
        Map<String, Object> metadata = parseMetadata(entry.get(FIELD_METADATA));

        return SchemaValidator.validateDescriptor(
            new ModelDescriptor(id, kind, tier, capabilities, HealthState.HEALTHY, metadata));
    }

    private static ModelId parseId(Object raw) {
        if (!(raw instanceof String)) {
            throw new SchemaValidationException(FIELD_ID, raw == null ? "is required" : "must be a string");
        }
        try {
            return ModelId.of((String) raw);
        } catch (IllegalArgumentException e) {
            throw new SchemaValidationException(FIELD_ID, e.getMessage());
        }
    }

    private static BackendKind parseBackendKind(Object raw) {
        if (!(raw instanceof String)) {
            throw new SchemaValidationException(FIELD_BACKEND_KIND, raw == null ? "is required" : "must be a string");
        }
        return BackendKind.fromWireName((String) raw)
            .orElseThrow(() -> new SchemaValidationException(FIELD_BACKEND_KIND, "unknown backend kind: " + raw));
    }

    private static Tier parseTier(Object raw) {
        if (raw == null) {
            throw new SchemaValidationException(FIELD_REQUIRED_TIER, "is required");
        }
        if (raw instanceof Integer || raw instanceof Long || raw instanceof Short) {
            int level = ((Number) raw).intValue();
            return Tier.fromLevel(level)
                .orElseThrow(() -> new SchemaValidationException(FIELD_REQUIRED_TIER, "unknown tier level: " + level));
        }
        if (raw instanceof String) {
            return Tier.fromName((String) raw)
                .orElseThrow(() -> new SchemaValidationException(FIELD_REQUIRED_TIER, "unknown tier name: " + raw));
        }
        throw new SchemaValidationException(FIELD_REQUIRED_TIER, "must be an integer level or a tier name");
    }

    private static Set<TaskType> parseCapabilities(Object raw) {
        if (!(raw instanceof Collection)) {
            throw new SchemaValidationException(FIELD_CAPABILITIES, raw == null ? "is required" : "must be a list");
        }
        Set<TaskType> capabilities = new LinkedHashSet<>();
        for (Object tag : (Collection<?>) raw) {
            if (!(tag instanceof String)) {
                throw new SchemaValidationException(FIELD_CAPABILITIES, "every capability must be a string");
            }
            try {
                capabilities.add(TaskType.of((String) tag));
            } catch (IllegalArgumentException e) {
                throw new SchemaValidationException(FIELD_CAPABILITIES, e.getMessage());
            }
        }
        return capabilities;
    }

    private static Map<String, Object> parseMetadata(Object raw) {
        if (raw == null) {
            return Map.of();
        }
        if (!(raw instanceof Map)) {
            throw new SchemaValidationException(FIELD_METADATA, "must be a map");
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        for (Map.Entry<?, ?> e : ((Map<?, ?>) raw).entrySet()) {
            if (!(e.getKey() instanceof String)) {
                throw new SchemaValidationException(FIELD_METADATA, "keys must be strings");
            }
            metadata.put((String) e.getKey(), e.getValue());
        }
        return metadata;
    }
}
