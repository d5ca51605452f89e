package com.ryuqq.aiorchestrator.application.catalog;

import com.ryuqq.aiorchestrator.core.model.BackendKind;
import com.ryuqq.aiorchestrator.core.model.HealthState;
import com.ryuqq.aiorchestrator.core.model.ModelDescriptor;
import com.ryuqq.aiorchestrator.core.model.ModelId;
import com.ryuqq.aiorchestrator.core.model.TaskType;
import com.ryuqq.aiorchestrator.core.model.Tier;

import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 모델 목록 항목.
 *
 * <p>조회 시점의 descriptor 스냅샷과 조회 등급 기준의 사용 가능 여부를 묶습니다.</p>
 *
 * <p><strong>두 가지 생성 방식:</strong></p>
 * <ul>
 *   <li>{@link #unchecked(ModelDescriptor)}: 등급 없이 조회 (authorized = false)</li>
 *   <li>{@link #forTier(ModelDescriptor, boolean)}: 등급 기준 조회 결과</li>
 * </ul>
 *
 * <p><strong>불변성:</strong> 생성 후 상태 변경 불가</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ModelView {

    private final ModelDescriptor descriptor;
    private final boolean authorized;

    private ModelView(ModelDescriptor descriptor, boolean authorized) {
        if (descriptor == null) {
            throw new IllegalArgumentException("descriptor cannot be null");
        }
        this.descriptor = descriptor;
        this.authorized = authorized;
    }

    public static ModelView unchecked(ModelDescriptor descriptor) {
        return new ModelView(descriptor, false);
    }

    /**
     * 등급 기준 조회 결과 생성.
     *
     * @param descriptor 모델 descriptor
     * @param authorized 조회 등급으로 사용 가능한지 여부
     * @return ModelView 인스턴스
     */
    public static ModelView forTier(ModelDescriptor descriptor, boolean authorized) {
        return new ModelView(descriptor, authorized);
    }

    public ModelId getModelId() {
        return descriptor.id();
    }

    public BackendKind getBackendKind() {
        return descriptor.backendKind();
    }

    public Tier getRequiredTier() {
        return descriptor.requiredTier();
    }

    public Set<TaskType> getCapabilities() {
        return descriptor.capabilities();
    }

    public HealthState getHealthState() {
        return descriptor.healthState();
    }

    public Map<String, Object> getMetadata() {
        return descriptor.metadata();
    }

    public boolean isAuthorized() {
        return authorized;
    }

    /**
     * 메타데이터의 description 값 (없으면 모델 식별자).
     */
    public String getDescription() {
        Object description = descriptor.metadata().get("description");
        return description == null ? descriptor.id().getValue() : description.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ModelView that = (ModelView) o;
        return authorized == that.authorized && descriptor.equals(that.descriptor);
    }

    @Override
    public int hashCode() {
        return Objects.hash(descriptor, authorized);
    }

    @Override
    public String toString() {
        return "ModelView{" +
            "modelId=" + descriptor.id().getValue() +
            ", backendKind=" + descriptor.backendKind().wireName() +
            ", requiredTier=" + descriptor.requiredTier() +
            ", health=" + descriptor.healthState() +
            ", authorized=" + authorized +
            '}';
    }
}
