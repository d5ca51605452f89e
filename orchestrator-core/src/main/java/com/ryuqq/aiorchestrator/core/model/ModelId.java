package com.ryuqq.aiorchestrator.core.model;

import java.util.regex.Pattern;

/**
 * 레지스트리 내 모델 식별자.
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~128자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_), 점(.), 콜론(:)만 허용 (예: llama3.2:latest)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ModelId {

    private static final Pattern VALID_PATTERN = Pattern.compile("^[a-zA-Z0-9\\-_.:]+$");

    private final String value;

    private ModelId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ModelId cannot be null or blank");
        }
        if (value.length() > 128) {
            throw new IllegalArgumentException("ModelId length cannot exceed 128 characters");
        }
        if (!VALID_PATTERN.matcher(value).matches()) {
            throw new IllegalArgumentException(
                "ModelId contains invalid characters. Only alphanumeric, hyphen, underscore, dot and colon are allowed");
        }
        this.value = value;
    }

    /**
     * ModelId 생성.
     *
     * @param value 식별자 값
     * @return ModelId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static ModelId of(String value) {
        return new ModelId(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ModelId modelId = (ModelId) o;
        return value.equals(modelId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "ModelId{" + value + '}';
    }
}
