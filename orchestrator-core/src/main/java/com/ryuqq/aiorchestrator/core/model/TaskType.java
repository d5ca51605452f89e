package com.ryuqq.aiorchestrator.core.model;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 작업 유형 태그 (capability tag).
 *
 * <p>모델이 선언하는 capability와 요청의 task-type hint가 같은 값 공간을 공유합니다.
 * 값은 소문자로 정규화됩니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>TaskType.CHAT - 자유 텍스트 대화</li>
 *   <li>TaskType.CLASSIFY - 분류</li>
 *   <li>TaskType.of("summarize") - 배포별 사용자 정의 태그</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TaskType {

    private static final Pattern VALID_PATTERN = Pattern.compile("^[a-z][a-z0-9_\\-]*$");

    public static final TaskType CHAT = new TaskType("chat");
    public static final TaskType ANALYZE = new TaskType("analyze");
    public static final TaskType GENERATE = new TaskType("generate");
    public static final TaskType CLASSIFY = new TaskType("classify");
    public static final TaskType PREDICT = new TaskType("predict");
    public static final TaskType VISION = new TaskType("vision");
    public static final TaskType CODE_ANALYSIS = new TaskType("code-analysis");

    private final String value;

    private TaskType(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("TaskType cannot be null or blank");
        }
        if (value.length() > 64) {
            throw new IllegalArgumentException("TaskType length cannot exceed 64 characters");
        }
        if (!VALID_PATTERN.matcher(value).matches()) {
            throw new IllegalArgumentException(
                "TaskType must start with a letter and contain only lowercase letters, digits, underscore and hyphen: " + value);
        }
        this.value = value;
    }

    /**
     * TaskType 생성 (소문자 정규화).
     *
     * @param value 태그 값
     * @return TaskType 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static TaskType of(String value) {
        if (value == null) {
            throw new IllegalArgumentException("TaskType cannot be null or blank");
        }
        return new TaskType(value.trim().toLowerCase(Locale.ROOT));
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TaskType taskType = (TaskType) o;
        return value.equals(taskType.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "TaskType{" + value + '}';
    }
}
