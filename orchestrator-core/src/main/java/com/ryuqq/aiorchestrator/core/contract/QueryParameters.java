package com.ryuqq.aiorchestrator.core.contract;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 요청 파라미터 (옵션 이름 → 값).
 *
 * <p>원본 맵을 그대로 보관하고, 타입이 지정된 조회 메서드를 제공합니다.
 * 이름/타입/범위 검증은 {@code SchemaValidator.validateParameters}가 수행합니다.
 * 검증을 통과한 파라미터에 대해서만 조회 메서드가 의미 있는 값을 반환합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class QueryParameters {

    private static final QueryParameters EMPTY = new QueryParameters(Collections.emptyMap());

    private final Map<String, Object> values;

    private QueryParameters(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static QueryParameters empty() {
        return EMPTY;
    }

    /**
     * QueryParameters 생성.
     *
     * @param values 옵션 이름 → 값 (null이면 빈 파라미터)
     * @return QueryParameters 인스턴스
     */
    public static QueryParameters of(Map<String, Object> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        return new QueryParameters(values);
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public double temperature() {
        Object value = values.get(QueryOption.TEMPERATURE.key());
        return value instanceof Number ? ((Number) value).doubleValue() : QueryOption.DEFAULT_TEMPERATURE;
    }

    public int maxTokens() {
        Object value = values.get(QueryOption.MAX_TOKENS.key());
        return value instanceof Number ? ((Number) value).intValue() : QueryOption.DEFAULT_MAX_TOKENS;
    }

    public Optional<String> systemPrompt() {
        return stringValue(QueryOption.SYSTEM_PROMPT);
    }

    public Optional<String> postTitle() {
        return stringValue(QueryOption.POST_TITLE);
    }

    public Optional<String> postContent() {
        return stringValue(QueryOption.POST_CONTENT);
    }

    private Optional<String> stringValue(QueryOption option) {
        Object value = values.get(option.key());
        return value instanceof String ? Optional.of((String) value) : Optional.empty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return values.equals(((QueryParameters) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "QueryParameters" + values;
    }
}
