package com.ryuqq.aiorchestrator.core.contract;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 요청 원본 입력.
 *
 * <p>자유 텍스트({@link Text}) 또는 구조화 payload({@link Structured}) 중 하나입니다.
 * 작업 유형 hint가 없으면 오케스트레이터는 입력 형태로 기본 작업 유형을 추론합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface QueryInput permits QueryInput.Text, QueryInput.Structured {

    /**
     * 입력 길이 (상호작용 로그용).
     *
     * @return 텍스트 길이 또는 구조화 필드 수
     */
    int length();

    /**
     * 모델에 전달할 텍스트 표현.
     *
     * @return 프롬프트 텍스트 (없으면 빈 문자열)
     */
    String promptText();

    static QueryInput text(String text) {
        return new Text(text);
    }

    static QueryInput structured(Map<String, Object> fields) {
        return new Structured(fields);
    }

    /**
     * 자유 텍스트 입력.
     *
     * @param value 텍스트
     */
    record Text(String value) implements QueryInput {

        @Override
        public int length() {
            return value == null ? 0 : value.length();
        }

        @Override
        public String promptText() {
            return value == null ? "" : value;
        }
    }

    /**
     * 구조화 입력 (예: {"image": base64, "prompt": "..."}).
     *
     * @param fields 필드 맵 (입력 순서 유지)
     */
    record Structured(Map<String, Object> fields) implements QueryInput {

        public static final String PROMPT_FIELD = "prompt";

        public Structured {
            fields = fields == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        }

        public boolean has(String key) {
            return fields.get(key) != null;
        }

        @Override
        public int length() {
            return fields.size();
        }

        @Override
        public String promptText() {
            Object prompt = fields.get(PROMPT_FIELD);
            return prompt == null ? "" : prompt.toString();
        }
    }
}
