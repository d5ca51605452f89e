package com.ryuqq.aiorchestrator.core.contract;

import java.util.Optional;

/**
 * 인식되는 요청 파라미터 이름.
 *
 * <p>정의되지 않은 이름이나 잘못된 타입의 값은 SchemaValidator가 거부합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum QueryOption {

    /** 샘플링 온도 (0.0~2.0, 기본 0.7). */
    TEMPERATURE("temperature", Double.class),

    /** 최대 생성 토큰 수 (1~32768, 기본 300). */
    MAX_TOKENS("max_tokens", Integer.class),

    /** 시스템 프롬프트. */
    SYSTEM_PROMPT("system_prompt", String.class),

    /** 대화 맥락 게시글 제목. */
    POST_TITLE("post_title", String.class),

    /** 대화 맥락 게시글 본문. */
    POST_CONTENT("post_content", String.class);

    public static final double DEFAULT_TEMPERATURE = 0.7;
    public static final int DEFAULT_MAX_TOKENS = 300;

    private final String key;
    private final Class<?> valueType;

    QueryOption(String key, Class<?> valueType) {
        this.key = key;
        this.valueType = valueType;
    }

    public String key() {
        return key;
    }

    public Class<?> valueType() {
        return valueType;
    }

    public static Optional<QueryOption> fromKey(String key) {
        for (QueryOption option : values()) {
            if (option.key.equals(key)) {
                return Optional.of(option);
            }
        }
        return Optional.empty();
    }
}
