package com.ryuqq.aiorchestrator.core.model;

import java.util.Optional;

/**
 * 모델 런타임 종류.
 *
 * <p>닫힌 집합이며, 종류마다 정확히 하나의 BackendAdapter와 하나의 결과 payload 형태가 대응됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum BackendKind {

    /** 범용 언어 모델 (채팅, 생성). */
    GENERAL_MODEL("general-model"),

    /** 학습된 신경망 분류기. */
    CLASSIFIER("classifier"),

    /** 이미지 분석 모델. */
    VISION("vision"),

    /** 코드 분석 모델. */
    CODE_ANALYSIS("code-analysis");

    private final String wireName;

    BackendKind(String wireName) {
        this.wireName = wireName;
    }

    /**
     * 설정 목록에서 사용하는 이름.
     *
     * @return wire name (예: "general-model")
     */
    public String wireName() {
        return wireName;
    }

    /**
     * wire name 또는 enum 이름으로 조회.
     *
     * @param value 이름 (예: "classifier", "CODE_ANALYSIS")
     * @return 해당 BackendKind 또는 empty (알 수 없는 값)
     */
    public static Optional<BackendKind> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        for (BackendKind kind : values()) {
            if (kind.wireName.equalsIgnoreCase(trimmed) || kind.name().equalsIgnoreCase(trimmed)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
