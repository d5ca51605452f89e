package com.ryuqq.aiorchestrator.core.exception;

/**
 * 호출자에게 노출되는 오류 종류.
 *
 * <p>모든 실패는 이 중 하나로 분류되며, 일반적인(untyped) 실패로 노출되지 않습니다.
 * 어댑터 내부 오류({@link AdapterException})는 오케스트레이터가 이 중 하나로 재분류합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ErrorKind {

    /** 명시한 모델 식별자가 등록되어 있지 않음. */
    UNKNOWN_MODEL("MODEL-404"),

    /** 이미 등록된 식별자로 등록 시도. */
    DUPLICATE_MODEL("MODEL-409"),

    /** 호출자 등급이 모델 요구 등급보다 낮음. */
    PERMISSION_DENIED("TIER-403"),

    /** 자동 선택 결과 capability와 권한을 모두 만족하는 후보가 없음. */
    NO_AUTHORIZED_MODEL("ROUTE-404"),

    /** 백엔드가 일시적 또는 영구적으로 사용 불가. */
    BACKEND_UNAVAILABLE("BACKEND-503"),

    /** 요청 또는 응답 payload가 정규 형태와 불일치. */
    SCHEMA_VALIDATION("SCHEMA-400");

    private final String code;

    ErrorKind(String code) {
        this.code = code;
    }

    /**
     * 안정적인 오류 코드.
     *
     * @return 오류 코드 (예: TIER-403)
     */
    public String code() {
        return code;
    }
}
