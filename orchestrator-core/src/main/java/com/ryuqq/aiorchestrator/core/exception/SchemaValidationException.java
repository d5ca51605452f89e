package com.ryuqq.aiorchestrator.core.exception;

/**
 * 요청/응답 payload가 정규 형태와 일치하지 않음.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class SchemaValidationException extends OrchestrationException {

    private final String field;

    public SchemaValidationException(String field, String message) {
        super(ErrorKind.SCHEMA_VALIDATION, field == null ? message : field + ": " + message);
        this.field = field;
    }

    /**
     * 위반 필드 (payload 전체 위반이면 null).
     */
    public String field() {
        return field;
    }
}
