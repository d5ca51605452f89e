package com.ryuqq.aiorchestrator.core.exception;

/**
 * 오케스트레이션 오류의 공통 상위 타입.
 *
 * <p>모든 하위 타입은 {@link ErrorKind}를 하나씩 가지며,
 * 호출자는 {@link #kind()}로 분기하거나 구체 타입으로 catch할 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class OrchestrationException extends RuntimeException {

    private final ErrorKind kind;

    protected OrchestrationException(ErrorKind kind, String message) {
        this(kind, message, null);
    }

    protected OrchestrationException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    public String errorCode() {
        return kind.code();
    }
}
