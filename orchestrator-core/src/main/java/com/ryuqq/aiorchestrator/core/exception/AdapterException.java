package com.ryuqq.aiorchestrator.core.exception;

/**
 * 백엔드 어댑터의 정규화된 실패.
 *
 * <p>어댑터는 백엔드 고유 예외(IOException, HTTP 오류 등)를 경계 밖으로 내보내지 않고
 * 이 예외로 변환해야 합니다. 호출자에게 직접 노출되지 않으며,
 * 오케스트레이터가 {@link ErrorKind} 중 하나로 재분류합니다.</p>
 *
 * <ul>
 *   <li>{@link Failure#TRANSIENT}: 타임아웃, 연결 실패, 5xx - 상태 정책 및 1회 재선택 대상</li>
 *   <li>{@link Failure#PERMANENT}: 백엔드가 요청을 거부함 - 재시도 없음</li>
 *   <li>{@link Failure#MALFORMED_RESPONSE}: 응답을 정규 형태로 변환할 수 없음</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class AdapterException extends Exception {

    /**
     * 실패 분류.
     */
    public enum Failure {
        TRANSIENT,
        PERMANENT,
        MALFORMED_RESPONSE
    }

    private final Failure failure;

    public AdapterException(Failure failure, String message, Throwable cause) {
        super(message, cause);
        if (failure == null) {
            throw new IllegalArgumentException("failure cannot be null");
        }
        this.failure = failure;
    }

    public static AdapterException transientFailure(String message, Throwable cause) {
        return new AdapterException(Failure.TRANSIENT, message, cause);
    }

    public static AdapterException permanentFailure(String message, Throwable cause) {
        return new AdapterException(Failure.PERMANENT, message, cause);
    }

    public static AdapterException malformedResponse(String message, Throwable cause) {
        return new AdapterException(Failure.MALFORMED_RESPONSE, message, cause);
    }

    public Failure failure() {
        return failure;
    }

    public boolean isTransient() {
        return failure == Failure.TRANSIENT;
    }
}
