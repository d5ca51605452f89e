package com.ryuqq.aiorchestrator.core.outcome;

import com.ryuqq.aiorchestrator.core.exception.ErrorKind;
import com.ryuqq.aiorchestrator.core.exception.OrchestrationException;

/**
 * 실패 결과.
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>권한 없음 (TIER-403)</li>
 *   <li>모델 없음 (MODEL-404)</li>
 *   <li>백엔드 장애 (BACKEND-503)</li>
 * </ul>
 *
 * @param kind 오류 종류
 * @param message 오류 메시지
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Fail(
    ErrorKind kind,
    String message
) implements Outcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException kind가 null이거나 message가 null/blank인 경우
     */
    public Fail {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }

    /**
     * 예외로부터 Fail 생성.
     *
     * @param exception 오케스트레이션 예외
     * @return Fail 인스턴스
     */
    public static Fail from(OrchestrationException exception) {
        if (exception == null) {
            throw new IllegalArgumentException("exception cannot be null");
        }
        String message = exception.getMessage();
        return new Fail(exception.kind(), message == null || message.isBlank() ? exception.kind().name() : message);
    }

    public String errorCode() {
        return kind.code();
    }
}
