package com.ryuqq.aiorchestrator.core.outcome;

import com.ryuqq.aiorchestrator.core.contract.QueryResponse;

/**
 * 성공 결과.
 *
 * @param response 정규 응답
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Ok(
    QueryResponse response
) implements Outcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException response가 null인 경우
     */
    public Ok {
        if (response == null) {
            throw new IllegalArgumentException("response cannot be null");
        }
    }
}
