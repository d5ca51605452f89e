package com.ryuqq.aiorchestrator.core.spi;

import com.ryuqq.aiorchestrator.core.exception.ErrorKind;
import com.ryuqq.aiorchestrator.core.model.ModelId;
import com.ryuqq.aiorchestrator.core.model.Tier;

import java.time.Duration;
import java.time.Instant;

/**
 * 질의 1건의 사용 기록.
 *
 * <p>프롬프트 본문은 저장하지 않고 길이만 기록합니다.</p>
 *
 * @param timestamp 요청 수락 시각
 * @param modelId 선택된 모델 (선택 전에 실패했으면 null)
 * @param callerTier 호출자 등급 (요청 검증 실패 시 null 가능)
 * @param inputLength 입력 길이
 * @param success 성공 여부
 * @param errorKind 실패 종류 (성공 시 null)
 * @param elapsed 소요 시간
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record InteractionRecord(
    Instant timestamp,
    ModelId modelId,
    Tier callerTier,
    int inputLength,
    boolean success,
    ErrorKind errorKind,
    Duration elapsed
) {

    public InteractionRecord {
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
        if (elapsed == null) {
            throw new IllegalArgumentException("elapsed cannot be null");
        }
        if (success && errorKind != null) {
            throw new IllegalArgumentException("successful interaction cannot carry an errorKind");
        }
        if (!success && errorKind == null) {
            throw new IllegalArgumentException("failed interaction must carry an errorKind");
        }
    }
}
