package com.ryuqq.aiorchestrator.core.result;

import com.ryuqq.aiorchestrator.core.model.BackendKind;

import java.util.List;

/**
 * 이미지 분석 결과.
 *
 * @param description 이미지 설명
 * @param labels 감지된 패턴/레이블
 * @param extractedText OCR 텍스트 (없으면 null)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record VisionResult(
    String description,
    List<String> labels,
    String extractedText
) implements ResultPayload {

    public VisionResult {
        labels = labels == null ? List.of() : List.copyOf(labels);
    }

    @Override
    public BackendKind backendKind() {
        return BackendKind.VISION;
    }
}
