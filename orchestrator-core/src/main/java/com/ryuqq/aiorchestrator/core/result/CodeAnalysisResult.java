package com.ryuqq.aiorchestrator.core.result;

import com.ryuqq.aiorchestrator.core.model.BackendKind;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * 코드 분석 결과.
 *
 * @param issues 발견된 문제
 * @param suggestions 개선 제안
 * @param qualityScore 품질 점수 (0~100)
 * @param complexity 복잡도
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record CodeAnalysisResult(
    List<String> issues,
    List<String> suggestions,
    double qualityScore,
    Complexity complexity
) implements ResultPayload {

    /**
     * 코드 복잡도 등급.
     */
    public enum Complexity {
        LOW,
        MEDIUM,
        HIGH;

        /**
         * 이름으로 조회 (대소문자 무시).
         *
         * @param value 이름 (예: "medium")
         * @return Complexity 또는 empty
         */
        public static Optional<Complexity> fromName(String value) {
            if (value == null) {
                return Optional.empty();
            }
            try {
                return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                return Optional.empty();
            }
        }
    }

    public CodeAnalysisResult {
        issues = issues == null ? List.of() : List.copyOf(issues);
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    @Override
    public BackendKind backendKind() {
        return BackendKind.CODE_ANALYSIS;
    }
}
