package com.ryuqq.aiorchestrator.adapter.runner;

import java.time.Duration;

/**
 * DefaultModelOrchestrator 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>failureThreshold: UNAVAILABLE 전환 연속 실패 횟수 (기본 3)</li>
 *   <li>defaultTimeoutMs: 요청에 타임아웃이 없을 때 호출 타임아웃 (기본 60000ms)</li>
 *   <li>dispatchConcurrency: 백엔드 호출 스레드 수 (기본 16)</li>
 *   <li>selectionPolicy: 자동 선택 정렬 정책 (기본 LEAST_PRIVILEGE)</li>
 * </ul>
 *
 * <p><strong>타임아웃 설정 가이드:</strong></p>
 * <ul>
 *   <li>로컬 Ollama 채팅: 60000ms (모델 로딩 포함)</li>
 *   <li>인프로세스 분류기: 1000ms 이하</li>
 *   <li>이미지 분석: 120000ms 이상</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param failureThreshold 연속 실패 임계값 (1 이상)
 * @param defaultTimeoutMs 기본 호출 타임아웃 (밀리초, 양수)
 * @param dispatchConcurrency 백엔드 호출 스레드 수 (1 이상)
 * @param selectionPolicy 자동 선택 정렬 정책 (null 불가)
 */
public record OrchestratorConfig(
    int failureThreshold,
    long defaultTimeoutMs,
    int dispatchConcurrency,
    SelectionPolicy selectionPolicy
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: failureThreshold=3, defaultTimeoutMs=60000ms,
     * dispatchConcurrency=16, selectionPolicy=LEAST_PRIVILEGE</p>
     */
    public OrchestratorConfig() {
        this(3, 60000, 16, SelectionPolicy.LEAST_PRIVILEGE);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public OrchestratorConfig {
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException(
                "failureThreshold must be positive (current: " + failureThreshold + ")"
            );
        }
        if (defaultTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "defaultTimeoutMs must be positive (current: " + defaultTimeoutMs + ")"
            );
        }
        if (dispatchConcurrency <= 0) {
            throw new IllegalArgumentException(
                "dispatchConcurrency must be positive (current: " + dispatchConcurrency + ")"
            );
        }
        if (selectionPolicy == null) {
            throw new IllegalArgumentException("selectionPolicy cannot be null");
        }
    }

    public Duration defaultTimeout() {
        return Duration.ofMillis(defaultTimeoutMs);
    }

    /**
     * failureThreshold만 변경한 새 인스턴스 생성.
     */
    public OrchestratorConfig withFailureThreshold(int failureThreshold) {
        return new OrchestratorConfig(failureThreshold, defaultTimeoutMs, dispatchConcurrency, selectionPolicy);
    }

    /**
     * defaultTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public OrchestratorConfig withDefaultTimeoutMs(long defaultTimeoutMs) {
        return new OrchestratorConfig(failureThreshold, defaultTimeoutMs, dispatchConcurrency, selectionPolicy);
    }

    /**
     * dispatchConcurrency만 변경한 새 인스턴스 생성.
     */
    public OrchestratorConfig withDispatchConcurrency(int dispatchConcurrency) {
        return new OrchestratorConfig(failureThreshold, defaultTimeoutMs, dispatchConcurrency, selectionPolicy);
    }

    /**
     * selectionPolicy만 변경한 새 인스턴스 생성.
     */
    public OrchestratorConfig withSelectionPolicy(SelectionPolicy selectionPolicy) {
        return new OrchestratorConfig(failureThreshold, defaultTimeoutMs, dispatchConcurrency, selectionPolicy);
    }
}
