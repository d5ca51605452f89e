package com.ryuqq.aiorchestrator.adapter.runner;

/**
 * 자동 선택 시 후보 정렬 정책.
 *
 * <p>두 정책 모두 health rank가 1순위입니다 (HEALTHY &gt; DEGRADED). 차이는 등급 정렬 방향입니다.</p>
 *
 * <p><strong>예시:</strong> A(tier 0, chat), B(tier 2, chat) 등록 상태</p>
 * <ul>
 *   <li>LEAST_PRIVILEGE: tier 1 호출자 → A, tier 3 호출자 → A</li>
 *   <li>REGISTRY_ORDER: tier 1 호출자 → A, tier 3 호출자 → B</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum SelectionPolicy {

    /**
     * 요구 등급이 가장 낮은 모델 우선 (health rank, 요구 등급 오름차순, 등록 순서).
     */
    LEAST_PRIVILEGE,

    /**
     * 레지스트리 capability 정렬 그대로 (health rank, 요구 등급 내림차순, 등록 순서).
     */
    REGISTRY_ORDER
}
