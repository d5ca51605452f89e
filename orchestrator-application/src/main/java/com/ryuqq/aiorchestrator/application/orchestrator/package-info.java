/**
 * Orchestrator Application Layer - 질의 라우팅 API.
 *
 * <p>이 패키지는 호출자가 사용하는 단일 진입점을 정의합니다.
 * 구현체는 adapter-runner 모듈에 위치합니다.</p>
 *
 * <h2>핵심 인터페이스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.aiorchestrator.application.orchestrator.ModelOrchestrator} - 질의 실행 조정자</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>헥사고날 아키텍처:</strong> 포트(인터페이스)와 어댑터 분리</li>
 *   <li><strong>명시적 의존성:</strong> 레지스트리와 어댑터는 생성자로 주입되며 전역 인스턴스가 없음</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.aiorchestrator.application.orchestrator;
