/**
 * Runner Adapter Layer - ModelOrchestrator 구현체.
 *
 * <p>이 패키지는 application 레이어 인터페이스의 구체적인 구현체와
 * 선택, 실패 추적, 복구 컴포넌트를 포함합니다.</p>
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.aiorchestrator.adapter.runner.DefaultModelOrchestrator} - 질의 라우팅 및 폴백</li>
 *   <li>{@link com.ryuqq.aiorchestrator.adapter.runner.RegistryModelCatalog} - 모델 목록 조회</li>
 *   <li>{@link com.ryuqq.aiorchestrator.adapter.runner.ManualRecoveryPolicy},
 *       {@link com.ryuqq.aiorchestrator.adapter.runner.IntervalProbePolicy} - 복구 정책</li>
 * </ul>
 *
 * <h2>지원 컴포넌트</h2>
 * <ul>
 *   <li>{@link com.ryuqq.aiorchestrator.adapter.runner.ModelSelector} - 명시적/자동 선택</li>
 *   <li>{@link com.ryuqq.aiorchestrator.adapter.runner.FailureTracker} - 연속 실패 카운터</li>
 *   <li>{@link com.ryuqq.aiorchestrator.adapter.runner.HealthMonitor} - UNAVAILABLE 모델 복구 스캔</li>
 *   <li>{@link com.ryuqq.aiorchestrator.adapter.runner.RegistryBootstrap} - 설정 목록 등록</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (DefaultModelOrchestrator, HealthMonitor)
 *   ↓ implements
 * application (ModelOrchestrator, ModelCatalog, HealthRecoveryPolicy)
 *   ↓ depends on
 * core (ModelDescriptor, QueryRequest, QueryResponse, Outcome, SchemaValidator)
 *   ↓ depends on
 * core/spi (ModelRegistry, BackendAdapter, InteractionLog)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.aiorchestrator.adapter.runner;
