package com.ryuqq.aiorchestrator.application.orchestrator;

import com.ryuqq.aiorchestrator.core.contract.QueryRequest;
import com.ryuqq.aiorchestrator.core.contract.QueryResponse;
import com.ryuqq.aiorchestrator.core.outcome.Outcome;

/**
 * 질의 라우팅 및 실행 조정자.
 *
 * <p>요청을 검증하고, 명시적 선택 또는 자동 선택으로 모델을 결정한 뒤
 * 해당 백엔드 어댑터로 위임합니다. 부분 결과를 반환하지 않습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * // 예외 기반
 * QueryResponse response = orchestrator.query(QueryRequest.of("What is 2+2?", Tier.BASIC));
 *
 * // 값 기반
 * Outcome outcome = orchestrator.submit(request);
 * if (outcome instanceof Ok ok) {
 *     render(ok.response());
 * } else if (outcome instanceof Fail fail) {
 *     showError(fail.errorCode(), fail.message());
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ModelOrchestrator {

    /**
     * 질의 실행.
     *
     * <p><strong>동작 방식:</strong></p>
     * <ol>
     *   <li>요청 검증 (SchemaValidator)</li>
     *   <li>모델 결정: 명시적 선택이면 lookup + 권한 검사, 아니면 작업 유형 기반 자동 선택</li>
     *   <li>backend kind에 대응하는 어댑터로 위임 (호출 타임아웃 적용)</li>
     *   <li>결과 payload 검증 후 응답 생성</li>
     *   <li>자동 선택에서 일시적 실패 시 실패 모델을 제외하고 1회 재선택</li>
     * </ol>
     *
     * @param request 질의 요청
     * @return 검증된 응답
     * @throws com.ryuqq.aiorchestrator.core.exception.SchemaValidationException 요청 또는 결과 형태 오류
     * @throws com.ryuqq.aiorchestrator.core.exception.UnknownModelException 명시한 모델이 없음
     * @throws com.ryuqq.aiorchestrator.core.exception.PermissionDeniedException 등급 부족
     * @throws com.ryuqq.aiorchestrator.core.exception.NoAuthorizedModelException 자동 선택 후보 없음
     * @throws com.ryuqq.aiorchestrator.core.exception.BackendUnavailableException 백엔드 실패
     */
    QueryResponse query(QueryRequest request);

    /**
     * 질의 실행 후 결과를 값으로 반환.
     *
     * <p>{@link #query(QueryRequest)}와 같은 규칙을 따르되, 오케스트레이션 오류를
     * {@link com.ryuqq.aiorchestrator.core.outcome.Fail}로 변환합니다.</p>
     *
     * @param request 질의 요청
     * @return Ok(response) 또는 Fail(kind, message)
     */
    Outcome submit(QueryRequest request);
}
