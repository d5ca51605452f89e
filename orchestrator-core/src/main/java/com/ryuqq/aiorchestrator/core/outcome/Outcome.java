package com.ryuqq.aiorchestrator.core.outcome;

/**
 * 질의 실행 결과.
 *
 * <p>Outcome은 두 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Ok}: 정규 응답과 함께 성공</li>
 *   <li>{@link Fail}: 오류 종류와 메시지를 가진 실패</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 다른 결과 형태가 존재하지 않음을 보장합니다.
 * 호출자는 반드시 성공/실패 여부를 명시적으로 확인하게 됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
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
public sealed interface Outcome permits Ok, Fail {

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isOk() {
        return this instanceof Ok;
    }

    /**
     * 결과가 실패인지 확인.
     *
     * @return 실패 여부
     */
    default boolean isFail() {
        return this instanceof Fail;
    }
}
