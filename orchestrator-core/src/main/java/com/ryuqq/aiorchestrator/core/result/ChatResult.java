package com.ryuqq.aiorchestrator.core.result;

import com.ryuqq.aiorchestrator.core.model.BackendKind;
import com.ryuqq.aiorchestrator.core.model.Message;

/**
 * 범용 언어 모델의 응답.
 *
 * @param message AI 응답 메시지
 * @param promptTokens 프롬프트 토큰 수 (알 수 없으면 0)
 * @param completionTokens 생성 토큰 수 (알 수 없으면 0)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ChatResult(
    Message message,
    long promptTokens,
    long completionTokens
) implements ResultPayload {

    /**
     * 토큰 정보 없이 생성.
     *
     * @param content 응답 본문
     * @return ChatResult 인스턴스
     */
    public static ChatResult of(String content) {
        return new ChatResult(Message.fromAi(content), 0, 0);
    }

    @Override
    public BackendKind backendKind() {
        return BackendKind.GENERAL_MODEL;
    }
}
