package com.ryuqq.aiorchestrator.core.model;

import java.time.Instant;

/**
 * 채팅/토론 공통 메시지.
 *
 * @param sender 발신자 역할
 * @param content 본문 (빈 문자열 허용, null 불가는 SchemaValidator가 검증)
 * @param timestamp 생성 시각
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Message(
    Sender sender,
    String content,
    Instant timestamp
) {

    /**
     * 메시지 발신자 역할.
     */
    public enum Sender {
        USER,
        AI,
        SYSTEM
    }

    public Message {
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }

    /**
     * 현재 시각의 AI 메시지 생성.
     *
     * @param content 본문
     * @return Message 인스턴스
     */
    public static Message fromAi(String content) {
        return new Message(Sender.AI, content, Instant.now());
    }
}
