package com.ryuqq.aiorchestrator.adapter.backend.ollama;

import com.ryuqq.aiorchestrator.core.contract.QueryParameters;

import java.util.Optional;

/**
 * 사용자 질문을 Ollama 프롬프트로 변환.
 *
 * <p>post_title 또는 post_content 파라미터가 있으면 게시글 제목과 본문 발췌(최대 800자,
 * 잘린 경우 "...")를 질문 앞에 넣습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class PromptBuilder {

    static final int EXCERPT_LENGTH = 800;
    static final String UNTITLED = "Untitled";

    private PromptBuilder() {
    }

    /**
     * 게시글 문맥을 반영한 사용자 프롬프트.
     *
     * @param question 사용자 질문
     * @param parameters 요청 파라미터
     * @return 프롬프트 (게시글 문맥이 없으면 질문 그대로)
     */
    public static String userPrompt(String question, QueryParameters parameters) {
        Optional<String> title = parameters.postTitle();
        Optional<String> content = parameters.postContent();
        if (title.isEmpty() && content.isEmpty()) {
            return question;
        }
        return "You are viewing a blog post titled: \"" + title.orElse(UNTITLED) + "\"\n\n"
            + "Post content excerpt:\n"
            + excerpt(content.orElse("")) + "\n\n"
            + "User question: " + question + "\n\n"
            + "Please answer based on the post content above.";
    }

    /**
     * 본문 발췌.
     *
     * @param content 게시글 본문
     * @return 최대 800자, 잘린 경우 "..." 추가
     */
    public static String excerpt(String content) {
        if (content.length() <= EXCERPT_LENGTH) {
            return content;
        }
        return content.substring(0, EXCERPT_LENGTH) + "...";
    }
}
