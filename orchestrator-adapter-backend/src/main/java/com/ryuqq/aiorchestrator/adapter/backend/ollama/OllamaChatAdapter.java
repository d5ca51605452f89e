package com.ryuqq.aiorchestrator.adapter.backend.ollama;

import com.ryuqq.aiorchestrator.core.contract.QueryRequest;
import com.ryuqq.aiorchestrator.core.exception.AdapterException;
import com.ryuqq.aiorchestrator.core.model.BackendKind;
import com.ryuqq.aiorchestrator.core.model.Message;
import com.ryuqq.aiorchestrator.core.model.ModelDescriptor;
import com.ryuqq.aiorchestrator.core.result.ChatResult;
import com.ryuqq.aiorchestrator.core.result.ResultPayload;

import java.util.ArrayList;
import java.util.List;

/**
 * general-model 어댑터 (Ollama /api/chat).
 *
 * <p>system_prompt가 있으면 system 메시지로, 질문은 게시글 문맥을 반영해 user 메시지로 보냅니다.
 * temperature와 max_tokens는 options.temperature, options.num_predict로 전달됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class OllamaChatAdapter extends OllamaBackendAdapter {

    static final String CHAT_PATH = "/api/chat";

    public OllamaChatAdapter(OllamaClient client) {
        super(client);
    }

    @Override
    public BackendKind backendKind() {
        return BackendKind.GENERAL_MODEL;
    }

    @Override
    public ResultPayload invoke(ModelDescriptor descriptor, QueryRequest request) throws AdapterException {
        List<OllamaChatRequest.Message> messages = new ArrayList<>(2);
        request.parameters().systemPrompt()
            .ifPresent(system -> messages.add(new OllamaChatRequest.Message("system", system)));
        messages.add(new OllamaChatRequest.Message("user",
            PromptBuilder.userPrompt(request.input().promptText(), request.parameters())));

        OllamaChatRequest body = new OllamaChatRequest(backendModel(descriptor), messages,
            options(request.parameters()));
        OllamaChatResponse response = client.post(CHAT_PATH, body, OllamaChatResponse.class);

        if (response.getMessage() == null || response.getMessage().getContent() == null) {
            throw AdapterException.malformedResponse("Ollama chat response has no message content", null);
        }
        return new ChatResult(
            Message.fromAi(response.getMessage().getContent().trim()),
            response.getPromptEvalCount() == null ? 0 : response.getPromptEvalCount(),
            response.getEvalCount() == null ? 0 : response.getEvalCount()
        );
    }
}
