package com.ryuqq.aiorchestrator.adapter.backend.ollama;

import com.ryuqq.aiorchestrator.core.contract.QueryInput;
import com.ryuqq.aiorchestrator.core.contract.QueryRequest;
import com.ryuqq.aiorchestrator.core.exception.AdapterException;
import com.ryuqq.aiorchestrator.core.model.BackendKind;
import com.ryuqq.aiorchestrator.core.model.ModelDescriptor;
import com.ryuqq.aiorchestrator.core.result.ResultPayload;
import com.ryuqq.aiorchestrator.core.result.VisionResult;

import java.util.Base64;
import java.util.List;

/**
 * vision 어댑터 (Ollama /api/generate, base64 images).
 *
 * <p>구조화 입력의 {@code image} 필드는 base64 문자열 또는 byte[]이어야 합니다.
 * 이미지 없는 요청은 백엔드가 처리할 수 없으므로 영구 실패입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class OllamaVisionAdapter extends OllamaBackendAdapter {

    static final String GENERATE_PATH = "/api/generate";
    static final String IMAGE_FIELD = "image";
    static final String DEFAULT_PROMPT = "Describe this image in detail.";

    public OllamaVisionAdapter(OllamaClient client) {
        super(client);
    }

    @Override
    public BackendKind backendKind() {
        return BackendKind.VISION;
    }

    @Override
    public ResultPayload invoke(ModelDescriptor descriptor, QueryRequest request) throws AdapterException {
        if (!(request.input() instanceof QueryInput.Structured)) {
            throw AdapterException.permanentFailure("vision request requires structured input with an image", null);
        }
        QueryInput.Structured input = (QueryInput.Structured) request.input();
        String image = encodeImage(input.fields().get(IMAGE_FIELD));
        String prompt = input.promptText().isBlank() ? DEFAULT_PROMPT : input.promptText();

        OllamaGenerateRequest body = new OllamaGenerateRequest(backendModel(descriptor), prompt, List.of(image),
            null, options(request.parameters()));
        OllamaGenerateResponse response = client.post(GENERATE_PATH, body, OllamaGenerateResponse.class);

        if (response.getResponse() == null || response.getResponse().isBlank()) {
            throw AdapterException.malformedResponse("Ollama vision response has no description", null);
        }
        return new VisionResult(response.getResponse().trim(), List.of(), null);
    }

    private static String encodeImage(Object image) throws AdapterException {
        if (image instanceof byte[]) {
            return Base64.getEncoder().encodeToString((byte[]) image);
        }
        if (image instanceof String && !((String) image).isBlank()) {
            return ((String) image).trim();
        }
        throw AdapterException.permanentFailure("image must be base64 text or bytes", null);
    }
}
