package com.ryuqq.aiorchestrator.adapter.backend.ollama;

import com.ryuqq.aiorchestrator.core.contract.QueryInput;
import com.ryuqq.aiorchestrator.core.contract.QueryRequest;
import com.ryuqq.aiorchestrator.core.exception.AdapterException;
import com.ryuqq.aiorchestrator.core.model.BackendKind;
import com.ryuqq.aiorchestrator.core.model.ModelDescriptor;
import com.ryuqq.aiorchestrator.core.result.CodeAnalysisResult;
import com.ryuqq.aiorchestrator.core.result.ResultPayload;

import java.util.List;

/**
 * code-analysis 어댑터 (Ollama /api/generate, format=json).
 *
 * <p>모델에게 issues, suggestions, quality_score(0~100), complexity(low|medium|high)를 가진
 * JSON 문서를 요청하고 {@link CodeAnalysisResult}로 변환합니다.
 * JSON이 아니거나 complexity가 없으면 MALFORMED_RESPONSE입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class OllamaCodeAnalysisAdapter extends OllamaBackendAdapter {

    static final String GENERATE_PATH = "/api/generate";
    static final String CODE_FIELD = "code";

    private static final String INSTRUCTIONS =
        "Analyze the following code. Respond only with a JSON object with the keys "
            + "\"issues\" (array of strings), \"suggestions\" (array of strings), "
            + "\"quality_score\" (number from 0 to 100) and \"complexity\" (one of low, medium, high).\n\n";

    public OllamaCodeAnalysisAdapter(OllamaClient client) {
        super(client);
    }

    @Override
    public BackendKind backendKind() {
        return BackendKind.CODE_ANALYSIS;
    }

    @Override
    public ResultPayload invoke(ModelDescriptor descriptor, QueryRequest request) throws AdapterException {
        String prompt = INSTRUCTIONS + "Code:\n" + code(request.input());
        OllamaGenerateRequest body = new OllamaGenerateRequest(backendModel(descriptor), prompt, null,
            OllamaGenerateRequest.FORMAT_JSON, options(request.parameters()));
        OllamaGenerateResponse response = client.post(GENERATE_PATH, body, OllamaGenerateResponse.class);

        CodeAnalysisReport report = client.readJson(response.getResponse(), CodeAnalysisReport.class);
        CodeAnalysisResult.Complexity complexity = CodeAnalysisResult.Complexity.fromName(report.getComplexity())
            .orElseThrow(() -> AdapterException.malformedResponse(
                "unknown complexity '" + report.getComplexity() + "'", null));
        if (report.getQualityScore() == null) {
            throw AdapterException.malformedResponse("quality_score is missing", null);
        }
        return new CodeAnalysisResult(entries("issues", report.getIssues()),
            entries("suggestions", report.getSuggestions()), report.getQualityScore(), complexity);
    }

    private static List<String> entries(String field, List<String> values) throws AdapterException {
        if (values == null) {
            return List.of();
        }
        for (String value : values) {
            if (value == null) {
                throw AdapterException.malformedResponse(field + " contains a null entry", null);
            }
        }
        return values;
    }

    private static String code(QueryInput input) throws AdapterException {
        if (input instanceof QueryInput.Structured) {
            Object code = ((QueryInput.Structured) input).fields().get(CODE_FIELD);
            if (code != null) {
                return code.toString();
            }
        }
        String text = input.promptText();
        if (text.isBlank()) {
            throw AdapterException.permanentFailure("code-analysis request has no code", null);
        }
        return text;
    }
}
