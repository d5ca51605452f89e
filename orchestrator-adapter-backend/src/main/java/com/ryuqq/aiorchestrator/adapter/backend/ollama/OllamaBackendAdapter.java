package com.ryuqq.aiorchestrator.adapter.backend.ollama;

import com.ryuqq.aiorchestrator.core.contract.QueryParameters;
import com.ryuqq.aiorchestrator.core.model.ModelDescriptor;
import com.ryuqq.aiorchestrator.core.spi.BackendAdapter;

/**
 * Ollama 어댑터 공통 부분 (클라이언트, probe, 백엔드 모델 이름).
 *
 * <p>descriptor 메타데이터의 {@code ollama_model}이 있으면 그 이름으로, 없으면 모델 식별자로 호출합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class OllamaBackendAdapter implements BackendAdapter {

    public static final String OLLAMA_MODEL_METADATA = "ollama_model";

    protected final OllamaClient client;

    protected OllamaBackendAdapter(OllamaClient client) {
        if (client == null) {
            throw new IllegalArgumentException("client cannot be null");
        }
        this.client = client;
    }

    @Override
    public boolean probe(ModelDescriptor descriptor) {
        return client.ping();
    }

    protected static String backendModel(ModelDescriptor descriptor) {
        Object name = descriptor.metadata().get(OLLAMA_MODEL_METADATA);
        if (name instanceof String && !((String) name).isBlank()) {
            return ((String) name).trim();
        }
        return descriptor.id().getValue();
    }

    protected static OllamaOptions options(QueryParameters parameters) {
        return new OllamaOptions(parameters.temperature(), parameters.maxTokens());
    }
}
