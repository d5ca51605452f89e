package com.ryuqq.aiorchestrator.testkit.contract;

import com.ryuqq.aiorchestrator.core.contract.QueryInput;
import com.ryuqq.aiorchestrator.core.contract.QueryRequest;
import com.ryuqq.aiorchestrator.core.model.BackendKind;
import com.ryuqq.aiorchestrator.core.model.ModelDescriptor;
import com.ryuqq.aiorchestrator.core.model.ModelId;
import com.ryuqq.aiorchestrator.core.model.TaskType;
import com.ryuqq.aiorchestrator.core.model.Tier;

import java.util.List;
import java.util.Map;

/**
 * Descriptor and request fixtures shared by contract tests.
 *
 * <p>The selection scenario pair: {@link #MODEL_A} (GUEST, chat) and {@link #MODEL_B} (NEURAL, chat).</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ModelFixtures {

    public static final ModelId MODEL_A = ModelId.of("model-a");
    public static final ModelId MODEL_B = ModelId.of("model-b");

    private ModelFixtures() {
    }

    public static ModelDescriptor chatModel(String id, Tier requiredTier) {
        return ModelDescriptor.of(ModelId.of(id), BackendKind.GENERAL_MODEL, requiredTier,
            List.of(TaskType.CHAT, TaskType.GENERATE));
    }

    public static ModelDescriptor classifier(String id, Tier requiredTier) {
        return ModelDescriptor.of(ModelId.of(id), BackendKind.CLASSIFIER, requiredTier,
            List.of(TaskType.CLASSIFY, TaskType.PREDICT));
    }

    public static ModelDescriptor visionModel(String id, Tier requiredTier) {
        return ModelDescriptor.of(ModelId.of(id), BackendKind.VISION, requiredTier, List.of(TaskType.VISION));
    }

    public static ModelDescriptor codeModel(String id, Tier requiredTier) {
        return ModelDescriptor.of(ModelId.of(id), BackendKind.CODE_ANALYSIS, requiredTier,
            List.of(TaskType.CODE_ANALYSIS));
    }

    /**
     * Model A: tier GUEST, capability chat.
     */
    public static ModelDescriptor modelA() {
        return ModelDescriptor.of(MODEL_A, BackendKind.GENERAL_MODEL, Tier.GUEST, List.of(TaskType.CHAT));
    }

    /**
     * Model B: tier NEURAL, capability chat.
     */
    public static ModelDescriptor modelB() {
        return ModelDescriptor.of(MODEL_B, BackendKind.GENERAL_MODEL, Tier.NEURAL, List.of(TaskType.CHAT));
    }

    public static QueryRequest chat(String text, Tier callerTier) {
        return QueryRequest.of(text, callerTier);
    }

    public static QueryRequest explicit(ModelId modelId, String text, Tier callerTier) {
        return QueryRequest.builder(new QueryInput.Text(text), callerTier).model(modelId).build();
    }

    public static QueryRequest image(String base64, Tier callerTier) {
        return QueryRequest.builder(new QueryInput.Structured(Map.of("image", base64)), callerTier).build();
    }

    public static QueryRequest code(String source, Tier callerTier) {
        return QueryRequest.builder(new QueryInput.Structured(Map.of("code", source)), callerTier).build();
    }

    /**
     * A registration entry in the deployment listing format.
     */
    public static Map<String, Object> entry(String id, String backendKind, int requiredTier,
                                            List<String> capabilities) {
        return Map.of(
            "id", id,
            "backendKind", backendKind,
            "requiredTier", requiredTier,
            "capabilities", capabilities
        );
    }
}
