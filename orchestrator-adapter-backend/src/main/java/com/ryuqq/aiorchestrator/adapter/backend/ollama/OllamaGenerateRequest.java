package com.ryuqq.aiorchestrator.adapter.backend.ollama;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/** Ollama /api/generate request body. {@code images} and {@code format} are omitted when null. */
@JsonInclude(JsonInclude.Include.NON_NULL)
final class OllamaGenerateRequest {

    static final String FORMAT_JSON = "json";

    private final String model;
    private final String prompt;
    private final List<String> images;
    private final String format;
    private final boolean stream;
    private final OllamaOptions options;

    OllamaGenerateRequest(String model, String prompt, List<String> images, String format, OllamaOptions options) {
        this.model = model;
        this.prompt = prompt;
        this.images = images;
        this.format = format;
        this.stream = false;
        this.options = options;
    }

    public String getModel() { return model; }
    public String getPrompt() { return prompt; }
    public List<String> getImages() { return images; }
    public String getFormat() { return format; }
    public boolean isStream() { return stream; }
    public OllamaOptions getOptions() { return options; }
}
