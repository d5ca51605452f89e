package com.ryuqq.aiorchestrator.adapter.backend.ollama;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Ollama /api/chat request body. */
final class OllamaChatRequest {

    private final String model;
    private final List<Message> messages;
    @JsonProperty("stream")
    private final boolean stream;
    private final OllamaOptions options;

    OllamaChatRequest(String model, List<Message> messages, OllamaOptions options) {
        this.model = model;
        this.messages = messages;
        this.stream = false;
        this.options = options;
    }

    public String getModel() { return model; }
    public List<Message> getMessages() { return messages; }
    public boolean isStream() { return stream; }
    public OllamaOptions getOptions() { return options; }

    static final class Message {
        private final String role;
        private final String content;

        Message(String role, String content) {
            this.role = role;
            this.content = content;
        }

        public String getRole() { return role; }
        public String getContent() { return content; }
    }
}
