package com.ryuqq.aiorchestrator.adapter.backend.ollama;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** Ollama /api/generate response (non-streaming). */
@JsonIgnoreProperties(ignoreUnknown = true)
final class OllamaGenerateResponse {

    private String model;
    private String response;
    private boolean done;

    public String getModel() { return model; }
    public void setModel(String model) { this.model = model; }
    public String getResponse() { return response; }
    public void setResponse(String response) { this.response = response; }
    public boolean isDone() { return done; }
    public void setDone(boolean done) { this.done = done; }
}
