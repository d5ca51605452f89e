package com.ryuqq.aiorchestrator.adapter.backend.ollama;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Ollama generation options ({@code options} object of /api/chat and /api/generate). */
final class OllamaOptions {

    private final double temperature;
    @JsonProperty("num_predict")
    private final int numPredict;

    OllamaOptions(double temperature, int numPredict) {
        this.temperature = temperature;
        this.numPredict = numPredict;
    }

    public double getTemperature() { return temperature; }
    public int getNumPredict() { return numPredict; }
}
