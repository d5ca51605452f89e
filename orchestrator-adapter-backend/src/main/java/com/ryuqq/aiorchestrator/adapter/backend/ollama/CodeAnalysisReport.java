package com.ryuqq.aiorchestrator.adapter.backend.ollama;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** JSON document the code-analysis prompt asks the model to return. */
@JsonIgnoreProperties(ignoreUnknown = true)
final class CodeAnalysisReport {

    private List<String> issues;
    private List<String> suggestions;
    @JsonProperty("quality_score")
    private Double qualityScore;
    private String complexity;

    public List<String> getIssues() { return issues; }
    public void setIssues(List<String> issues) { this.issues = issues; }
    public List<String> getSuggestions() { return suggestions; }
    public void setSuggestions(List<String> suggestions) { this.suggestions = suggestions; }
    public Double getQualityScore() { return qualityScore; }
    public void setQualityScore(Double qualityScore) { this.qualityScore = qualityScore; }
    public String getComplexity() { return complexity; }
    public void setComplexity(String complexity) { this.complexity = complexity; }
}
