package com.leadranker.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One prompt variant inside a generation of the genetic optimizer.
 * Candidates are immutable; re-scoring or promotion produces a copy.
 */
public record PromptCandidate(
    @JsonProperty("content")       String  content,
    @JsonProperty("version")       int     version,
    @JsonProperty("fitness")       double  fitness,
    @JsonProperty("generation")    int     generation,
    @JsonProperty("parentVersion") Integer parentVersion
) {
    public PromptCandidate withFitness(double newFitness) {
        return new PromptCandidate(content, version, newFitness, generation, parentVersion);
    }

    public PromptCandidate withGeneration(int newGeneration) {
        return new PromptCandidate(content, version, fitness, newGeneration, parentVersion);
    }

    public PromptCandidate withVersion(int newVersion) {
        return new PromptCandidate(content, newVersion, fitness, generation, parentVersion);
    }
}
