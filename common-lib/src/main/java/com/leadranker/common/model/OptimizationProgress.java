package com.leadranker.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Live progress of one optimizer run. {@code currentBestPrompt} holds a
 * 200-character preview, never the full prompt.
 */
public record OptimizationProgress(
    @JsonProperty("status")            RunStatus status,
    @JsonProperty("currentGeneration") int       currentGeneration,
    @JsonProperty("totalGenerations")  int       totalGenerations,
    @JsonProperty("populationSize")    int       populationSize,
    @JsonProperty("bestFitness")       double    bestFitness,
    @JsonProperty("currentBestPrompt") String    currentBestPrompt,
    @JsonProperty("evaluationsRun")    int       evaluationsRun,
    @JsonProperty("error")             String    error
) {
    public static final int PREVIEW_LENGTH = 200;

    public static OptimizationProgress idle() {
        return new OptimizationProgress(RunStatus.IDLE, 0, 0, 0, 0.0, null, 0, null);
    }

    public OptimizationProgress started(int generations, int population) {
        return new OptimizationProgress(RunStatus.RUNNING, 0, generations, population, 0.0, null, 0, null);
    }

    public OptimizationProgress atGeneration(int generation) {
        return new OptimizationProgress(status, generation, totalGenerations, populationSize,
            bestFitness, currentBestPrompt, evaluationsRun, error);
    }

    public OptimizationProgress withEvaluations(int evaluations) {
        return new OptimizationProgress(status, currentGeneration, totalGenerations, populationSize,
            bestFitness, currentBestPrompt, evaluations, error);
    }

    public OptimizationProgress withBest(PromptCandidate best) {
        return new OptimizationProgress(status, currentGeneration, totalGenerations, populationSize,
            best.fitness(), preview(best.content()), evaluationsRun, error);
    }

    public OptimizationProgress completed(double finalFitness) {
        return new OptimizationProgress(RunStatus.COMPLETED, currentGeneration, totalGenerations,
            populationSize, finalFitness, currentBestPrompt, evaluationsRun, error);
    }

    public OptimizationProgress failed(String message) {
        return new OptimizationProgress(RunStatus.ERROR, currentGeneration, totalGenerations,
            populationSize, bestFitness, currentBestPrompt, evaluationsRun, message);
    }

    static String preview(String content) {
        if (content == null) return null;
        return content.length() > PREVIEW_LENGTH
            ? content.substring(0, PREVIEW_LENGTH) + "..."
            : content;
    }
}
