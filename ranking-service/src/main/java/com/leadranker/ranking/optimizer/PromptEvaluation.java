package com.leadranker.ranking.optimizer;

import com.leadranker.common.fitness.ErrorPatterns;
import com.leadranker.common.fitness.FitnessScorer;
import com.leadranker.common.fitness.Prediction;

import java.util.List;

/** Fitness of one prompt on one evaluation sample, with the predictions behind it. */
public record PromptEvaluation(double fitness, List<Prediction> predictions) {

    public static PromptEvaluation of(List<Prediction> predictions) {
        return new PromptEvaluation(FitnessScorer.score(predictions), List.copyOf(predictions));
    }

    public ErrorPatterns errors() {
        return FitnessScorer.analyze(predictions);
    }
}
