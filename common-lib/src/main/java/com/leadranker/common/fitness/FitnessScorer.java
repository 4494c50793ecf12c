package com.leadranker.common.fitness;

import java.util.List;

/**
 * Stateless fitness function for the prompt optimizer.
 *
 * <p><b>Per prediction</b>:
 * <pre>
 *   relevance disagrees          → 0
 *   both irrelevant (null)       → 1
 *   both ranked                  → 1 − |predicted − expected| / 9
 * </pre>
 * Overall fitness is the arithmetic mean; an empty set scores 0.
 *
 * <p>Ranks outside 1–10 are not clamped, so a distance above
 * {@value #MAX_RANK_DISTANCE} yields a negative per-prediction score.
 */
public final class FitnessScorer {

    static final double MAX_RANK_DISTANCE = 9.0;

    private FitnessScorer() {}

    public static double scorePrediction(Prediction p) {
        if (!p.relevanceMatches()) return 0.0;
        if (p.expected() == null) return 1.0;
        return 1.0 - Math.abs(p.predicted() - p.expected()) / MAX_RANK_DISTANCE;
    }

    public static double score(List<Prediction> predictions) {
        if (predictions == null || predictions.isEmpty()) return 0.0;
        return predictions.stream()
            .mapToDouble(FitnessScorer::scorePrediction)
            .average()
            .orElse(0.0);
    }

    public static ErrorPatterns analyze(List<Prediction> predictions) {
        int falsePositives = 0;
        int falseNegatives = 0;
        int rankTooHigh    = 0;
        int rankTooLow     = 0;

        for (Prediction p : predictions) {
            boolean predictedRelevant = p.predicted() != null;
            boolean expectedRelevant  = p.expected() != null;

            if (predictedRelevant && !expectedRelevant) {
                falsePositives++;
            } else if (!predictedRelevant && expectedRelevant) {
                falseNegatives++;
            } else if (predictedRelevant) {
                if (p.predicted() < p.expected()) rankTooHigh++;
                else if (p.predicted() > p.expected()) rankTooLow++;
            }
        }
        return new ErrorPatterns(falsePositives, falseNegatives, rankTooHigh, rankTooLow);
    }
}
