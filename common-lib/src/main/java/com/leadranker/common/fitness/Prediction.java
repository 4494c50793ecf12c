package com.leadranker.common.fitness;

/** Predicted vs. human-labelled rank for one evaluation lead; null = irrelevant. */
public record Prediction(Integer predicted, Integer expected) {

    public boolean relevanceMatches() {
        return (predicted == null) == (expected == null);
    }
}
