package com.leadranker.ranking.optimizer;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Tuning knobs of one optimizer run. Null request fields fall back to
 * {@link #defaults()}; {@link #validate()} enforces the accepted ranges.
 */
public record OptimizerSettings(
    @JsonProperty("populationSize") int    populationSize,
    @JsonProperty("generations")    int    generations,
    @JsonProperty("sampleSize")     int    sampleSize,
    @JsonProperty("mutationRate")   double mutationRate,
    @JsonProperty("eliteCount")     int    eliteCount,
    @JsonProperty("tournamentSize") int    tournamentSize
) {
    public static final int    DEFAULT_POPULATION_SIZE = 6;
    public static final int    DEFAULT_GENERATIONS     = 5;
    public static final int    DEFAULT_SAMPLE_SIZE     = 30;
    public static final double DEFAULT_MUTATION_RATE   = 0.7;
    public static final int    DEFAULT_ELITE_COUNT     = 2;
    public static final int    DEFAULT_TOURNAMENT_SIZE = 3;

    public static OptimizerSettings defaults() {
        return new OptimizerSettings(DEFAULT_POPULATION_SIZE, DEFAULT_GENERATIONS, DEFAULT_SAMPLE_SIZE,
            DEFAULT_MUTATION_RATE, DEFAULT_ELITE_COUNT, DEFAULT_TOURNAMENT_SIZE);
    }

    /** Request-side overrides; any null keeps the default. */
    public static OptimizerSettings of(Integer populationSize, Integer generations, Integer sampleSize) {
        return new OptimizerSettings(
            populationSize != null ? populationSize : DEFAULT_POPULATION_SIZE,
            generations    != null ? generations    : DEFAULT_GENERATIONS,
            sampleSize     != null ? sampleSize     : DEFAULT_SAMPLE_SIZE,
            DEFAULT_MUTATION_RATE, DEFAULT_ELITE_COUNT, DEFAULT_TOURNAMENT_SIZE);
    }

    public OptimizerSettings validate() {
        requireRange("populationSize", populationSize, 3, 20);
        requireRange("generations", generations, 1, 20);
        requireRange("sampleSize", sampleSize, 10, 100);
        if (mutationRate < 0.0 || mutationRate > 1.0) {
            throw new IllegalArgumentException("mutationRate must be between 0 and 1, got " + mutationRate);
        }
        if (eliteCount < 0 || eliteCount > populationSize) {
            throw new IllegalArgumentException("eliteCount must be between 0 and populationSize, got " + eliteCount);
        }
        if (tournamentSize < 1) {
            throw new IllegalArgumentException("tournamentSize must be positive, got " + tournamentSize);
        }
        return this;
    }

    private static void requireRange(String name, int value, int min, int max) {
        if (value < min || value > max) {
            throw new IllegalArgumentException(name + " must be between " + min + " and " + max + ", got " + value);
        }
    }
}
