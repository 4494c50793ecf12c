package com.leadranker.common.fitness;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FitnessScorerTest {

    private static final double EPS = 1e-9;

    @Nested
    @DisplayName("scorePrediction()")
    class PerPrediction {

        @Test
        @DisplayName("relevance disagreement → 0")
        void relevanceMismatch() {
            assertEquals(0.0, FitnessScorer.scorePrediction(new Prediction(3, null)), EPS);
            assertEquals(0.0, FitnessScorer.scorePrediction(new Prediction(null, 1)), EPS);
        }

        @Test
        @DisplayName("both irrelevant → 1")
        void bothIrrelevant() {
            assertEquals(1.0, FitnessScorer.scorePrediction(new Prediction(null, null)), EPS);
        }

        @Test
        @DisplayName("rank distance scales linearly over 9")
        void rankDistance() {
            assertEquals(1.0, FitnessScorer.scorePrediction(new Prediction(4, 4)), EPS);
            assertEquals(0.0, FitnessScorer.scorePrediction(new Prediction(1, 10)), EPS);
            assertEquals(1.0 - 3.0 / 9.0, FitnessScorer.scorePrediction(new Prediction(2, 5)), EPS);
        }

        @Test
        @DisplayName("out-of-range model rank is not clamped")
        void outOfRangeGoesNegative() {
            assertTrue(FitnessScorer.scorePrediction(new Prediction(15, 1)) < 0.0);
        }
    }

    @Nested
    @DisplayName("score()")
    class Overall {

        @Test
        @DisplayName("empty set → 0")
        void empty() {
            assertEquals(0.0, FitnessScorer.score(List.of()), EPS);
            assertEquals(0.0, FitnessScorer.score(null), EPS);
        }

        @Test
        @DisplayName("all exact matches, including irrelevant ones → 1.0")
        void perfect() {
            List<Prediction> predictions = List.of(
                new Prediction(1, 1), new Prediction(null, null), new Prediction(7, 7));
            assertEquals(1.0, FitnessScorer.score(predictions), EPS);
        }

        @Test
        @DisplayName("order invariant")
        void orderInvariant() {
            Prediction a = new Prediction(2, 5);
            Prediction b = new Prediction(null, null);
            assertEquals(FitnessScorer.score(List.of(a, b)), FitnessScorer.score(List.of(b, a)), EPS);
        }

        @Test
        @DisplayName("mean of per-prediction scores")
        void mean() {
            List<Prediction> predictions = List.of(new Prediction(1, 1), new Prediction(3, null));
            assertEquals(0.5, FitnessScorer.score(predictions), EPS);
        }
    }

    @Nested
    @DisplayName("analyze()")
    class Analyze {

        @Test
        @DisplayName("counts each error category")
        void countsErrors() {
            ErrorPatterns patterns = FitnessScorer.analyze(List.of(
                new Prediction(2, null),   // false positive
                new Prediction(null, 3),   // false negative
                new Prediction(1, 4),      // too high
                new Prediction(8, 5),      // too low
                new Prediction(6, 6),
                new Prediction(null, null)));

            assertEquals(new ErrorPatterns(1, 1, 1, 1), patterns);
            assertEquals(4, patterns.hints().size());
            assertTrue(patterns.hints().get(0).contains("1 irrelevant leads as relevant"));
        }

        @Test
        @DisplayName("no errors → no hints")
        void noErrors() {
            ErrorPatterns patterns = FitnessScorer.analyze(List.of(new Prediction(3, 3)));
            assertTrue(patterns.isEmpty());
            assertTrue(patterns.hints().isEmpty());
        }
    }
}
