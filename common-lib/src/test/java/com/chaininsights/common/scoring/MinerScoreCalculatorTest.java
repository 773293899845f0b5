package com.chaininsights.common.scoring;

import com.chaininsights.common.model.NetworkDistribution;
import com.chaininsights.common.model.ScoreInput;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Behavioural contract of {@link MinerScoreCalculator}: bounded, pure and monotone in each
 * signal with the others held fixed.
 */
class MinerScoreCalculatorTest {

    private static final ScoringWeights WEIGHTS = ScoringWeights.defaults();
    private static final long TIP = 800_000;

    private static NetworkDistribution distribution(int onIp, int onColdkey) {
        return new NetworkDistribution(
            Map.of("bitcoin", 4, "ethereum", 6),
            Map.of("10.0.0.1", onIp),
            Map.of("ck-1", onColdkey),
            Map.of(),
            10);
    }

    private static ScoreInput input(double time, long start, long end, double uptime, int onIp) {
        return new ScoreInput("bitcoin", time, start, end, TIP, distribution(onIp, 1), uptime, "10.0.0.1", "ck-1");
    }

    @Nested
    @DisplayName("calculateScore(): bounds and purity")
    class Bounds {

        @Test
        @DisplayName("score stays in [0, 1] for extreme inputs")
        void bounded() {
            double best  = MinerScoreCalculator.calculateScore(input(0.0, 1, TIP, 1.0, 1), WEIGHTS);
            double worst = MinerScoreCalculator.calculateScore(input(1e9, TIP - 1, TIP, 0.0, 50), WEIGHTS);
            double nan   = MinerScoreCalculator.calculateScore(input(Double.NaN, 1, TIP, Double.NaN, 1), WEIGHTS);

            for (double score : new double[] {best, worst, nan}) {
                assertTrue(score >= 0.0 && score <= 1.0, "score out of range: " + score);
            }
        }

        @Test
        @DisplayName("identical inputs → identical score")
        void idempotent() {
            ScoreInput in = input(3.2, 500_000, 799_990, 0.7, 2);
            assertEquals(MinerScoreCalculator.calculateScore(in, WEIGHTS),
                         MinerScoreCalculator.calculateScore(in, WEIGHTS));
        }

        @Test
        @DisplayName("positional overload matches the record form without crowding")
        void positionalOverload() {
            NetworkDistribution d = distribution(1, 1);
            double positional = MinerScoreCalculator.calculateScore(
                "bitcoin", 2.0, 1_000, 799_000, TIP, d, 0.5, WEIGHTS);
            double record = MinerScoreCalculator.calculateScore(
                new ScoreInput("bitcoin", 2.0, 1_000, 799_000, TIP, d, 0.5, "10.0.0.1", "ck-1"), WEIGHTS);
            assertEquals(positional, record, 1e-12);
        }
    }

    @Nested
    @DisplayName("calculateScore(): monotonicity")
    class Monotonicity {

        @Test
        @DisplayName("non-decreasing in uptime average")
        void uptime() {
            double low  = MinerScoreCalculator.calculateScore(input(2.0, 1_000, 799_000, 0.1, 1), WEIGHTS);
            double high = MinerScoreCalculator.calculateScore(input(2.0, 1_000, 799_000, 0.9, 1), WEIGHTS);
            assertTrue(high >= low);
        }

        @Test
        @DisplayName("non-decreasing in coverage width")
        void coverage() {
            double narrow = MinerScoreCalculator.calculateScore(input(2.0, 700_000, 799_000, 0.5, 1), WEIGHTS);
            double wide   = MinerScoreCalculator.calculateScore(input(2.0, 1_000, 799_000, 0.5, 1), WEIGHTS);
            assertTrue(wide >= narrow);
        }

        @Test
        @DisplayName("non-increasing in adjusted response time")
        void responseTime() {
            double fast = MinerScoreCalculator.calculateScore(input(0.5, 1_000, 799_000, 0.5, 1), WEIGHTS);
            double slow = MinerScoreCalculator.calculateScore(input(20.0, 1_000, 799_000, 0.5, 1), WEIGHTS);
            assertTrue(fast >= slow);
        }

        @Test
        @DisplayName("non-increasing in miners sharing the same IP")
        void crowding() {
            double alone   = MinerScoreCalculator.calculateScore(input(2.0, 1_000, 799_000, 0.5, 1), WEIGHTS);
            double crowded = MinerScoreCalculator.calculateScore(input(2.0, 1_000, 799_000, 0.5, 5), WEIGHTS);
            assertTrue(alone > crowded);
        }
    }

    @Nested
    @DisplayName("components")
    class Components {

        @Test
        @DisplayName("timeScore: 0s → 1, max → 0, beyond max → 0")
        void timeScore() {
            assertEquals(1.0, MinerScoreCalculator.timeScore(0.0, 30.0));
            assertEquals(0.0, MinerScoreCalculator.timeScore(30.0, 30.0));
            assertEquals(0.0, MinerScoreCalculator.timeScore(90.0, 30.0));
            assertEquals(0.5, MinerScoreCalculator.timeScore(15.0, 30.0), 1e-12);
        }

        @Test
        @DisplayName("recencyScore: at tip → 1, a full window behind → 0")
        void recencyScore() {
            assertEquals(1.0, MinerScoreCalculator.recencyScore(TIP, TIP, 100));
            assertEquals(0.0, MinerScoreCalculator.recencyScore(TIP - 100, TIP, 100));
        }

        @Test
        @DisplayName("distributionScore: empty distribution → 1, whole network share → 0")
        void distributionScore() {
            assertEquals(1.0, MinerScoreCalculator.distributionScore("bitcoin", NetworkDistribution.empty()));
            NetworkDistribution all = new NetworkDistribution(Map.of("bitcoin", 3), Map.of(), Map.of(), Map.of(), 3);
            assertEquals(0.0, MinerScoreCalculator.distributionScore("bitcoin", all));
        }

        @Test
        @DisplayName("crowdingFactor: alone → 1, three sharing with penalty 0.5 → 0.5")
        void crowdingFactor() {
            assertEquals(1.0, MinerScoreCalculator.crowdingFactor(1, 0.5));
            assertEquals(0.5, MinerScoreCalculator.crowdingFactor(3, 0.5), 1e-12);
        }
    }

    @Test
    @DisplayName("negative weight → IllegalArgumentException")
    void invalidWeights() {
        assertThrows(IllegalArgumentException.class,
            () -> new ScoringWeights(-0.1, 0.25, 0.15, 0.10, 0.25, 30.0, 100, 0.5));
    }
}
