package com.chaininsights.common.scoring;

/**
 * Tuning knobs for {@link MinerScoreCalculator}. Component weights need not sum to 1: 
 * the calculator divides by their total.
 *
 * @param maxResponseTime response time (seconds) at or above which the time component is 0
 * @param recencyWindow   blocks behind the chain tip at or beyond which the recency component is 0
 * @param crowdingPenalty per extra miner sharing an IP or coldkey; 0 disables the crowding factor
 */
public record ScoringWeights(
    double timeWeight,
    double coverageWeight,
    double recencyWeight,
    double distributionWeight,
    double uptimeWeight,
    double maxResponseTime,
    long   recencyWindow,
    double crowdingPenalty
) {
    public ScoringWeights {
        if (timeWeight < 0 || coverageWeight < 0 || recencyWeight < 0
                || distributionWeight < 0 || uptimeWeight < 0 || crowdingPenalty < 0) {
            throw new IllegalArgumentException("scoring weights must not be negative");
        }
        if (maxResponseTime <= 0 || recencyWindow <= 0) {
            throw new IllegalArgumentException("maxResponseTime and recencyWindow must be positive");
        }
    }

    public static ScoringWeights defaults() {
        return new ScoringWeights(0.25, 0.25, 0.15, 0.10, 0.25, 30.0, 100L, 0.5);
    }

    double totalWeight() {
        return timeWeight + coverageWeight + recencyWeight + distributionWeight + uptimeWeight;
    }
}
