package com.chaininsights.common.scoring;

import com.chaininsights.common.model.NetworkDistribution;
import com.chaininsights.common.model.ScoreInput;

/**
 * Pure reward function combining correctness-gated signals into one score in [0.0, 1.0].
 *
 * <p>Only invoked after the response was valid and cross-validation passed; the gates
 * themselves live in the round driver.
 *
 * <h3>Components (each in [0.0, 1.0])</h3>
 * <pre>
 *   time         = 1 − min(1, adjustedResponseTime / maxResponseTime)
 *   coverage     = min(1, (end − start + 1) / authoritativeHeight)
 *   recency      = 1 − min(1, max(0, authoritativeHeight − end) / recencyWindow)
 *   distribution = 1 − minersOnNetwork / totalMiners
 *   uptime       = uptimeAverage
 * </pre>
 *
 * <h3>Combination</h3>
 * <pre>
 *   base     = Σ(weight × component) / Σ(weight)
 *   crowding = 1 / (1 + crowdingPenalty × (minersOnIp − 1))
 *            × 1 / (1 + crowdingPenalty × (minersOnColdkey − 1))
 *   score    = clamp(base × crowding, 0, 1)
 * </pre>
 *
 * <p>Non-decreasing in uptime and coverage width; non-increasing in response time, network
 * share and crowding. Pure static utility: identical inputs give identical scores.
 */
public final class MinerScoreCalculator {

    private MinerScoreCalculator() {}

    public static double calculateScore(ScoreInput input, ScoringWeights weights) {
        double base = weightedBase(
            input.network(), input.adjustedResponseTime(), input.claimedStart(), input.claimedEnd(),
            input.authoritativeHeight(), input.distribution(), input.uptimeAverage(), weights);

        NetworkDistribution distribution = input.distribution();
        double crowding = crowdingFactor(distribution.onIp(input.ip()), weights.crowdingPenalty())
                        * crowdingFactor(distribution.onColdkey(input.coldkey()), weights.crowdingPenalty());

        return clamp(base * crowding);
    }

    /**
     * Positional form without identity crowding: the distribution only contributes its
     * network share.
     */
    public static double calculateScore(String network,
                                        double adjustedResponseTime,
                                        long claimedStart,
                                        long claimedEnd,
                                        long authoritativeHeight,
                                        NetworkDistribution distribution,
                                        double uptimeAverage,
                                        ScoringWeights weights) {
        return clamp(weightedBase(network, adjustedResponseTime, claimedStart, claimedEnd,
                                  authoritativeHeight, distribution, uptimeAverage, weights));
    }

    // ── components ───────────────────────────────────────────────────────────

    static double timeScore(double adjustedResponseTime, double maxResponseTime) {
        if (Double.isNaN(adjustedResponseTime)) return 0.0;
        double time = Math.max(0.0, adjustedResponseTime);
        return 1.0 - Math.min(1.0, time / maxResponseTime);
    }

    static double coverageScore(long start, long end, long authoritativeHeight) {
        if (authoritativeHeight <= 0 || end < start) return 0.0;
        double width = (double) (end - start + 1);
        return Math.min(1.0, width / authoritativeHeight);
    }

    static double recencyScore(long end, long authoritativeHeight, long recencyWindow) {
        double behind = Math.max(0L, authoritativeHeight - end);
        return 1.0 - Math.min(1.0, behind / recencyWindow);
    }

    static double distributionScore(String network, NetworkDistribution distribution) {
        if (distribution == null || distribution.totalMiners() <= 0) return 1.0;
        double share = (double) distribution.onNetwork(network) / distribution.totalMiners();
        return 1.0 - Math.min(1.0, share);
    }

    static double crowdingFactor(int sharing, double penalty) {
        if (sharing <= 1) return 1.0;
        return 1.0 / (1.0 + penalty * (sharing - 1));
    }

    private static double weightedBase(String network, double adjustedResponseTime,
                                       long start, long end, long authoritativeHeight,
                                       NetworkDistribution distribution, double uptimeAverage,
                                       ScoringWeights w) {
        double total = w.totalWeight();
        if (total <= 0.0) return 0.0;

        double sum = w.timeWeight()         * timeScore(adjustedResponseTime, w.maxResponseTime())
                   + w.coverageWeight()     * coverageScore(start, end, authoritativeHeight)
                   + w.recencyWeight()      * recencyScore(end, authoritativeHeight, w.recencyWindow())
                   + w.distributionWeight() * distributionScore(network, distribution)
                   + w.uptimeWeight()       * clamp(uptimeAverage);
        return sum / total;
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) return 0.0;
        return Math.max(0.0, Math.min(1.0, value));
    }
}
