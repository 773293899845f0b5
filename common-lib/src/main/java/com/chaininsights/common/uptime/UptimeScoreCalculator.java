package com.chaininsights.common.uptime;

import com.chaininsights.common.model.UptimeSample;
import com.chaininsights.common.model.UptimeScores;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Derives rolling availability from a miner's up/down history.
 *
 * <p>{@code average} covers the {@code window} most recent samples; {@code daily} and
 * {@code weekly} cover every sample observed within 24 hours / 7 days of {@code now}.
 * A single good round after a long outage therefore only moves the average by
 * {@code 1 / window}.
 *
 * <p>Pure static utility. Every returned score is in [0.0, 1.0].
 */
public final class UptimeScoreCalculator {

    static final Duration DAY  = Duration.ofDays(1);
    static final Duration WEEK = Duration.ofDays(7);

    private UptimeScoreCalculator() {}

    /**
     * @param recentFirst samples ordered most-recent first; may be longer than {@code window}
     * @param window      number of most recent samples the average is taken over
     * @param now         reference time for the daily/weekly windows
     */
    public static UptimeScores compute(List<UptimeSample> recentFirst, int window, Instant now) {
        if (recentFirst == null || recentFirst.isEmpty() || window <= 0) {
            return UptimeScores.none();
        }
        List<UptimeSample> windowed = recentFirst.subList(0, Math.min(window, recentFirst.size()));

        double average = upRatio(windowed, null, now);
        double daily   = upRatio(recentFirst, DAY, now);
        double weekly  = upRatio(recentFirst, WEEK, now);
        return new UptimeScores(average, daily, weekly, windowed.size());
    }

    static double upRatio(List<UptimeSample> samples, Duration within, Instant now) {
        int total = 0;
        int up = 0;
        for (UptimeSample sample : samples) {
            if (sample == null) continue;
            if (within != null && sample.observedAt() != null
                    && sample.observedAt().isBefore(now.minus(within))) {
                continue;
            }
            total++;
            if (sample.up()) up++;
        }
        if (total == 0) return 0.0;
        return Math.max(0.0, Math.min(1.0, (double) up / total));
    }
}
