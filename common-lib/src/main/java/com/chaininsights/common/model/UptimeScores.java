package com.chaininsights.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Rolling availability derived from a miner's up/down history. Every score is in [0.0, 1.0].
 *
 * <ul>
 *   <li>{@code average} – share of "up" rounds over the bounded recent window</li>
 *   <li>{@code daily}   – share of "up" rounds observed in the last 24 hours</li>
 *   <li>{@code weekly}  – share of "up" rounds observed in the last 7 days</li>
 * </ul>
 */
public record UptimeScores(
    @JsonProperty("average")      double average,
    @JsonProperty("daily")        double daily,
    @JsonProperty("weekly")       double weekly,
    @JsonProperty("observations") int observations
) {
    public static UptimeScores none() {
        return new UptimeScores(0.0, 0.0, 0.0, 0);
    }
}
