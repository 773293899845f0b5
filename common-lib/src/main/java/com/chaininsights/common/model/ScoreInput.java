package com.chaininsights.common.model;

/**
 * Every signal the scorer consumes for one miner in one round. Assembled by the round driver
 * only after the response was valid and cross-validation did not come back indeterminate.
 */
public record ScoreInput(
    String network,
    double adjustedResponseTime,
    long claimedStart,
    long claimedEnd,
    long authoritativeHeight,
    NetworkDistribution distribution,
    double uptimeAverage,
    String ip,
    String coldkey
) {}
