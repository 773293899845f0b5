package com.chaininsights.validator.round;

/**
 * Where a miner ended up in a round, and what that means for its uptime history.
 */
public enum MinerRoundStatus {
    /** Agreed with the benchmark majority and was scored. */
    REWARDED(UptimeEffect.UP),
    /** Answered the challenge wrongly or claimed an impossible range. Rewarded 0. */
    CROSS_CHECK_FAILED(UptimeEffect.DOWN),
    /** Transport error, malformed discovery output or over an anti-abuse cap. */
    INVALID(UptimeEffect.DOWN),
    /** No usable challenge answer. */
    INDETERMINATE(UptimeEffect.DOWN),
    /** Answered the benchmark differently from the majority, or not at all. Rewarded 0. */
    BENCHMARK_DISAGREED(UptimeEffect.DOWN),
    /** Nobody in the miner's chunk answered the benchmark. */
    BENCHMARK_VACANT(UptimeEffect.DOWN),
    /** The miner's network had too few claims to cluster. */
    CLUSTERING_SKIPPED(UptimeEffect.DOWN),
    /** Our authoritative client for the miner's network was unreachable. */
    NODE_UNAVAILABLE(UptimeEffect.NONE),
    /** No committed metadata could be loaded for the miner. */
    METADATA_MISSING(UptimeEffect.NONE);

    public enum UptimeEffect { UP, DOWN, NONE }

    private final UptimeEffect uptimeEffect;

    MinerRoundStatus(UptimeEffect uptimeEffect) {
        this.uptimeEffect = uptimeEffect;
    }

    public UptimeEffect uptimeEffect() {
        return uptimeEffect;
    }
}
