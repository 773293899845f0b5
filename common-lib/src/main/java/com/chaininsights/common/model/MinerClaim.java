package com.chaininsights.common.model;

/**
 * A miner's self-reported coverage after it passed response validation.
 * Lives for one round only.
 *
 * @param discoveryTime transport time of the discovery call, used as the miner's network latency
 */
public record MinerClaim(
    MinerAxon axon,
    String network,
    String modelType,
    long startHeight,
    long endHeight,
    int version,
    double discoveryTime
) {
    public String hotkey() {
        return axon.hotkey();
    }

    public long width() {
        return endHeight - startHeight + 1;
    }
}
