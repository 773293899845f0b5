package com.chaininsights.common.model;

import java.util.Map;

/**
 * How the sampled miners of a round spread over networks, addresses, owners and indexer runs.
 * Used both for the hard anti-abuse caps and for the scorer's over-representation penalties.
 */
public record NetworkDistribution(
    Map<String, Integer> minersPerNetwork,
    Map<String, Integer> minersPerIp,
    Map<String, Integer> minersPerColdkey,
    Map<String, Integer> minersPerRunId,
    int totalMiners
) {
    public NetworkDistribution {
        minersPerNetwork = Map.copyOf(minersPerNetwork);
        minersPerIp      = Map.copyOf(minersPerIp);
        minersPerColdkey = Map.copyOf(minersPerColdkey);
        minersPerRunId   = Map.copyOf(minersPerRunId);
    }

    public static NetworkDistribution empty() {
        return new NetworkDistribution(Map.of(), Map.of(), Map.of(), Map.of(), 0);
    }

    public int onNetwork(String network) {
        return network == null ? 0 : minersPerNetwork.getOrDefault(network, 0);
    }

    public int onIp(String ip) {
        return ip == null ? 0 : minersPerIp.getOrDefault(ip, 0);
    }

    public int onColdkey(String coldkey) {
        return coldkey == null ? 0 : minersPerColdkey.getOrDefault(coldkey, 0);
    }

    public int onRunId(String runId) {
        return runId == null ? 0 : minersPerRunId.getOrDefault(runId, 0);
    }
}
