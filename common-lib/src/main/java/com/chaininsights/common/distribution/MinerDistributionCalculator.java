package com.chaininsights.common.distribution;

import com.chaininsights.common.model.MinerAxon;
import com.chaininsights.common.model.MinerMetadata;
import com.chaininsights.common.model.NetworkDistribution;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

/**
 * Counts how the round's miners spread over networks, IPs, coldkeys and indexer run ids.
 *
 * <p>Network and run id come from committed metadata; a miner without metadata still counts
 * toward IP and coldkey totals, so metadata gaps cannot be used to dodge the caps.
 */
public final class MinerDistributionCalculator {

    private MinerDistributionCalculator() {}

    public static NetworkDistribution compute(Collection<MinerAxon> axons,
                                              Map<String, MinerMetadata> metadataByHotkey) {
        Map<String, Integer> perNetwork = new HashMap<>();
        Map<String, Integer> perIp      = new HashMap<>();
        Map<String, Integer> perColdkey = new HashMap<>();
        Map<String, Integer> perRunId   = new HashMap<>();

        for (MinerAxon axon : axons) {
            if (axon.ip() != null)      perIp.merge(axon.ip(), 1, Integer::sum);
            if (axon.coldkey() != null) perColdkey.merge(axon.coldkey(), 1, Integer::sum);

            MinerMetadata metadata = metadataByHotkey.get(axon.hotkey());
            if (metadata == null) continue;
            perNetwork.merge(NetworkIds.nameOf(metadata.network()), 1, Integer::sum);
            if (metadata.runId() != null && !metadata.runId().isBlank()) {
                perRunId.merge(metadata.runId(), 1, Integer::sum);
            }
        }
        return new NetworkDistribution(perNetwork, perIp, perColdkey, perRunId, axons.size());
    }
}
