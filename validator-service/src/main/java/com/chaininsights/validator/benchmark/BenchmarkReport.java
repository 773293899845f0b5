package com.chaininsights.validator.benchmark;

import com.chaininsights.common.model.BenchmarkOutcome;
import com.chaininsights.common.model.ClusterGroup;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Result of one benchmark stage.
 *
 * <ul>
 *   <li>{@code outcomes} – per-hotkey result for every miner whose chunk had at least one responder</li>
 *   <li>{@code vacantHotkeys} – members of chunks where nobody answered</li>
 *   <li>{@code clusteringSkippedHotkeys} – miners of networks that got no benchmark this round</li>
 *   <li>{@code weakConsensusChunks} – chunks decided by a single responder</li>
 * </ul>
 */
public record BenchmarkReport(
    Map<String, BenchmarkOutcome> outcomes,
    Set<String> vacantHotkeys,
    Set<String> clusteringSkippedHotkeys,
    List<String> skippedNetworks,
    int weakConsensusChunks,
    List<ClusterGroup> groups
) {
    public BenchmarkReport {
        outcomes                 = Map.copyOf(outcomes);
        vacantHotkeys            = Set.copyOf(vacantHotkeys);
        clusteringSkippedHotkeys = Set.copyOf(clusteringSkippedHotkeys);
        skippedNetworks          = List.copyOf(skippedNetworks);
        groups                   = List.copyOf(groups);
    }

    public static BenchmarkReport empty() {
        return new BenchmarkReport(Map.of(), Set.of(), Set.of(), List.of(), 0, List.of());
    }
}
