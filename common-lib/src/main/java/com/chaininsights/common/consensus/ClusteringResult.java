package com.chaininsights.common.consensus;

import com.chaininsights.common.model.MinerClaim;

import java.util.List;

/**
 * Output of {@link CoverageClusterer}. When {@code skipped} is set the network gets no
 * benchmark this round and {@code clusters} is empty.
 */
public record ClusteringResult(boolean skipped, String reason, List<List<MinerClaim>> clusters) {

    public ClusteringResult {
        clusters = clusters.stream().map(List::copyOf).toList();
    }

    public static ClusteringResult skip(String reason) {
        return new ClusteringResult(true, reason, List.of());
    }

    public static ClusteringResult of(List<List<MinerClaim>> clusters) {
        return new ClusteringResult(false, null, clusters);
    }
}
