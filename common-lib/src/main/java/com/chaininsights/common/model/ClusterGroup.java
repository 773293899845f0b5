package com.chaininsights.common.model;

import java.util.List;

/**
 * Miners of one network believed to share near-identical coverage.
 *
 * <p>{@code commonStart}/{@code commonEnd} are the minimum start and minimum end across the
 * members. {@code chunks} hold the shuffled members split into bounded-size dispatch groups.
 */
public record ClusterGroup(
    String network,
    int label,
    long commonStart,
    long commonEnd,
    List<List<MinerClaim>> chunks
) {
    public ClusterGroup {
        chunks = chunks.stream().map(List::copyOf).toList();
    }

    public int memberCount() {
        return chunks.stream().mapToInt(List::size).sum();
    }
}
