package com.chaininsights.common.consensus;

import com.chaininsights.common.model.ClusterGroup;
import com.chaininsights.common.model.MinerClaim;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Turns clustering output into dispatchable {@link ClusterGroup}s.
 *
 * <p>For every cluster:
 * <ol>
 *   <li>{@code commonStart} = min start, {@code commonEnd} = min end across members: the widest
 *       range every member is expected to cover.</li>
 *   <li>Members are shuffled with the round-scoped {@link Random}.</li>
 *   <li>The shuffled list is split into chunks of at most {@code chunkSize} members.</li>
 * </ol>
 */
public final class ClusterGroupPlanner {

    private ClusterGroupPlanner() {}

    public static List<ClusterGroup> plan(String network, List<List<MinerClaim>> clusters,
                                          int chunkSize, Random random) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive, was " + chunkSize);
        }
        List<ClusterGroup> groups = new ArrayList<>();
        int label = 0;
        for (List<MinerClaim> members : clusters) {
            if (members.isEmpty()) continue;

            long commonStart = members.stream().mapToLong(MinerClaim::startHeight).min().getAsLong();
            long commonEnd   = members.stream().mapToLong(MinerClaim::endHeight).min().getAsLong();

            List<MinerClaim> shuffled = new ArrayList<>(members);
            Collections.shuffle(shuffled, random);

            List<List<MinerClaim>> chunks = new ArrayList<>();
            for (int i = 0; i < shuffled.size(); i += chunkSize) {
                chunks.add(shuffled.subList(i, Math.min(i + chunkSize, shuffled.size())));
            }
            groups.add(new ClusterGroup(network, label++, commonStart, commonEnd, chunks));
        }
        return groups;
    }
}
