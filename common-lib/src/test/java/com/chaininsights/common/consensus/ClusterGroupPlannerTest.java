package com.chaininsights.common.consensus;

import com.chaininsights.common.model.ClusterGroup;
import com.chaininsights.common.model.MinerAxon;
import com.chaininsights.common.model.MinerClaim;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class ClusterGroupPlannerTest {

    private static MinerClaim claim(String hotkey, long start, long end) {
        return new MinerClaim(new MinerAxon(0, hotkey, "ck", "10.0.0.1", 8091),
                              "bitcoin", "funds_flow", start, end, 5, 0.1);
    }

    private final List<MinerClaim> cluster = List.of(
        claim("a", 10, 900), claim("b", 5, 950), claim("c", 12, 880), claim("d", 8, 910), claim("e", 11, 905));

    @Test
    @DisplayName("common range = min start and min end of the members")
    void commonRange() {
        ClusterGroup group = ClusterGroupPlanner.plan("bitcoin", List.of(cluster), 10, new Random(1)).get(0);
        assertEquals(5, group.commonStart());
        assertEquals(880, group.commonEnd());
    }

    @Test
    @DisplayName("5 members, chunk size 2 → chunks of 2, 2, 1")
    void chunking() {
        ClusterGroup group = ClusterGroupPlanner.plan("bitcoin", List.of(cluster), 2, new Random(1)).get(0);
        assertEquals(List.of(2, 2, 1), group.chunks().stream().map(List::size).toList());
        assertEquals(5, group.memberCount());
    }

    @Test
    @DisplayName("same round random → same shuffle")
    void reproducibleShuffle() {
        List<ClusterGroup> first  = ClusterGroupPlanner.plan("bitcoin", List.of(cluster), 2, new Random(77));
        List<ClusterGroup> second = ClusterGroupPlanner.plan("bitcoin", List.of(cluster), 2, new Random(77));
        assertEquals(first, second);
    }

    @Test
    @DisplayName("empty clusters are skipped, labels stay dense")
    void emptyClusterSkipped() {
        List<ClusterGroup> groups = ClusterGroupPlanner.plan(
            "bitcoin", List.of(List.of(), cluster), 3, new Random(1));
        assertEquals(1, groups.size());
        assertEquals(0, groups.get(0).label());
    }

    @Test
    @DisplayName("non-positive chunk size → IllegalArgumentException")
    void invalidChunkSize() {
        assertThrows(IllegalArgumentException.class,
            () -> ClusterGroupPlanner.plan("bitcoin", List.of(cluster), 0, new Random(1)));
    }
}
