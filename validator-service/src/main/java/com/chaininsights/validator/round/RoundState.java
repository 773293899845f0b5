package com.chaininsights.validator.round;

import com.chaininsights.common.model.MinerAxon;
import com.chaininsights.common.model.NetworkDistribution;
import com.chaininsights.validator.registry.RoundSnapshot;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable working set of one round. Only touched between stages, after each stage's
 * dispatches have all completed.
 */
final class RoundState {

    private final RoundSnapshot snapshot;
    private final Map<String, MinerAxon> axons = new LinkedHashMap<>();
    private final Map<String, MinerRoundResult> results = new HashMap<>();

    NetworkDistribution distribution = NetworkDistribution.empty();
    Map<String, Long> heights = Map.of();
    int weakConsensusChunks;
    List<String> skippedNetworks = List.of();

    RoundState(RoundSnapshot snapshot) {
        this.snapshot = snapshot;
        for (MinerAxon axon : snapshot.axons()) {
            axons.put(axon.hotkey(), axon);
        }
    }

    RoundSnapshot snapshot() {
        return snapshot;
    }

    String roundId() {
        return snapshot.roundId();
    }

    MinerAxon axon(String hotkey) {
        return axons.get(hotkey);
    }

    void resolve(MinerRoundResult result) {
        results.put(result.hotkey(), result);
    }

    List<MinerRoundResult> resolved() {
        return new ArrayList<>(results.values());
    }

    RoundResult finish(Instant finishedAt) {
        List<MinerRoundResult> ordered = new ArrayList<>();
        for (String hotkey : axons.keySet()) {
            MinerRoundResult result = results.get(hotkey);
            if (result != null) ordered.add(result);
        }
        return new RoundResult(snapshot.roundId(), snapshot.seed(), snapshot.startedAt(), finishedAt,
                               ordered, weakConsensusChunks, skippedNetworks);
    }
}
