package com.chaininsights.validator.round;

import com.chaininsights.common.model.MinerReward;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one validation round, miners in sampling order.
 */
public record RoundResult(
    String roundId,
    long seed,
    Instant startedAt,
    Instant finishedAt,
    List<MinerRoundResult> miners,
    int weakConsensusChunks,
    List<String> skippedNetworks
) {
    public RoundResult {
        miners          = List.copyOf(miners);
        skippedNetworks = List.copyOf(skippedNetworks);
    }

    public Map<MinerRoundStatus, Long> countByStatus() {
        Map<MinerRoundStatus, Long> counts = new EnumMap<>(MinerRoundStatus.class);
        for (MinerRoundResult miner : miners) {
            counts.merge(miner.status(), 1L, Long::sum);
        }
        return counts;
    }

    public List<MinerReward> rewards() {
        return miners.stream()
            .filter(MinerRoundResult::isRewarded)
            .map(m -> new MinerReward(m.uid(), m.hotkey(), m.reward()))
            .toList();
    }
}
