package com.chaininsights.validator.registry;

import com.chaininsights.common.model.MinerAxon;
import com.chaininsights.common.model.MinerMetadata;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Immutable inputs of one validation round. {@code seed} drives every random choice the
 * round makes, so a round can be replayed from its snapshot.
 */
public record RoundSnapshot(
    String roundId,
    long seed,
    List<MinerAxon> axons,
    Map<String, MinerMetadata> metadata,
    Instant startedAt
) {
    public RoundSnapshot {
        axons    = List.copyOf(axons);
        metadata = Map.copyOf(metadata);
    }
}
