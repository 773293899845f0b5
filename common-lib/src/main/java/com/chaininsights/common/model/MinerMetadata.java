package com.chaininsights.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Metadata a miner committed to the chain: network and model ids, software version and the
 * run id of its indexer. Read-only snapshot, refreshed once per round.
 */
public record MinerMetadata(
    @JsonProperty("hotkey")           String hotkey,
    @JsonProperty("network")          int network,
    @JsonProperty("modelType")        int modelType,
    @JsonProperty("version")          int version,
    @JsonProperty("runId")            String runId,
    @JsonProperty("committedAtBlock") long committedAtBlock
) {}
