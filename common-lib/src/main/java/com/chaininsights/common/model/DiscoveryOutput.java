package com.chaininsights.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Discovery answer returned by a miner. Every field is nullable on the wire: structural
 * checks happen in {@link com.chaininsights.common.validation.ResponseValidator}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DiscoveryOutput(
    @JsonProperty("metadata")           DiscoveryMetadata metadata,
    @JsonProperty("start_block_height") Long startBlockHeight,
    @JsonProperty("block_height")       Long blockHeight,
    @JsonProperty("version")            Integer version
) {}
