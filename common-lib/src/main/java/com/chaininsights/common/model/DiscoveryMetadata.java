package com.chaininsights.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record DiscoveryMetadata(
    @JsonProperty("network")   String network,
    @JsonProperty("modelType") String modelType
) {}
