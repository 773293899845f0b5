package com.chaininsights.validator.transport;

import com.fasterxml.jackson.annotation.JsonProperty;

public record BenchmarkRequest(
    @JsonProperty("network") String network,
    @JsonProperty("query")   String query
) {}
