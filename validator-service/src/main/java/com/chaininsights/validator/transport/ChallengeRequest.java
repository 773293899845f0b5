package com.chaininsights.validator.transport;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record ChallengeRequest(
    @JsonProperty("network")   String network,
    @JsonProperty("challenge") Map<String, Object> challenge
) {}
