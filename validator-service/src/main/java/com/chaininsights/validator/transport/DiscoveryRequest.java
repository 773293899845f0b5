package com.chaininsights.validator.transport;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Discovery carries only the validator's protocol version. */
public record DiscoveryRequest(@JsonProperty("version") int version) {}
