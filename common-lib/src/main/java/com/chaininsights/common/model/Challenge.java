package com.chaininsights.common.model;

import java.util.Map;

/**
 * A question built by an authoritative client whose answer it can compute from its own
 * ledger view. {@code payload} is sent to the miner; {@code expectedAnswer} never leaves
 * the validator.
 */
public record Challenge(
    String network,
    Map<String, Object> payload,
    String expectedAnswer,
    long blockHeight
) {
    public Challenge {
        payload = Map.copyOf(payload);
    }
}
