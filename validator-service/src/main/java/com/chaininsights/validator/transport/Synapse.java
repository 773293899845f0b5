package com.chaininsights.validator.transport;

/** Request kinds a miner serves. The wire name is the last path segment of the miner endpoint. */
public enum Synapse {
    DISCOVERY("Discovery"),
    CHALLENGE("Challenge"),
    BENCHMARK("Benchmark");

    private final String wireName;

    Synapse(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
