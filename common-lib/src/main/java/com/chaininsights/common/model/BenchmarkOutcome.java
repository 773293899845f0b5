package com.chaininsights.common.model;

/**
 * Per-miner result of the shared benchmark query. {@code output} is {@code null} for
 * miners that did not answer; they never agree with the majority.
 */
public record BenchmarkOutcome(
    String hotkey,
    double responseTime,
    String output,
    boolean agreesWithMajority
) {}
