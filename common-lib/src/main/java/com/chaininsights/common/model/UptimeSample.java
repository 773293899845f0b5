package com.chaininsights.common.model;

import java.time.Instant;

/** One up/down observation of a miner. */
public record UptimeSample(boolean up, Instant observedAt) {}
