package com.chaininsights.common.model;

/** Reward handed to the weight updater. {@code reward} must be within [0.0, 1.0]. */
public record MinerReward(int uid, String hotkey, double reward) {}
