package com.chaininsights.common.validation;

/**
 * Hard multiplicity caps applied before any miner response is trusted.
 * A response is rejected when strictly more miners than the cap share the same key.
 */
public record AbuseThresholds(int maxMinersPerIp, int maxMinersPerColdkey, int maxMinersPerRunId) {

    public static final int DEFAULT_MAX_MULTIPLE = 9;

    public static AbuseThresholds defaults() {
        return new AbuseThresholds(DEFAULT_MAX_MULTIPLE, DEFAULT_MAX_MULTIPLE, DEFAULT_MAX_MULTIPLE);
    }
}
