package com.chaininsights.common.exception;

/**
 * Base type for failures raised while running a validation round. The message is prefixed
 * with the component that failed, e.g. {@code [Node:bitcoin] getblock failed}.
 */
public class ValidatorException extends RuntimeException {
    private final String component;

    public ValidatorException(String component, String message) {
        super("[" + component + "] " + message);
        this.component = component;
    }

    public ValidatorException(String component, String message, Throwable cause) {
        super("[" + component + "] " + message, cause);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }

    /**
     * Whether this failure, raised while a miner is being checked, may count against that
     * miner. Failures of the validator's own dependencies return {@code false}: the miner gets
     * no verdict and its uptime is left untouched.
     */
    public boolean isPenalising() {
        return true;
    }
}
