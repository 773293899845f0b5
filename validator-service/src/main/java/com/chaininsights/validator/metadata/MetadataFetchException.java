package com.chaininsights.validator.metadata;

import com.chaininsights.common.exception.ValidatorException;

/**
 * A metadata lookup failed. Transient failures (rate limits, dropped connections) are
 * retried; permanent ones skip the miner for the round straight away.
 */
public class MetadataFetchException extends ValidatorException {

    private final boolean retryable;

    public MetadataFetchException(String hotkey, String message, boolean retryable) {
        super("Metadata:" + hotkey, message);
        this.retryable = retryable;
    }

    public MetadataFetchException(String hotkey, String message, boolean retryable, Throwable cause) {
        super("Metadata:" + hotkey, message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /** A metadata gap is on the validator's side of the wire. */
    @Override
    public boolean isPenalising() {
        return false;
    }
}
