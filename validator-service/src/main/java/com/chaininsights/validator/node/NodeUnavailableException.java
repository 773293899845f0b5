package com.chaininsights.validator.node;

import com.chaininsights.common.exception.ValidatorException;

/**
 * The validator's own authoritative client could not answer. Never a reason to penalise
 * the miner being checked.
 */
public class NodeUnavailableException extends ValidatorException {

    public NodeUnavailableException(String network, String message) {
        super("Node:" + network, message);
    }

    public NodeUnavailableException(String network, String message, Throwable cause) {
        super("Node:" + network, message, cause);
    }

    @Override
    public boolean isPenalising() {
        return false;
    }
}
