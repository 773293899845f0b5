package com.chaininsights.validator.round;

import com.chaininsights.common.exception.ValidatorException;

public class RoundAlreadyRunningException extends ValidatorException {

    public RoundAlreadyRunningException() {
        super("RoundTrigger", "a validation round is already running");
    }
}
