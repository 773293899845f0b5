package com.chaininsights.validator.config;

import com.chaininsights.common.exception.ValidatorException;

/** Configuration the validator must not run with. Aborts application startup. */
public class FatalConfigurationException extends ValidatorException {

    public FatalConfigurationException(String message) {
        super("Configuration", message);
    }
}
