package com.chaininsights.validator.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Refuses to start a validator whose protocol version the network no longer accepts.
 *
 * <p>Under {@code enforce-upgrade} a stale version is fatal; otherwise it is only logged.
 * Also rejects configurations that cannot produce a meaningful round (no networks, empty
 * moving-average factor, a grace score outside [0, 1], inverted benchmark diff bounds).
 */
@Component
public class ProtocolVersionGuard {

    private static final Logger log = LoggerFactory.getLogger(ProtocolVersionGuard.class);

    private final ValidatorProperties properties;

    public ProtocolVersionGuard(ValidatorProperties properties) {
        this.properties = properties;
    }

    @PostConstruct
    public void verify() {
        int version = properties.getProtocolVersion();
        int minimum = properties.getMinProtocolVersion();
        if (version < minimum) {
            if (properties.isEnforceUpgrade()) {
                throw new FatalConfigurationException(
                    "protocol version " + version + " is below required " + minimum + "; upgrade the validator");
            }
            log.warn("Protocol version below network minimum. version={} minimum={}", version, minimum);
        }

        if (properties.getNetworks().isEmpty()) {
            throw new FatalConfigurationException("no networks configured");
        }
        double alpha = properties.getWeights().getAlpha();
        if (alpha <= 0.0 || alpha > 1.0) {
            throw new FatalConfigurationException("weights.alpha must be in (0, 1], was " + alpha);
        }
        double graceScore = properties.getScoring().getGraceScore();
        if (graceScore < 0.0 || graceScore > 1.0) {
            throw new FatalConfigurationException("scoring.grace-score must be in [0, 1], was " + graceScore);
        }
        ValidatorProperties.Benchmark benchmark = properties.getBenchmark();
        if (benchmark.getDiffMin() > benchmark.getDiffMax()) {
            throw new FatalConfigurationException("benchmark.diff-min must not exceed benchmark.diff-max");
        }
        log.info("Validator configuration accepted. protocolVersion={} networks={}",
                 version, properties.getNetworks().keySet());
    }
}
