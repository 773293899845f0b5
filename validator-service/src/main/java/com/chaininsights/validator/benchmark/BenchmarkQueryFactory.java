package com.chaininsights.validator.benchmark;

import com.chaininsights.validator.config.ValidatorProperties;
import org.springframework.stereotype.Component;

import java.util.Random;

/**
 * Fills a network's benchmark query template. Each chunk gets its own {@code diff} drawn from
 * {@code [diffMin, diffMax]}, so miners cannot cache answers across chunks.
 */
@Component
public class BenchmarkQueryFactory {

    private final ValidatorProperties properties;

    public BenchmarkQueryFactory(ValidatorProperties properties) {
        this.properties = properties;
    }

    public boolean supports(String network) {
        ValidatorProperties.Network cfg = properties.getNetworks().get(network);
        return cfg != null && cfg.getBenchmarkQueryTemplate() != null && !cfg.getBenchmarkQueryTemplate().isBlank();
    }

    /**
     * @throws IllegalArgumentException when the network has no query template
     */
    public String create(String network, long commonStart, long commonEnd, Random random) {
        if (!supports(network)) {
            throw new IllegalArgumentException("no benchmark query template for network " + network);
        }
        ValidatorProperties.Benchmark bounds = properties.getBenchmark();
        int diff = bounds.getDiffMin() + random.nextInt(bounds.getDiffMax() - bounds.getDiffMin() + 1);
        return properties.getNetworks().get(network).getBenchmarkQueryTemplate()
            .replace("{start}", Long.toString(commonStart))
            .replace("{end}", Long.toString(commonEnd))
            .replace("{diff}", Integer.toString(diff));
    }
}
