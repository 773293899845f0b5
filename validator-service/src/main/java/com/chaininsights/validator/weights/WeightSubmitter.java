package com.chaininsights.validator.weights;

import reactor.core.publisher.Mono;

import java.util.Map;

/** Hands the current per-uid scores to whatever publishes weights for the network. */
public interface WeightSubmitter {

    Mono<Void> submit(String roundId, Map<Integer, Double> weights);
}
