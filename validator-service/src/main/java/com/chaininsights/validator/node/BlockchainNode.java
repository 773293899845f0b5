package com.chaininsights.validator.node;

import com.chaininsights.common.model.Challenge;
import reactor.core.publisher.Mono;

/**
 * Authoritative view of one network's ledger. Every failure surfaces as a
 * {@link NodeUnavailableException} error signal.
 */
public interface BlockchainNode {

    String network();

    Mono<Long> getCurrentBlockHeight();

    /** Builds a challenge from a random block within {@code [start, end]}. */
    Mono<Challenge> createChallenge(long start, long end);

    boolean validateChallengeResponseOutput(Challenge challenge, String output);
}
