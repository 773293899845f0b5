package com.chaininsights.validator.crossvalidation;

import com.chaininsights.common.model.Challenge;
import com.chaininsights.common.model.CrossCheckResult;
import com.chaininsights.common.model.MinerAxon;
import com.chaininsights.common.validation.BlockRangeValidator;
import com.chaininsights.validator.config.ValidatorProperties;
import com.chaininsights.validator.node.BlockchainNode;
import com.chaininsights.validator.transport.ChallengeRequest;
import com.chaininsights.validator.transport.MinerTransport;
import com.chaininsights.validator.transport.Synapse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Checks a miner's claimed coverage against the authoritative client.
 *
 * <p>A range that fails {@link BlockRangeValidator} fails outright without any network call.
 * Otherwise the node builds a challenge inside the part of the range that exists on the
 * authoritative chain and the miner must answer it.
 * No answer at all is {@code INDETERMINATE}; a wrong answer is {@code FAIL}.
 *
 * <p>Errors from the node are propagated as {@code NodeUnavailableException} so the caller
 * can tell "our client is down" apart from "the miner is wrong".
 */
@Component
public class CrossValidator {

    private static final Logger log = LoggerFactory.getLogger(CrossValidator.class);

    private final MinerTransport transport;
    private final ValidatorProperties properties;

    public CrossValidator(MinerTransport transport, ValidatorProperties properties) {
        this.transport = transport;
        this.properties = properties;
    }

    public Mono<CrossCheckResult> crossValidate(MinerAxon target,
                                                BlockchainNode node,
                                                long claimedStart,
                                                long claimedEnd,
                                                long currentHeight) {
        String reason = BlockRangeValidator.rejectionReason(
            claimedStart, claimedEnd, minRangeSize(node.network()), currentHeight);
        if (reason != null) {
            log.debug("Range rejected before challenge. hotkey={} start={} end={} reason={}",
                      target.hotkey(), claimedStart, claimedEnd, reason);
            return Mono.just(CrossCheckResult.fail(0.0, reason));
        }

        // The range check tolerates a few blocks past the tip; those blocks cannot be queried yet.
        long challengeEnd = Math.min(claimedEnd, currentHeight);
        return node.createChallenge(claimedStart, challengeEnd)
            .flatMap(challenge -> ask(target, node, challenge));
    }

    private Mono<CrossCheckResult> ask(MinerAxon target, BlockchainNode node, Challenge challenge) {
        ChallengeRequest request = new ChallengeRequest(challenge.network(), challenge.payload());
        return transport.send(target, Synapse.CHALLENGE, request, String.class,
                              properties.getCrossValidationTimeout())
            .map(response -> {
                if (!response.isSuccess() || !response.hasOutput()) {
                    return CrossCheckResult.indeterminate("no challenge answer: " + response.statusMessage());
                }
                boolean correct = node.validateChallengeResponseOutput(challenge, response.output());
                if (correct) {
                    return CrossCheckResult.pass(response.processTime());
                }
                log.info("Challenge answered incorrectly. hotkey={} network={} height={}",
                         target.hotkey(), challenge.network(), challenge.blockHeight());
                return CrossCheckResult.fail(response.processTime(), "wrong challenge answer");
            });
    }

    private long minRangeSize(String network) {
        ValidatorProperties.Network cfg = properties.getNetworks().get(network);
        return cfg == null ? new ValidatorProperties.Network().getMinRangeSize() : cfg.getMinRangeSize();
    }
}
