package com.chaininsights.validator.node;

import com.chaininsights.common.model.Challenge;
import com.fasterxml.jackson.databind.JsonNode;
import org.apache.commons.codec.digest.DigestUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Ethereum JSON-RPC client.
 *
 * <p>A challenge is the SHA-256 checksum of {@code blockNumber:from:to:value} for one
 * transaction of a random block in the claimed range; the expected answer is that
 * transaction's hash. Empty blocks are skipped by re-drawing up to {@link #MAX_DRAWS} times.
 */
public class EthereumNode implements BlockchainNode {

    private static final Logger log = LoggerFactory.getLogger(EthereumNode.class);

    static final int MAX_DRAWS = 5;

    private final String network;
    private final JsonRpcClient rpc;

    public EthereumNode(String network, JsonRpcClient rpc) {
        this.network = network;
        this.rpc = rpc;
    }

    @Override
    public String network() {
        return network;
    }

    @Override
    public Mono<Long> getCurrentBlockHeight() {
        return rpc.call("eth_blockNumber", List.of()).map(n -> parseQuantity(n.asText()));
    }

    @Override
    public Mono<Challenge> createChallenge(long start, long end) {
        return draw(start, end, 1);
    }

    private Mono<Challenge> draw(long start, long end, int attempt) {
        long height = start + (long) (ThreadLocalRandom.current().nextDouble() * (end - start + 1));
        return rpc.call("eth_getBlockByNumber", List.of("0x" + Long.toHexString(height), true))
            .flatMap(block -> {
                JsonNode txs = block.path("transactions");
                if (!txs.isArray() || txs.isEmpty()) {
                    if (attempt >= MAX_DRAWS) {
                        return Mono.error(new NodeUnavailableException(
                            network, "no transactions found in " + MAX_DRAWS + " sampled blocks"));
                    }
                    return draw(start, end, attempt + 1);
                }
                JsonNode tx = txs.get(ThreadLocalRandom.current().nextInt(txs.size()));
                String checksum = checksum(height, tx.path("from").asText(),
                                           tx.path("to").asText(""), tx.path("value").asText("0x0"));
                log.debug("Ethereum challenge created. height={} attempt={}", height, attempt);
                return Mono.just(new Challenge(network, Map.of("checksum", checksum),
                                               tx.path("hash").asText(), height));
            });
    }

    @Override
    public boolean validateChallengeResponseOutput(Challenge challenge, String output) {
        if (output == null || challenge.expectedAnswer() == null) return false;
        return normalise(challenge.expectedAnswer()).equals(normalise(output));
    }

    static String checksum(long blockNumber, String from, String to, String value) {
        return DigestUtils.sha256Hex(blockNumber + ":" + from + ":" + to + ":" + value);
    }

    static String normalise(String hash) {
        String h = hash.trim().toLowerCase(Locale.ROOT);
        return h.startsWith("0x") ? h.substring(2) : h;
    }

    static long parseQuantity(String hex) {
        String digits = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
        return Long.parseLong(digits, 16);
    }
}
