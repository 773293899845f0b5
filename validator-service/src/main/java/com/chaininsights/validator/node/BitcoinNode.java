package com.chaininsights.validator.node;

import com.chaininsights.common.model.Challenge;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Bitcoin Core JSON-RPC client.
 *
 * <p>A challenge names one transaction of a random block in the claimed range by its total
 * input value, total output value and the last four characters of its txid. A miner that
 * really indexed the range can return the full txid.
 */
public class BitcoinNode implements BlockchainNode {

    private static final Logger log = LoggerFactory.getLogger(BitcoinNode.class);

    private final String network;
    private final JsonRpcClient rpc;

    public BitcoinNode(String network, JsonRpcClient rpc) {
        this.network = network;
        this.rpc = rpc;
    }

    @Override
    public String network() {
        return network;
    }

    @Override
    public Mono<Long> getCurrentBlockHeight() {
        return rpc.call("getblockcount", List.of()).map(JsonNode::asLong);
    }

    @Override
    public Mono<Challenge> createChallenge(long start, long end) {
        Random random = ThreadLocalRandom.current();
        long height = start + (long) (random.nextDouble() * (end - start + 1));
        return rpc.call("getblockhash", List.of(height))
            .flatMap(hash -> rpc.call("getblock", List.of(hash.asText(), 2)))
            .flatMap(block -> {
                JsonNode tx = pickTransaction(block.path("tx"), random);
                if (tx == null) {
                    return Mono.error(new NodeUnavailableException(network, "block " + height + " has no transactions"));
                }
                String txid = tx.path("txid").asText();
                Map<String, Object> payload = Map.of(
                    "in_total_amount", inputTotal(tx),
                    "out_total_amount", outputTotal(tx),
                    "tx_id_last_4_chars", txid.substring(Math.max(0, txid.length() - 4)));
                log.debug("Bitcoin challenge created. height={} txidSuffix={}", height, payload.get("tx_id_last_4_chars"));
                return Mono.just(new Challenge(network, payload, txid, height));
            });
    }

    @Override
    public boolean validateChallengeResponseOutput(Challenge challenge, String output) {
        if (output == null || challenge.expectedAnswer() == null) return false;
        return challenge.expectedAnswer().trim().equalsIgnoreCase(output.trim());
    }

    /** Prefers a non-coinbase transaction; falls back to the coinbase for single-tx blocks. */
    private static JsonNode pickTransaction(JsonNode txs, Random random) {
        if (!txs.isArray() || txs.isEmpty()) return null;
        List<JsonNode> candidates = new ArrayList<>();
        for (JsonNode tx : txs) {
            if (!isCoinbase(tx)) candidates.add(tx);
        }
        if (candidates.isEmpty()) return txs.get(0);
        return candidates.get(random.nextInt(candidates.size()));
    }

    private static boolean isCoinbase(JsonNode tx) {
        JsonNode vin = tx.path("vin");
        return vin.isArray() && !vin.isEmpty() && vin.get(0).has("coinbase");
    }

    /** Sum of prevout values; verbosity 2 exposes them under {@code vin[].prevout.value}. */
    static BigDecimal inputTotal(JsonNode tx) {
        BigDecimal total = BigDecimal.ZERO;
        for (JsonNode in : tx.path("vin")) {
            JsonNode value = in.path("prevout").path("value");
            if (value.isNumber()) total = total.add(value.decimalValue());
        }
        return total;
    }

    static BigDecimal outputTotal(JsonNode tx) {
        BigDecimal total = BigDecimal.ZERO;
        for (JsonNode out : tx.path("vout")) {
            JsonNode value = out.path("value");
            if (value.isNumber()) total = total.add(value.decimalValue());
        }
        return total;
    }
}
