package com.chaininsights.validator.node;

import com.chaininsights.validator.config.FatalConfigurationException;
import com.chaininsights.validator.config.ValidatorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** One authoritative client per configured network, keyed by network id. */
@Component
public class NodeRegistry {

    private static final Logger log = LoggerFactory.getLogger(NodeRegistry.class);

    private final Map<String, BlockchainNode> nodes;

    @Autowired
    public NodeRegistry(ValidatorProperties properties, WebClient.Builder builder) {
        Map<String, BlockchainNode> built = new LinkedHashMap<>();
        properties.getNetworks().forEach((network, cfg) -> {
            if (cfg.getType() == null || cfg.getRpcUrl() == null) {
                throw new FatalConfigurationException("network " + network + " needs type and rpc-url");
            }
            JsonRpcClient rpc = new JsonRpcClient(network, builder, cfg.getRpcUrl(),
                                                  cfg.getRpcUser(), cfg.getRpcPassword(),
                                                  properties.getNodeTimeout());
            BlockchainNode node = switch (cfg.getType()) {
                case BITCOIN  -> new BitcoinNode(network, rpc);
                case ETHEREUM -> new EthereumNode(network, rpc);
            };
            built.put(network, node);
            log.info("Authoritative client registered. network={} type={}", network, cfg.getType());
        });
        this.nodes = Collections.unmodifiableMap(built);
    }

    /** Test seam: registry over pre-built nodes. */
    public NodeRegistry(Map<String, BlockchainNode> nodes) {
        this.nodes = Map.copyOf(nodes);
    }

    public Optional<BlockchainNode> find(String network) {
        return Optional.ofNullable(nodes.get(network));
    }

    public Set<String> supportedNetworks() {
        return nodes.keySet();
    }
}
