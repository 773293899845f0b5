package com.chaininsights.common.distribution;

import java.util.Map;

/** Numeric network and model ids used in compact on-chain metadata. */
public final class NetworkIds {

    public static final String BITCOIN  = "bitcoin";
    public static final String ETHEREUM = "ethereum";

    private static final Map<Integer, String> NAMES = Map.of(
        1, BITCOIN,
        2, ETHEREUM
    );

    public static final String FUNDS_FLOW = "funds_flow";

    private static final Map<Integer, String> MODELS = Map.of(
        1, FUNDS_FLOW
    );

    private NetworkIds() {}

    public static String nameOf(int id) {
        return NAMES.getOrDefault(id, "unknown-" + id);
    }

    public static int idOf(String network) {
        return NAMES.entrySet().stream()
            .filter(e -> e.getValue().equals(network))
            .map(Map.Entry::getKey)
            .findFirst()
            .orElse(0);
    }

    public static int modelIdOf(String modelType) {
        return MODELS.entrySet().stream()
            .filter(e -> e.getValue().equals(modelType))
            .map(Map.Entry::getKey)
            .findFirst()
            .orElse(0);
    }
}
