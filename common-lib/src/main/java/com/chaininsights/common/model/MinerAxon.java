package com.chaininsights.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Network-reachable identity of a registered miner as published by the registry.
 *
 * <ul>
 *   <li>{@code uid}     – slot index used by the weight updater</li>
 *   <li>{@code hotkey}  – the miner's own identity; primary key for uptime history</li>
 *   <li>{@code coldkey} – owning identity; several hotkeys may share one coldkey</li>
 *   <li>{@code ip}/{@code port} – transport endpoint</li>
 * </ul>
 */
public record MinerAxon(
    @JsonProperty("uid")     int uid,
    @JsonProperty("hotkey")  String hotkey,
    @JsonProperty("coldkey") String coldkey,
    @JsonProperty("ip")      String ip,
    @JsonProperty("port")    int port
) {
    public String endpoint() {
        return ip + ":" + port;
    }
}
