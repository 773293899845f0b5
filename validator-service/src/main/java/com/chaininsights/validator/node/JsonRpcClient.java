package com.chaininsights.validator.node;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Minimal JSON-RPC 2.0 client shared by the node implementations. A transport error, a
 * timeout or an {@code error} member in the reply all become {@link NodeUnavailableException}.
 */
public class JsonRpcClient {

    private final String network;
    private final WebClient webClient;
    private final Duration timeout;
    private final AtomicLong ids = new AtomicLong();

    public JsonRpcClient(String network, WebClient.Builder builder, String rpcUrl,
                         String user, String password, Duration timeout) {
        this.network = network;
        this.timeout = timeout;
        WebClient.Builder configured = builder.clone()
            .baseUrl(rpcUrl)
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        if (user != null && !user.isBlank()) {
            configured = configured.defaultHeaders(h -> h.setBasicAuth(user, password == null ? "" : password));
        }
        this.webClient = configured.build();
    }

    public Mono<JsonNode> call(String method, List<?> params) {
        Map<String, Object> request = Map.of(
            "jsonrpc", "2.0",
            "id", ids.incrementAndGet(),
            "method", method,
            "params", params);

        return webClient.post()
            .bodyValue(request)
            .retrieve()
            .bodyToMono(JsonNode.class)
            .timeout(timeout)
            .onErrorMap(e -> !(e instanceof NodeUnavailableException),
                        e -> new NodeUnavailableException(network, method + " failed: " + e.getMessage(), e))
            .flatMap(reply -> {
                JsonNode error = reply.get("error");
                if (error != null && !error.isNull()) {
                    return Mono.error(new NodeUnavailableException(network, method + " returned error " + error));
                }
                JsonNode result = reply.get("result");
                if (result == null || result.isNull()) {
                    return Mono.error(new NodeUnavailableException(network, method + " returned no result"));
                }
                return Mono.just(result);
            });
    }
}
