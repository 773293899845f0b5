package com.chaininsights.validator.transport;

import com.chaininsights.common.model.MinerAxon;
import com.chaininsights.common.model.TransportResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * HTTP transport: {@code POST http://{ip}:{port}/{Synapse}} with a JSON body.
 *
 * <p>401/403 are reported as blacklisted, any other status of 400 or above as a failure,
 * a missed deadline as a 408 timeout. The elapsed time is measured around the exchange.
 */
@Component
public class WebClientMinerTransport implements MinerTransport {

    private static final Logger log = LoggerFactory.getLogger(WebClientMinerTransport.class);

    private final WebClient webClient;

    public WebClientMinerTransport(WebClient minerWebClient) {
        this.webClient = minerWebClient;
    }

    @Override
    public <T> Mono<TransportResponse<T>> send(MinerAxon axon,
                                               Synapse synapse,
                                               Object body,
                                               Class<T> outputType,
                                               Duration timeout) {
        String uri = "http://" + axon.endpoint() + "/" + synapse.wireName();
        return Mono.defer(() -> {
            long started = System.nanoTime();
            return webClient.post()
                .uri(uri)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchangeToMono(response -> {
                    int status = response.statusCode().value();
                    if (status == 401 || status == 403) {
                        return response.releaseBody()
                            .thenReturn(TransportResponse.<T>blacklisted(status, "rejected by miner"));
                    }
                    if (status >= 400) {
                        return response.releaseBody()
                            .thenReturn(TransportResponse.<T>failed(status, "status " + status, elapsed(started)));
                    }
                    return response.bodyToMono(outputType)
                        .map(output -> TransportResponse.success(output, elapsed(started)))
                        .defaultIfEmpty(TransportResponse.failed(status, "empty body", elapsed(started)));
                })
                .timeout(timeout)
                .onErrorResume(TimeoutException.class, e -> {
                    log.debug("Miner call timed out. hotkey={} synapse={}", axon.hotkey(), synapse);
                    return Mono.just(TransportResponse.timedOut(elapsed(started)));
                })
                .onErrorResume(e -> {
                    log.debug("Miner call failed. hotkey={} synapse={} reason={}",
                              axon.hotkey(), synapse, e.getMessage());
                    return Mono.just(TransportResponse.failed(503, e.getClass().getSimpleName(), elapsed(started)));
                });
        });
    }

    private static double elapsed(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000_000.0;
    }
}
