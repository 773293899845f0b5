package com.chaininsights.validator.transport;

import com.chaininsights.common.model.MinerAxon;
import com.chaininsights.common.model.TransportResponse;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Outbound request/response channel to a single miner.
 *
 * <p>Implementations never signal an error: timeouts, refusals and decoding problems are
 * folded into the returned {@link TransportResponse} flags so one bad miner cannot fail a
 * whole dispatch stage.
 */
public interface MinerTransport {

    <T> Mono<TransportResponse<T>> send(MinerAxon axon,
                                        Synapse synapse,
                                        Object body,
                                        Class<T> outputType,
                                        Duration timeout);
}
