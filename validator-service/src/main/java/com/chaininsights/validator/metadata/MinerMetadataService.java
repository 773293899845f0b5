package com.chaininsights.validator.metadata;

import com.chaininsights.common.model.MinerAxon;
import com.chaininsights.common.model.MinerMetadata;
import com.chaininsights.validator.config.ValidatorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.util.Collection;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Loads the round's metadata snapshot.
 *
 * <p>At most {@code metadata.concurrency} lookups run at once. A retryable failure is retried
 * with a fixed {@code metadata.backoff} up to {@code metadata.max-attempts} attempts in total.
 * A miner whose lookup still fails is left out of the snapshot and reported as
 * metadata-missing by the round driver; the round itself always completes.
 */
@Service
public class MinerMetadataService {

    private static final Logger log = LoggerFactory.getLogger(MinerMetadataService.class);

    private final MinerMetadataSource source;
    private final ValidatorProperties properties;

    public MinerMetadataService(MinerMetadataSource source, ValidatorProperties properties) {
        this.source = source;
        this.properties = properties;
    }

    public Mono<Map<String, MinerMetadata>> fetchAll(Collection<MinerAxon> axons) {
        ValidatorProperties.MetadataFetch cfg = properties.getMetadata();
        return Flux.fromIterable(axons)
            .flatMap(axon -> fetchOne(axon, cfg), Math.max(1, cfg.getConcurrency()))
            .collectMap(MinerMetadata::hotkey)
            .doOnNext(snapshot -> log.info("Metadata snapshot loaded. requested={} loaded={}",
                                           axons.size(), snapshot.size()));
    }

    private Mono<MinerMetadata> fetchOne(MinerAxon axon, ValidatorProperties.MetadataFetch cfg) {
        return Mono.defer(() -> source.fetch(axon))
            .timeout(cfg.getTimeout())
            .retryWhen(Retry.fixedDelay(Math.max(0, cfg.getMaxAttempts() - 1), cfg.getBackoff())
                .filter(MinerMetadataService::isRetryable)
                .doBeforeRetry(s -> log.debug("Retrying metadata lookup. hotkey={} attempt={} reason={}",
                                              axon.hotkey(), s.totalRetries() + 2, s.failure().getMessage())))
            .onErrorResume(e -> {
                log.warn("Metadata lookup failed, skipping miner this round. hotkey={} reason={}",
                         axon.hotkey(), e.getMessage());
                return Mono.empty();
            });
    }

    static boolean isRetryable(Throwable e) {
        return e instanceof TimeoutException
            || (e instanceof MetadataFetchException mfe && mfe.isRetryable());
    }
}
