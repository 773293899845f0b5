package com.chaininsights.validator.registry;

import com.chaininsights.common.model.MinerAxon;
import com.chaininsights.validator.config.ValidatorProperties;
import com.chaininsights.validator.metadata.MinerMetadataService;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Samples up to {@code sample-size} serving miners and freezes them with their metadata into a
 * {@link RoundSnapshot}.
 */
@Component
public class RoundSnapshotFactory {

    private final MinerRegistry registry;
    private final MinerMetadataService metadataService;
    private final ValidatorProperties properties;
    private final Clock clock;

    public RoundSnapshotFactory(MinerRegistry registry,
                                MinerMetadataService metadataService,
                                ValidatorProperties properties,
                                Clock clock) {
        this.registry = registry;
        this.metadataService = metadataService;
        this.properties = properties;
        this.clock = clock;
    }

    public Mono<RoundSnapshot> next() {
        return next(ThreadLocalRandom.current().nextLong());
    }

    public Mono<RoundSnapshot> next(long seed) {
        String roundId = UUID.randomUUID().toString();
        return registry.serving()
            .map(axons -> sample(axons, properties.getSampleSize(), new Random(seed)))
            .flatMap(sampled -> metadataService.fetchAll(sampled)
                .map(metadata -> new RoundSnapshot(roundId, seed, sampled, metadata, clock.instant())));
    }

    static List<MinerAxon> sample(List<MinerAxon> axons, int size, Random random) {
        List<MinerAxon> copy = new ArrayList<>(axons);
        Collections.shuffle(copy, random);
        return copy.subList(0, Math.min(Math.max(0, size), copy.size()));
    }
}
