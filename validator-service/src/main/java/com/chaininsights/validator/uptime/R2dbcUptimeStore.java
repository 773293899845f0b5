package com.chaininsights.validator.uptime;

import com.chaininsights.common.model.MinerAxon;
import com.chaininsights.common.model.UptimeSample;
import com.chaininsights.common.model.UptimeScores;
import com.chaininsights.common.uptime.UptimeScoreCalculator;
import com.chaininsights.validator.config.ValidatorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;

/**
 * {@link UptimeStore} over the {@code miner_uptime_observation} table.
 *
 * <p>Writes are single-row inserts with {@code ON CONFLICT DO NOTHING}, so concurrent
 * updates for different miners never contend and a repeated update within a round is a
 * no-op. Reads load at most {@code uptime.history-limit} rows, newest first.
 */
@Component
public class R2dbcUptimeStore implements UptimeStore {

    private static final Logger log = LoggerFactory.getLogger(R2dbcUptimeStore.class);

    private final MinerUptimeObservationRepository repository;
    private final ValidatorProperties properties;
    private final Clock clock;

    public R2dbcUptimeStore(MinerUptimeObservationRepository repository,
                            ValidatorProperties properties,
                            Clock clock) {
        this.repository = repository;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public Mono<Void> up(MinerAxon miner, String roundId) {
        return record(miner, roundId, true);
    }

    @Override
    public Mono<Void> down(MinerAxon miner, String roundId) {
        return record(miner, roundId, false);
    }

    @Override
    public Mono<UptimeScores> getUptimeScores(String hotkey) {
        ValidatorProperties.Uptime cfg = properties.getUptime();
        return repository.findRecent(hotkey, Math.max(cfg.getWindow(), cfg.getHistoryLimit()))
            .map(o -> new UptimeSample(o.isUp(), o.getObservedAt()))
            .collectList()
            .map(samples -> UptimeScoreCalculator.compute(samples, cfg.getWindow(), clock.instant()));
    }

    private Mono<Void> record(MinerAxon miner, String roundId, boolean up) {
        return repository.record(miner.hotkey(), miner.uid(), up, roundId, clock.instant())
            .doOnNext(rows -> {
                if (rows == 0) {
                    log.debug("Uptime already recorded for round. hotkey={} roundId={}", miner.hotkey(), roundId);
                }
            })
            .then();
    }
}
