package com.chaininsights.validator.uptime;

import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;

@Repository
public interface MinerUptimeObservationRepository
        extends ReactiveCrudRepository<MinerUptimeObservation, Long> {

    /**
     * Appends an observation unless the miner already has one for this round.
     *
     * @return rows inserted: 1, or 0 when the round was already recorded
     */
    @Modifying
    @Query("""
        INSERT INTO miner_uptime_observation (hotkey, uid, is_up, round_id, observed_at)
        VALUES (:hotkey, :uid, :up, :roundId, :observedAt)
        ON CONFLICT (hotkey, round_id) DO NOTHING
        """)
    Mono<Integer> record(String hotkey, int uid, boolean up, String roundId, Instant observedAt);

    @Query("""
        SELECT * FROM miner_uptime_observation
        WHERE hotkey = :hotkey
        ORDER BY observed_at DESC, id DESC
        LIMIT :limit
        """)
    Flux<MinerUptimeObservation> findRecent(String hotkey, int limit);
}
