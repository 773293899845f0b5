package com.chaininsights.validator.uptime;

import com.chaininsights.common.model.MinerAxon;
import com.chaininsights.common.model.UptimeScores;
import reactor.core.publisher.Mono;

/**
 * Durable per-miner availability history. A miner is recorded at most once per round; the
 * first observation of a round wins.
 */
public interface UptimeStore {

    Mono<Void> up(MinerAxon miner, String roundId);

    Mono<Void> down(MinerAxon miner, String roundId);

    /** Scores for a miner with no history are all zero. */
    Mono<UptimeScores> getUptimeScores(String hotkey);
}
