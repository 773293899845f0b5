package com.chaininsights.validator.round;

import com.chaininsights.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Logs each stage a validation round passes through. Pure side effect; never changes the
 * pipeline.
 *
 * <p>Stages, in order:
 * <ol>
 *   <li>{@link #ROUND_STARTED}</li>
 *   <li>{@link #DISCOVERY_COMPLETED}</li>
 *   <li>{@link #VALIDATION_COMPLETED}</li>
 *   <li>{@link #CROSS_VALIDATION_COMPLETED}</li>
 *   <li>{@link #BENCHMARK_COMPLETED}</li>
 *   <li>{@link #SCORING_COMPLETED}</li>
 *   <li>{@link #ROUND_COMPLETED}</li>
 * </ol>
 *
 * <pre>
 *     .doOnEach(roundFlowLogger.stage(RoundFlowLogger.BENCHMARK_COMPLETED))
 * </pre>
 */
@Component
public class RoundFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(RoundFlowLogger.class);

    public static final String ROUND_STARTED              = "ROUND_STARTED";
    public static final String DISCOVERY_COMPLETED        = "DISCOVERY_COMPLETED";
    public static final String VALIDATION_COMPLETED       = "VALIDATION_COMPLETED";
    public static final String CROSS_VALIDATION_COMPLETED = "CROSS_VALIDATION_COMPLETED";
    public static final String BENCHMARK_COMPLETED        = "BENCHMARK_COMPLETED";
    public static final String SCORING_COMPLETED          = "SCORING_COMPLETED";
    public static final String REWARDS_SUBMITTED          = "REWARDS_SUBMITTED";
    public static final String ROUND_COMPLETED            = "ROUND_COMPLETED";

    /**
     * {@code doOnEach} consumer logging the stage on {@code onNext}. The round id is read from
     * the Reactor Context carried by the signal.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String roundId = TraceContextUtil.getRoundId(signal.getContextView());
            TraceContextUtil.withMdc(roundId, () ->
                log.info("[RoundFlow] stage={} roundId={}", stageName, roundId)
            );
        };
    }

    public void logWithRoundId(String stageName, String roundId) {
        TraceContextUtil.withMdc(roundId, () ->
            log.info("[RoundFlow] stage={} roundId={}", stageName, roundId)
        );
    }

    /** One summary line per finished round. */
    public void logSummary(RoundResult result) {
        TraceContextUtil.withMdc(result.roundId(), () ->
            log.info("[RoundFlow] stage={} roundId={} miners={} rewarded={} statuses={} "
                     + "weakConsensusChunks={} skippedNetworks={}",
                     ROUND_COMPLETED, result.roundId(), result.miners().size(),
                     result.rewards().size(), result.countByStatus(),
                     result.weakConsensusChunks(), result.skippedNetworks())
        );
    }
}
