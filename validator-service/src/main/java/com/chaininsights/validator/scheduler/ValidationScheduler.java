package com.chaininsights.validator.scheduler;

import com.chaininsights.validator.config.ValidatorProperties;
import com.chaininsights.validator.round.RoundAlreadyRunningException;
import com.chaininsights.validator.round.RoundTrigger;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Runs a validation round every {@code validator.round-interval}.
 *
 * <pre>
 *   delay(interval) → trigger round → reschedule
 * </pre>
 *
 * <p>Each cycle is a fresh {@link Mono} whose terminal {@code subscribe} schedules the next
 * one, so no stream nests and no thread blocks during the wait. The loop never stops: a
 * failed round is logged and the next one is scheduled as usual.
 */
@Component
@ConditionalOnProperty(prefix = "validator", name = "scheduler-enabled", havingValue = "true", matchIfMissing = true)
public class ValidationScheduler {

    private static final Logger log = LoggerFactory.getLogger(ValidationScheduler.class);

    private final RoundTrigger roundTrigger;
    private final Duration interval;

    private volatile Disposable current;
    private volatile boolean stopped;

    public ValidationScheduler(RoundTrigger roundTrigger, ValidatorProperties properties) {
        this.roundTrigger = roundTrigger;
        this.interval = properties.getRoundInterval();
    }

    @PostConstruct
    public void start() {
        log.info("Validation scheduler started. intervalSeconds={}", interval.toSeconds());
        scheduleNextRound(interval);
    }

    @PreDestroy
    public void stop() {
        stopped = true;
        Disposable running = current;
        if (running != null) running.dispose();
    }

    private void scheduleNextRound(Duration delay) {
        if (stopped) return;
        current = Mono.delay(delay)
            .then(roundTrigger.trigger())
            .subscribe(
                result -> log.info("Scheduled round finished. roundId={} miners={} rewarded={}",
                                   result.roundId(), result.miners().size(), result.rewards().size()),
                err -> {
                    if (err instanceof RoundAlreadyRunningException) {
                        log.info("Previous round still running, skipping this cycle");
                    } else {
                        log.error("Scheduled round failed, rescheduling", err);
                    }
                    scheduleNextRound(interval);
                },
                () -> scheduleNextRound(interval)
            );
    }
}
