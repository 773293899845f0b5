package com.chaininsights.validator.round;

import com.chaininsights.validator.registry.RoundSnapshotFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single entry point for starting a round, shared by the scheduler and the API. At most one
 * round runs at a time; a trigger while a round is in flight is refused.
 */
@Service
public class RoundTrigger {

    private static final Logger log = LoggerFactory.getLogger(RoundTrigger.class);

    private final RoundSnapshotFactory snapshotFactory;
    private final ValidationRoundDriver driver;
    private final AtomicBoolean running = new AtomicBoolean();

    public RoundTrigger(RoundSnapshotFactory snapshotFactory, ValidationRoundDriver driver) {
        this.snapshotFactory = snapshotFactory;
        this.driver = driver;
    }

    /**
     * @return the finished round, or {@link RoundAlreadyRunningException} if another round is in flight
     */
    public Mono<RoundResult> trigger() {
        return Mono.defer(() -> {
            if (!running.compareAndSet(false, true)) {
                return Mono.error(new RoundAlreadyRunningException());
            }
            return snapshotFactory.next()
                .doOnNext(s -> log.info("Round snapshot taken. roundId={} miners={} seed={}",
                                        s.roundId(), s.axons().size(), s.seed()))
                .flatMap(driver::runRound)
                .doFinally(signal -> running.set(false));
        });
    }

    public boolean isRunning() {
        return running.get();
    }
}
