package com.chaininsights.validator.controller;

import com.chaininsights.common.model.UptimeScores;
import com.chaininsights.validator.round.RoundAlreadyRunningException;
import com.chaininsights.validator.round.RoundResult;
import com.chaininsights.validator.round.RoundTrigger;
import com.chaininsights.validator.round.ValidationRoundDriver;
import com.chaininsights.validator.uptime.UptimeStore;
import com.chaininsights.validator.weights.MovingAverageWeightUpdater;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/validator")
public class ValidatorController {

    private static final Logger log = LoggerFactory.getLogger(ValidatorController.class);

    private final RoundTrigger roundTrigger;
    private final ValidationRoundDriver roundDriver;
    private final MovingAverageWeightUpdater weightUpdater;
    private final UptimeStore uptimeStore;

    public ValidatorController(RoundTrigger roundTrigger,
                               ValidationRoundDriver roundDriver,
                               MovingAverageWeightUpdater weightUpdater,
                               UptimeStore uptimeStore) {
        this.roundTrigger  = roundTrigger;
        this.roundDriver   = roundDriver;
        this.weightUpdater = weightUpdater;
        this.uptimeStore   = uptimeStore;
    }

    @PostMapping("/rounds/trigger")
    public Mono<ResponseEntity<RoundResult>> trigger() {
        log.info("Manual round trigger received");
        return roundTrigger.trigger()
            .map(ResponseEntity::ok)
            .onErrorResume(RoundAlreadyRunningException.class,
                           e -> Mono.just(ResponseEntity.status(HttpStatus.CONFLICT).<RoundResult>build()))
            .doOnError(e -> log.error("Round trigger endpoint error", e));
    }

    @GetMapping("/rounds/latest")
    public ResponseEntity<RoundResult> latestRound() {
        return roundDriver.latest()
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping("/weights")
    public ResponseEntity<Map<Integer, Double>> weights() {
        return ResponseEntity.ok(weightUpdater.scores());
    }

    @GetMapping("/uptime/{hotkey}")
    public Mono<ResponseEntity<UptimeScores>> uptime(@PathVariable String hotkey) {
        log.info("Uptime query received. hotkey={}", hotkey);
        return uptimeStore.getUptimeScores(hotkey)
            .map(ResponseEntity::ok)
            .doOnError(e -> log.error("Uptime endpoint error. hotkey={}", hotkey, e));
    }
}
