package com.chaininsights.validator.round;

import com.chaininsights.common.distribution.MinerDistributionCalculator;
import com.chaininsights.common.exception.ValidatorException;
import com.chaininsights.common.model.BenchmarkOutcome;
import com.chaininsights.common.model.CrossCheckResult;
import com.chaininsights.common.model.DiscoveryOutput;
import com.chaininsights.common.model.MinerAxon;
import com.chaininsights.common.model.MinerClaim;
import com.chaininsights.common.model.MinerMetadata;
import com.chaininsights.common.model.MinerReward;
import com.chaininsights.common.model.ScoreInput;
import com.chaininsights.common.model.TransportResponse;
import com.chaininsights.common.model.UptimeScores;
import com.chaininsights.common.model.ValidationVerdict;
import com.chaininsights.common.scoring.MinerScoreCalculator;
import com.chaininsights.common.scoring.ScoringWeights;
import com.chaininsights.common.trace.TraceContextUtil;
import com.chaininsights.common.validation.ResponseValidator;
import com.chaininsights.validator.benchmark.BenchmarkEngine;
import com.chaininsights.validator.benchmark.BenchmarkReport;
import com.chaininsights.validator.config.ValidatorProperties;
import com.chaininsights.validator.crossvalidation.CrossValidator;
import com.chaininsights.validator.node.BlockchainNode;
import com.chaininsights.validator.node.NodeRegistry;
import com.chaininsights.validator.registry.RoundSnapshot;
import com.chaininsights.validator.transport.DiscoveryRequest;
import com.chaininsights.validator.transport.MinerTransport;
import com.chaininsights.validator.transport.Synapse;
import com.chaininsights.validator.uptime.UptimeStore;
import com.chaininsights.validator.weights.MovingAverageWeightUpdater;
import com.chaininsights.validator.weights.WeightSubmitter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drives one validation round over a frozen {@link RoundSnapshot}.
 *
 * <p>Stages are barrier-synchronised: every miner finishes a stage before any miner enters
 * the next, so clustering sees a consistent set of claims.
 * <pre>
 *   discovery → response validation → cross-validation → benchmark → uptime + scoring → rewards
 * </pre>
 *
 * <p>A failure concerning one miner is folded into that miner's {@link MinerRoundStatus} and
 * never aborts the round. Failures of our own dependencies (authoritative client, metadata
 * source) leave the miner's uptime untouched.
 */
@Service
public class ValidationRoundDriver {

    private static final Logger log = LoggerFactory.getLogger(ValidationRoundDriver.class);

    private final MinerTransport transport;
    private final ResponseValidator responseValidator;
    private final CrossValidator crossValidator;
    private final BenchmarkEngine benchmarkEngine;
    private final NodeRegistry nodeRegistry;
    private final UptimeStore uptimeStore;
    private final MovingAverageWeightUpdater weightUpdater;
    private final WeightSubmitter weightSubmitter;
    private final RoundFlowLogger flowLogger;
    private final ScoringWeights scoringWeights;
    private final ValidatorProperties properties;
    private final Clock clock;

    private final AtomicReference<RoundResult> latest = new AtomicReference<>();

    public ValidationRoundDriver(MinerTransport transport,
                                 ResponseValidator responseValidator,
                                 CrossValidator crossValidator,
                                 BenchmarkEngine benchmarkEngine,
                                 NodeRegistry nodeRegistry,
                                 UptimeStore uptimeStore,
                                 MovingAverageWeightUpdater weightUpdater,
                                 WeightSubmitter weightSubmitter,
                                 RoundFlowLogger flowLogger,
                                 ScoringWeights scoringWeights,
                                 ValidatorProperties properties,
                                 Clock clock) {
        this.transport         = transport;
        this.responseValidator = responseValidator;
        this.crossValidator    = crossValidator;
        this.benchmarkEngine   = benchmarkEngine;
        this.nodeRegistry      = nodeRegistry;
        this.uptimeStore       = uptimeStore;
        this.weightUpdater     = weightUpdater;
        this.weightSubmitter   = weightSubmitter;
        this.flowLogger        = flowLogger;
        this.scoringWeights    = scoringWeights;
        this.properties        = properties;
        this.clock             = clock;
    }

    public Optional<RoundResult> latest() {
        return Optional.ofNullable(latest.get());
    }

    public Mono<RoundResult> runRound(RoundSnapshot snapshot) {
        Mono<RoundResult> pipeline = Mono.defer(() -> {
            RoundState state = new RoundState(snapshot);
            Random roundRandom = new Random(snapshot.seed());

            return Mono.just(snapshot)
                .doOnEach(flowLogger.stage(RoundFlowLogger.ROUND_STARTED))
                .flatMap(s -> discover(state))
                .doOnEach(flowLogger.stage(RoundFlowLogger.DISCOVERY_COMPLETED))
                .map(discovered -> validate(state, discovered))
                .doOnEach(flowLogger.stage(RoundFlowLogger.VALIDATION_COMPLETED))
                .flatMap(claims -> crossValidate(state, claims))
                .doOnEach(flowLogger.stage(RoundFlowLogger.CROSS_VALIDATION_COMPLETED))
                .flatMap(passed -> benchmarkEngine.run(passed, roundRandom, snapshot.seed())
                    .map(report -> applyBenchmark(state, passed, report)))
                .doOnEach(flowLogger.stage(RoundFlowLogger.BENCHMARK_COMPLETED))
                .flatMap(agreed -> recordUptime(state, agreed).then(score(state, agreed)))
                .doOnEach(flowLogger.stage(RoundFlowLogger.SCORING_COMPLETED))
                .flatMap(scored -> submitRewards(state)
                    .then(Mono.fromSupplier(() -> state.finish(clock.instant()))));
        })
        .doOnNext(result -> {
            latest.set(result);
            flowLogger.logSummary(result);
        });
        return TraceContextUtil.withRoundId(pipeline, snapshot.roundId());
    }

    // ── stage 1: discovery ───────────────────────────────────────────────────

    private Mono<List<Discovered>> discover(RoundState state) {
        List<MinerAxon> reachable = new ArrayList<>();
        for (MinerAxon axon : state.snapshot().axons()) {
            if (state.snapshot().metadata().containsKey(axon.hotkey())) {
                reachable.add(axon);
            } else {
                state.resolve(MinerRoundResult.of(axon, MinerRoundStatus.METADATA_MISSING, "no committed metadata"));
            }
        }
        DiscoveryRequest request = new DiscoveryRequest(properties.getProtocolVersion());
        return Flux.fromIterable(reachable)
            .flatMapSequential(axon -> transport
                .send(axon, Synapse.DISCOVERY, request, DiscoveryOutput.class, properties.getDiscoveryTimeout())
                .map(response -> new Discovered(axon, response)),
                properties.getTransportConcurrency())
            .collectList();
    }

    // ── stage 2: response validation ─────────────────────────────────────────

    private List<MinerClaim> validate(RoundState state, List<Discovered> discovered) {
        RoundSnapshot snapshot = state.snapshot();
        state.distribution = MinerDistributionCalculator.compute(snapshot.axons(), snapshot.metadata());
        Set<String> supported = nodeRegistry.supportedNetworks();

        List<MinerClaim> claims = new ArrayList<>();
        for (Discovered d : discovered) {
            MinerMetadata metadata = snapshot.metadata().get(d.axon().hotkey());
            ValidationVerdict verdict = responseValidator.validate(
                d.response(), d.axon(), metadata.runId(), state.distribution, supported);
            if (!verdict.isValid()) {
                TraceContextUtil.withMdc(state.roundId(), d.axon().hotkey(), () ->
                    log.info("Discovery response rejected. hotkey={} status={} reason={}",
                             d.axon().hotkey(), verdict.status(), verdict.reason()));
                state.resolve(MinerRoundResult.of(d.axon(), MinerRoundStatus.INVALID, verdict.reason()));
                continue;
            }
            DiscoveryOutput output = d.response().output();
            int version = output.version() != null ? output.version() : metadata.version();
            claims.add(new MinerClaim(d.axon(), output.metadata().network(), output.metadata().modelType(),
                                      output.startBlockHeight(), output.blockHeight(), version,
                                      d.response().processTime()));
        }
        return claims;
    }

    // ── stage 3: cross-validation ────────────────────────────────────────────

    private Mono<List<MinerClaim>> crossValidate(RoundState state, List<MinerClaim> claims) {
        Set<String> networks = new LinkedHashSet<>();
        claims.forEach(c -> networks.add(c.network()));

        return Flux.fromIterable(networks)
            .flatMap(network -> nodeRegistry.find(network)
                .map(node -> node.getCurrentBlockHeight()
                    .map(height -> Map.entry(network, height))
                    .onErrorResume(e -> {
                        log.warn("Authoritative height unavailable, skipping cross-validation. network={} reason={}",
                                 network, e.getMessage());
                        return Mono.empty();
                    }))
                .orElseGet(Mono::empty))
            .collectMap(Map.Entry::getKey, Map.Entry::getValue)
            .flatMap(heights -> {
                state.heights = heights;
                return Flux.fromIterable(claims)
                    .flatMapSequential(claim -> check(state, claim, heights), properties.getTransportConcurrency())
                    .collectList();
            })
            .map(checked -> {
                List<MinerClaim> passed = new ArrayList<>();
                for (Checked c : checked) {
                    MinerAxon axon = c.claim().axon();
                    if (c.result() == null) {
                        state.resolve(MinerRoundResult.of(axon, MinerRoundStatus.NODE_UNAVAILABLE, c.detail())
                            .withNetwork(c.claim().network()));
                        continue;
                    }
                    switch (c.result().outcome()) {
                        case PASS -> passed.add(c.claim());
                        case FAIL -> state.resolve(
                            MinerRoundResult.of(axon, MinerRoundStatus.CROSS_CHECK_FAILED, c.result().detail())
                                .withNetwork(c.claim().network())
                                .withReward(0.0));
                        case INDETERMINATE -> state.resolve(
                            MinerRoundResult.of(axon, MinerRoundStatus.INDETERMINATE, c.result().detail())
                                .withNetwork(c.claim().network()));
                    }
                }
                return passed;
            });
    }

    private Mono<Checked> check(RoundState state, MinerClaim claim, Map<String, Long> heights) {
        String roundId = state.roundId();
        Long height = heights.get(claim.network());
        Optional<BlockchainNode> node = nodeRegistry.find(claim.network());
        if (height == null || node.isEmpty()) {
            return Mono.just(new Checked(claim, null, "authoritative client unavailable for " + claim.network()));
        }
        return crossValidator.crossValidate(claim.axon(), node.get(), claim.startHeight(), claim.endHeight(), height)
            .map(result -> new Checked(claim, result, null))
            .onErrorResume(e -> e instanceof ValidatorException ve && !ve.isPenalising(), e -> {
                TraceContextUtil.withMdc(roundId, claim.hotkey(), () ->
                    log.warn("Challenge could not be built. hotkey={} reason={}", claim.hotkey(), e.getMessage()));
                return Mono.just(new Checked(claim, null, e.getMessage()));
            })
            .onErrorResume(e -> {
                TraceContextUtil.withMdc(roundId, claim.hotkey(), () ->
                    log.error("Cross-validation failed unexpectedly. hotkey={}", claim.hotkey(), e));
                return Mono.just(new Checked(claim, CrossCheckResult.indeterminate("cross-validation error"), null));
            });
    }

    // ── stage 4: benchmark ───────────────────────────────────────────────────

    private List<Agreed> applyBenchmark(RoundState state, List<MinerClaim> passed, BenchmarkReport report) {
        state.weakConsensusChunks = report.weakConsensusChunks();
        state.skippedNetworks = report.skippedNetworks();

        List<Agreed> agreed = new ArrayList<>();
        for (MinerClaim claim : passed) {
            MinerAxon axon = claim.axon();
            String hotkey = claim.hotkey();
            BenchmarkOutcome outcome = report.outcomes().get(hotkey);
            if (report.clusteringSkippedHotkeys().contains(hotkey)) {
                state.resolve(MinerRoundResult.of(axon, MinerRoundStatus.CLUSTERING_SKIPPED, "benchmark skipped for network")
                    .withNetwork(claim.network()));
            } else if (report.vacantHotkeys().contains(hotkey) || outcome == null) {
                state.resolve(MinerRoundResult.of(axon, MinerRoundStatus.BENCHMARK_VACANT, "no benchmark responders in chunk")
                    .withNetwork(claim.network()));
            } else if (!outcome.agreesWithMajority()) {
                state.resolve(MinerRoundResult.of(axon, MinerRoundStatus.BENCHMARK_DISAGREED,
                                                  outcome.output() == null ? "no benchmark answer" : "answer differs from majority")
                    .withNetwork(claim.network())
                    .withReward(0.0));
            } else {
                agreed.add(new Agreed(claim, outcome));
            }
        }
        return agreed;
    }

    // ── stage 5: uptime and scoring ──────────────────────────────────────────

    private Mono<Void> recordUptime(RoundState state, List<Agreed> agreed) {
        String roundId = state.roundId();
        Flux<Void> ups = Flux.fromIterable(agreed)
            .flatMap(a -> isolate(uptimeStore.up(a.claim().axon(), roundId), a.claim().hotkey()));
        Flux<Void> downs = Flux.fromIterable(state.resolved())
            .filter(r -> r.status().uptimeEffect() == MinerRoundStatus.UptimeEffect.DOWN)
            .flatMap(r -> isolate(uptimeStore.down(state.axon(r.hotkey()), roundId), r.hotkey()));
        return Flux.merge(ups, downs).then();
    }

    private Mono<Void> isolate(Mono<Void> write, String hotkey) {
        return write.onErrorResume(e -> {
            log.warn("Uptime write failed. hotkey={} reason={}", hotkey, e.getMessage());
            return Mono.empty();
        });
    }

    private Mono<List<MinerRoundResult>> score(RoundState state, List<Agreed> agreed) {
        ValidatorProperties.Scoring cfg = properties.getScoring();
        return Flux.fromIterable(agreed)
            .flatMapSequential(a -> uptimeStore.getUptimeScores(a.claim().hotkey())
                .onErrorResume(e -> {
                    log.warn("Uptime read failed, scoring with empty history. hotkey={} reason={}",
                             a.claim().hotkey(), e.getMessage());
                    return Mono.just(UptimeScores.none());
                })
                .map(uptime -> {
                    MinerClaim claim = a.claim();
                    double adjusted = Math.max(0.0, a.outcome().responseTime() - claim.discoveryTime());
                    double reward;
                    if (cfg.isGracePeriod() && claim.version() != cfg.getRequiredVersion()) {
                        reward = cfg.getGraceScore();
                        log.info("Grace score applied. hotkey={} version={} score={}",
                                 claim.hotkey(), claim.version(), reward);
                    } else {
                        reward = MinerScoreCalculator.calculateScore(new ScoreInput(
                            claim.network(), adjusted, claim.startHeight(), claim.endHeight(),
                            state.heights.getOrDefault(claim.network(), claim.endHeight()),
                            state.distribution, uptime.average(),
                            claim.axon().ip(), claim.axon().coldkey()), scoringWeights);
                    }
                    return MinerRoundResult
                        .of(claim.axon(), MinerRoundStatus.REWARDED, "agreed with benchmark majority")
                        .withNetwork(claim.network())
                        .withReward(reward)
                        .withAdjustedResponseTime(adjusted);
                }), properties.getTransportConcurrency())
            .collectList()
            .doOnNext(scored -> scored.forEach(state::resolve));
    }

    // ── stage 6: reward sink ─────────────────────────────────────────────────

    private Mono<Void> submitRewards(RoundState state) {
        List<MinerReward> rewards = state.finish(clock.instant()).rewards();
        if (rewards.isEmpty()) {
            log.info("No rewards this round. roundId={}", state.roundId());
            return Mono.empty();
        }
        return Mono.fromCallable(() -> weightUpdater.update(rewards))
            .flatMap(weights -> weightSubmitter.submit(state.roundId(), weights)
                .doOnSuccess(v -> flowLogger.logWithRoundId(RoundFlowLogger.REWARDS_SUBMITTED, state.roundId()))
                .onErrorResume(e -> {
                    log.warn("Weight submission failed. roundId={} reason={}", state.roundId(), e.getMessage());
                    return Mono.empty();
                }));
    }

    private record Discovered(MinerAxon axon, TransportResponse<DiscoveryOutput> response) {}

    private record Checked(MinerClaim claim, CrossCheckResult result, String detail) {}

    private record Agreed(MinerClaim claim, BenchmarkOutcome outcome) {}
}
