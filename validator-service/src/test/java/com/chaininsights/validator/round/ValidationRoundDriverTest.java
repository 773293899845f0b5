package com.chaininsights.validator.round;

import com.chaininsights.common.exception.ValidatorException;
import com.chaininsights.common.model.BenchmarkOutcome;
import com.chaininsights.common.model.CrossCheckResult;
import com.chaininsights.common.model.DiscoveryMetadata;
import com.chaininsights.common.model.DiscoveryOutput;
import com.chaininsights.common.model.MinerAxon;
import com.chaininsights.common.model.MinerMetadata;
import com.chaininsights.common.model.TransportResponse;
import com.chaininsights.common.model.UptimeScores;
import com.chaininsights.common.scoring.ScoringWeights;
import com.chaininsights.common.validation.AbuseThresholds;
import com.chaininsights.common.validation.ResponseValidator;
import com.chaininsights.validator.benchmark.BenchmarkEngine;
import com.chaininsights.validator.benchmark.BenchmarkReport;
import com.chaininsights.validator.config.ValidatorProperties;
import com.chaininsights.validator.crossvalidation.CrossValidator;
import com.chaininsights.validator.node.BlockchainNode;
import com.chaininsights.validator.node.NodeRegistry;
import com.chaininsights.validator.node.NodeUnavailableException;
import com.chaininsights.validator.registry.RoundSnapshot;
import com.chaininsights.validator.transport.MinerTransport;
import com.chaininsights.validator.transport.Synapse;
import com.chaininsights.validator.uptime.UptimeStore;
import com.chaininsights.validator.weights.MovingAverageWeightUpdater;
import com.chaininsights.validator.weights.WeightSubmitter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Stage wiring of {@link ValidationRoundDriver}: statuses, rewards and uptime effects per miner.
 * Collaborators with their own tests are mocked.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ValidationRoundDriverTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final String ROUND = "round-1";
    private static final long TIP = 1_000;

    @Mock MinerTransport transport;
    @Mock CrossValidator crossValidator;
    @Mock BenchmarkEngine benchmarkEngine;
    @Mock BlockchainNode node;
    @Mock UptimeStore uptimeStore;
    @Mock WeightSubmitter weightSubmitter;

    private ValidatorProperties properties;
    private MovingAverageWeightUpdater weightUpdater;
    private ValidationRoundDriver driver;

    private final Map<String, MinerMetadata> metadata = new HashMap<>();

    @BeforeEach
    void setUp() {
        properties = new ValidatorProperties();
        weightUpdater = new MovingAverageWeightUpdater(properties);
        driver = new ValidationRoundDriver(
            transport,
            new ResponseValidator(AbuseThresholds.defaults()),
            crossValidator,
            benchmarkEngine,
            new NodeRegistry(Map.of("bitcoin", node)),
            uptimeStore,
            weightUpdater,
            weightSubmitter,
            new RoundFlowLogger(),
            ScoringWeights.defaults(),
            properties,
            Clock.fixed(NOW, ZoneOffset.UTC));

        when(node.network()).thenReturn("bitcoin");
        when(node.getCurrentBlockHeight()).thenReturn(Mono.just(TIP));
        when(uptimeStore.up(any(), any())).thenReturn(Mono.empty());
        when(uptimeStore.down(any(), any())).thenReturn(Mono.empty());
        when(uptimeStore.getUptimeScores(any())).thenReturn(Mono.just(new UptimeScores(0.8, 0.8, 0.8, 10)));
        when(weightSubmitter.submit(any(), any())).thenReturn(Mono.empty());
        when(benchmarkEngine.run(anyList(), any(Random.class), anyLong())).thenReturn(Mono.just(BenchmarkReport.empty()));
    }

    private static MinerAxon axon(int uid) {
        return new MinerAxon(uid, "hk" + uid, "ck" + uid, "10.0.0." + uid, 8091);
    }

    private void withMetadata(MinerAxon axon, int version) {
        metadata.put(axon.hotkey(), new MinerMetadata(axon.hotkey(), 1, 1, version, "run-" + axon.uid(), 10));
    }

    private void discovers(MinerAxon axon, TransportResponse<DiscoveryOutput> response) {
        when(transport.send(eq(axon), eq(Synapse.DISCOVERY), any(), eq(DiscoveryOutput.class), any(Duration.class)))
            .thenReturn(Mono.just(response));
    }

    private void claims(MinerAxon axon, long start, long end, int version) {
        withMetadata(axon, version);
        discovers(axon, TransportResponse.success(
            new DiscoveryOutput(new DiscoveryMetadata("bitcoin", "funds_flow"), start, end, version), 0.2));
    }

    private void crossCheck(MinerAxon axon, CrossCheckResult result) {
        when(crossValidator.crossValidate(eq(axon), eq(node), anyLong(), anyLong(), eq(TIP)))
            .thenReturn(Mono.just(result));
    }

    private void benchmark(Map<String, BenchmarkOutcome> outcomes, Set<String> vacant, Set<String> skipped) {
        when(benchmarkEngine.run(anyList(), any(Random.class), anyLong())).thenReturn(Mono.just(
            new BenchmarkReport(outcomes, vacant, skipped, skipped.isEmpty() ? List.of() : List.of("bitcoin"), 0, List.of())));
    }

    private RoundResult run(MinerAxon... axons) {
        RoundSnapshot snapshot = new RoundSnapshot(ROUND, 42L, List.of(axons), metadata, NOW);
        RoundResult[] holder = new RoundResult[1];
        StepVerifier.create(driver.runRound(snapshot))
            .assertNext(r -> holder[0] = r)
            .verifyComplete();
        return holder[0];
    }

    private static MinerRoundResult miner(RoundResult result, MinerAxon axon) {
        return result.miners().stream()
            .filter(m -> m.hotkey().equals(axon.hotkey()))
            .findFirst()
            .orElseThrow();
    }

    @Nested
    @DisplayName("happy path")
    class HappyPath {

        @Test
        @DisplayName("majority agreer → REWARDED, uptime up, weights updated")
        void rewarded() {
            MinerAxon a = axon(1);
            claims(a, 100, 999, 5);
            crossCheck(a, CrossCheckResult.pass(0.5));
            benchmark(Map.of("hk1", new BenchmarkOutcome("hk1", 1.5, "A", true)), Set.of(), Set.of());

            RoundResult result = run(a);
            MinerRoundResult m = miner(result, a);

            assertEquals(MinerRoundStatus.REWARDED, m.status());
            assertTrue(m.reward() > 0.0 && m.reward() <= 1.0);
            assertEquals(1.3, m.adjustedResponseTime(), 1e-9);
            verify(uptimeStore).up(a, ROUND);
            verify(uptimeStore, never()).down(any(), any());
            verify(weightSubmitter).submit(eq(ROUND), anyMap());
            assertTrue(weightUpdater.scores().containsKey(1));
            assertTrue(driver.latest().isPresent());
        }

        @Test
        @DisplayName("benchmark faster than discovery → adjusted response time clamps at 0")
        void adjustedTimeNonNegative() {
            MinerAxon a = axon(1);
            claims(a, 100, 999, 5);
            crossCheck(a, CrossCheckResult.pass(0.5));
            benchmark(Map.of("hk1", new BenchmarkOutcome("hk1", 0.1, "A", true)), Set.of(), Set.of());

            assertEquals(0.0, miner(run(a), a).adjustedResponseTime());
        }

        @Test
        @DisplayName("grace period → off-version miner gets the grace score")
        void gracePeriod() {
            properties.getScoring().setGracePeriod(true);
            MinerAxon a = axon(1);
            claims(a, 100, 999, 4);
            crossCheck(a, CrossCheckResult.pass(0.5));
            benchmark(Map.of("hk1", new BenchmarkOutcome("hk1", 1.5, "A", true)), Set.of(), Set.of());

            assertEquals(properties.getScoring().getGraceScore(), miner(run(a), a).reward());
        }
    }

    @Nested
    @DisplayName("discovery and validation")
    class Discovery {

        @Test
        @DisplayName("discovery timeout → INVALID, uptime down, no reward")
        void timeout() {
            MinerAxon a = axon(1);
            withMetadata(a, 5);
            discovers(a, TransportResponse.timedOut(10.0));

            MinerRoundResult m = miner(run(a), a);
            assertEquals(MinerRoundStatus.INVALID, m.status());
            assertNull(m.reward());
            verify(uptimeStore).down(a, ROUND);
            verify(crossValidator, never()).crossValidate(any(), any(), anyLong(), anyLong(), anyLong());
            verifyNoInteractions(weightSubmitter);
        }

        @Test
        @DisplayName("no metadata → METADATA_MISSING, not queried, uptime untouched")
        void metadataMissing() {
            MinerAxon a = axon(1);

            MinerRoundResult m = miner(run(a), a);
            assertEquals(MinerRoundStatus.METADATA_MISSING, m.status());
            verifyNoInteractions(transport);
            verify(uptimeStore, never()).up(any(), any());
            verify(uptimeStore, never()).down(any(), any());
        }

        @Test
        @DisplayName("one bad miner does not affect the others")
        void isolation() {
            MinerAxon good = axon(1);
            MinerAxon bad = axon(2);
            claims(good, 100, 999, 5);
            withMetadata(bad, 5);
            discovers(bad, TransportResponse.blacklisted(403, "rejected"));
            crossCheck(good, CrossCheckResult.pass(0.5));
            benchmark(Map.of("hk1", new BenchmarkOutcome("hk1", 1.0, "A", true)), Set.of(), Set.of());

            RoundResult result = run(good, bad);
            assertEquals(MinerRoundStatus.REWARDED, miner(result, good).status());
            assertEquals(MinerRoundStatus.INVALID, miner(result, bad).status());
            assertEquals(List.of("hk1", "hk2"), result.miners().stream().map(MinerRoundResult::hotkey).toList());
        }
    }

    @Nested
    @DisplayName("cross-validation")
    class CrossValidation {

        @Test
        @DisplayName("wrong challenge answer → CROSS_CHECK_FAILED, reward 0, uptime down")
        void failed() {
            MinerAxon a = axon(1);
            claims(a, 100, 999, 5);
            crossCheck(a, CrossCheckResult.fail(0.4, "wrong challenge answer"));

            MinerRoundResult m = miner(run(a), a);
            assertEquals(MinerRoundStatus.CROSS_CHECK_FAILED, m.status());
            assertEquals(0.0, m.reward());
            verify(uptimeStore).down(a, ROUND);
            assertEquals(0.0, weightUpdater.scores().get(1));
        }

        @Test
        @DisplayName("challenge timed out → INDETERMINATE, uptime down, no reward")
        void indeterminate() {
            MinerAxon a = axon(1);
            claims(a, 100, 999, 5);
            crossCheck(a, CrossCheckResult.indeterminate("no challenge answer: Timeout"));

            MinerRoundResult m = miner(run(a), a);
            assertEquals(MinerRoundStatus.INDETERMINATE, m.status());
            assertNull(m.reward());
            verify(uptimeStore).down(a, ROUND);
        }

        @Test
        @DisplayName("authoritative height unavailable → NODE_UNAVAILABLE, uptime untouched")
        void heightUnavailable() {
            when(node.getCurrentBlockHeight()).thenReturn(Mono.error(new NodeUnavailableException("bitcoin", "down")));
            MinerAxon a = axon(1);
            claims(a, 100, 999, 5);

            MinerRoundResult m = miner(run(a), a);
            assertEquals(MinerRoundStatus.NODE_UNAVAILABLE, m.status());
            verify(uptimeStore, never()).down(any(), any());
            verify(crossValidator, never()).crossValidate(any(), any(), anyLong(), anyLong(), anyLong());
        }

        @Test
        @DisplayName("challenge cannot be built → NODE_UNAVAILABLE")
        void challengeUnavailable() {
            MinerAxon a = axon(1);
            claims(a, 100, 999, 5);
            when(crossValidator.crossValidate(eq(a), eq(node), anyLong(), anyLong(), eq(TIP)))
                .thenReturn(Mono.error(new NodeUnavailableException("bitcoin", "getblock failed")));

            assertEquals(MinerRoundStatus.NODE_UNAVAILABLE, miner(run(a), a).status());
            verify(uptimeStore, never()).down(any(), any());
        }

        @Test
        @DisplayName("penalising cross-validation error → INDETERMINATE, uptime down")
        void penalisingError() {
            MinerAxon a = axon(1);
            claims(a, 100, 999, 5);
            when(crossValidator.crossValidate(eq(a), eq(node), anyLong(), anyLong(), eq(TIP)))
                .thenReturn(Mono.error(new ValidatorException("Challenge", "malformed answer")));

            MinerRoundResult m = miner(run(a), a);
            assertEquals(MinerRoundStatus.INDETERMINATE, m.status());
            assertNull(m.reward());
            verify(uptimeStore).down(a, ROUND);
        }
    }

    @Nested
    @DisplayName("benchmark")
    class Benchmark {

        @Test
        @DisplayName("disagreeing miner → BENCHMARK_DISAGREED, reward 0, uptime down")
        void disagreed() {
            MinerAxon a = axon(1);
            MinerAxon b = axon(2);
            claims(a, 100, 999, 5);
            claims(b, 100, 999, 5);
            crossCheck(a, CrossCheckResult.pass(0.5));
            crossCheck(b, CrossCheckResult.pass(0.5));
            benchmark(Map.of(
                "hk1", new BenchmarkOutcome("hk1", 1.0, "A", true),
                "hk2", new BenchmarkOutcome("hk2", 1.0, "B", false)), Set.of(), Set.of());

            RoundResult result = run(a, b);
            assertEquals(MinerRoundStatus.REWARDED, miner(result, a).status());
            assertEquals(MinerRoundStatus.BENCHMARK_DISAGREED, miner(result, b).status());
            assertEquals(0.0, miner(result, b).reward());
            verify(uptimeStore).up(a, ROUND);
            verify(uptimeStore).down(b, ROUND);
        }

        @Test
        @DisplayName("vacant chunk → BENCHMARK_VACANT, no reward, uptime down")
        void vacant() {
            MinerAxon a = axon(1);
            claims(a, 100, 999, 5);
            crossCheck(a, CrossCheckResult.pass(0.5));
            benchmark(Map.of(), Set.of("hk1"), Set.of());

            MinerRoundResult m = miner(run(a), a);
            assertEquals(MinerRoundStatus.BENCHMARK_VACANT, m.status());
            assertNull(m.reward());
            verify(uptimeStore).down(a, ROUND);
        }

        @Test
        @DisplayName("clustering skipped → CLUSTERING_SKIPPED, uptime down, network reported")
        void clusteringSkipped() {
            MinerAxon a = axon(1);
            claims(a, 100, 999, 5);
            crossCheck(a, CrossCheckResult.pass(0.5));
            benchmark(Map.of(), Set.of(), Set.of("hk1"));

            RoundResult result = run(a);
            assertEquals(MinerRoundStatus.CLUSTERING_SKIPPED, miner(result, a).status());
            assertEquals(List.of("bitcoin"), result.skippedNetworks());
            verify(uptimeStore).down(a, ROUND);
        }
    }

    @Test
    @DisplayName("uptime write failure does not fail the round")
    void uptimeFailureIsolated() {
        when(uptimeStore.down(any(), any())).thenReturn(Mono.error(new IllegalStateException("db down")));
        MinerAxon a = axon(1);
        withMetadata(a, 5);
        discovers(a, TransportResponse.timedOut(10.0));

        assertEquals(MinerRoundStatus.INVALID, miner(run(a), a).status());
    }

    @Test
    @DisplayName("status counts summarise the round")
    void countByStatus() {
        MinerAxon a = axon(1);
        MinerAxon b = axon(2);
        withMetadata(a, 5);
        discovers(a, TransportResponse.timedOut(10.0));

        RoundResult result = run(a, b);
        assertEquals(1L, result.countByStatus().get(MinerRoundStatus.INVALID));
        assertEquals(1L, result.countByStatus().get(MinerRoundStatus.METADATA_MISSING));
        assertTrue(result.rewards().isEmpty());
    }
}
