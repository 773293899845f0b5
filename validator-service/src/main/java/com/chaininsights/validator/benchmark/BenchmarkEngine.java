package com.chaininsights.validator.benchmark;

import com.chaininsights.common.consensus.ClusterGroupPlanner;
import com.chaininsights.common.consensus.ClusteringResult;
import com.chaininsights.common.consensus.ConsensusEngine;
import com.chaininsights.common.consensus.ConsensusResult;
import com.chaininsights.common.consensus.CoverageClusterer;
import com.chaininsights.common.consensus.Vote;
import com.chaininsights.common.model.BenchmarkOutcome;
import com.chaininsights.common.model.ClusterGroup;
import com.chaininsights.common.model.MinerClaim;
import com.chaininsights.common.model.TransportResponse;
import com.chaininsights.validator.config.ValidatorProperties;
import com.chaininsights.validator.transport.BenchmarkRequest;
import com.chaininsights.validator.transport.MinerTransport;
import com.chaininsights.validator.transport.Synapse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.TreeMap;

/**
 * Runs the shared benchmark query over groups of miners with similar coverage and takes the
 * majority answer of each chunk as ground truth.
 *
 * <p>Pipeline per round:
 * <ol>
 *   <li>group passed claims by network (sorted, so random draws are reproducible)</li>
 *   <li>cluster each network's claims on (start, end) with {@link CoverageClusterer}</li>
 *   <li>plan shuffled, bounded chunks with {@link ClusterGroupPlanner}</li>
 *   <li>build every chunk's query up front, then dispatch chunks one after another;
 *       members of a chunk are queried concurrently</li>
 *   <li>vote each chunk with the {@link ConsensusEngine}</li>
 * </ol>
 */
@Component
public class BenchmarkEngine {

    private static final Logger log = LoggerFactory.getLogger(BenchmarkEngine.class);

    private final MinerTransport transport;
    private final ConsensusEngine consensusEngine;
    private final BenchmarkQueryFactory queryFactory;
    private final ValidatorProperties properties;

    public BenchmarkEngine(MinerTransport transport,
                           ConsensusEngine consensusEngine,
                           BenchmarkQueryFactory queryFactory,
                           ValidatorProperties properties) {
        this.transport = transport;
        this.consensusEngine = consensusEngine;
        this.queryFactory = queryFactory;
        this.properties = properties;
    }

    public Mono<BenchmarkReport> run(List<MinerClaim> passed, Random roundRandom, long seed) {
        if (passed.isEmpty()) {
            return Mono.just(BenchmarkReport.empty());
        }

        Map<String, List<MinerClaim>> byNetwork = new TreeMap<>();
        for (MinerClaim claim : passed) {
            byNetwork.computeIfAbsent(claim.network(), n -> new ArrayList<>()).add(claim);
        }

        ValidatorProperties.Benchmark cfg = properties.getBenchmark();
        List<ChunkJob> jobs = new ArrayList<>();
        List<ClusterGroup> groups = new ArrayList<>();
        List<String> skippedNetworks = new ArrayList<>();
        Set<String> skippedHotkeys = new HashSet<>();

        byNetwork.forEach((network, claims) -> {
            if (!queryFactory.supports(network)) {
                skip(network, claims, "no benchmark query configured", skippedNetworks, skippedHotkeys);
                return;
            }
            ClusteringResult clustering = CoverageClusterer.cluster(claims, cfg.getClusterCount(), seed);
            if (clustering.skipped()) {
                skip(network, claims, clustering.reason(), skippedNetworks, skippedHotkeys);
                return;
            }
            for (ClusterGroup group : ClusterGroupPlanner.plan(network, clustering.clusters(), cfg.getChunkSize(), roundRandom)) {
                groups.add(group);
                for (List<MinerClaim> chunk : group.chunks()) {
                    String query = queryFactory.create(network, group.commonStart(), group.commonEnd(), roundRandom);
                    jobs.add(new ChunkJob(network, group.label(), chunk, query));
                }
            }
        });

        return Flux.fromIterable(jobs)
            .concatMap(this::dispatch)
            .collectList()
            .map(results -> assemble(results, skippedNetworks, skippedHotkeys, groups));
    }

    private Mono<ChunkResult> dispatch(ChunkJob job) {
        BenchmarkRequest request = new BenchmarkRequest(job.network(), job.query());
        return Flux.fromIterable(job.members())
            .flatMapSequential(claim -> transport
                .send(claim.axon(), Synapse.BENCHMARK, request, String.class, properties.getBenchmarkTimeout())
                .map(response -> toVote(claim, response)),
                properties.getTransportConcurrency())
            .collectList()
            .map(votes -> new ChunkResult(job, votes, consensusEngine.compute(votes)));
    }

    private static Vote<String> toVote(MinerClaim claim, TransportResponse<String> response) {
        String output = response.isSuccess() ? response.output() : null;
        if (output != null && output.isBlank()) output = null;
        return new Vote<>(claim.hotkey(), output, response.processTime());
    }

    private BenchmarkReport assemble(List<ChunkResult> results,
                                     List<String> skippedNetworks,
                                     Set<String> skippedHotkeys,
                                     List<ClusterGroup> groups) {
        Map<String, BenchmarkOutcome> outcomes = new HashMap<>();
        Set<String> vacant = new HashSet<>();
        int weak = 0;

        for (ChunkResult result : results) {
            ConsensusResult<String> consensus = result.consensus();
            if (consensus.isVacant()) {
                result.job().members().forEach(c -> vacant.add(c.hotkey()));
                log.info("Benchmark chunk vacant. network={} cluster={} members={}",
                         result.job().network(), result.job().label(), result.job().members().size());
                continue;
            }
            if (consensus.isWeak()) {
                weak++;
                log.warn("Benchmark chunk decided by a single responder. network={} cluster={} members={}",
                         result.job().network(), result.job().label(), result.job().members().size());
            }
            Set<String> agreeing = new HashSet<>(consensus.agreeing());
            for (Vote<String> vote : result.votes()) {
                outcomes.put(vote.voter(), new BenchmarkOutcome(
                    vote.voter(), vote.responseTime(), vote.value(), agreeing.contains(vote.voter())));
            }
            log.debug("Benchmark chunk voted. network={} cluster={} responders={} majority={}",
                      result.job().network(), result.job().label(),
                      consensus.responders(), consensus.majorityCount());
        }
        return new BenchmarkReport(outcomes, vacant, skippedHotkeys, skippedNetworks, weak, groups);
    }

    private static void skip(String network, List<MinerClaim> claims, String reason,
                             List<String> skippedNetworks, Set<String> skippedHotkeys) {
        log.info("Benchmark skipped for network. network={} miners={} reason={}", network, claims.size(), reason);
        skippedNetworks.add(network);
        claims.forEach(c -> skippedHotkeys.add(c.hotkey()));
    }

    private record ChunkJob(String network, int label, List<MinerClaim> members, String query) {}

    private record ChunkResult(ChunkJob job, List<Vote<String>> votes, ConsensusResult<String> consensus) {}
}
