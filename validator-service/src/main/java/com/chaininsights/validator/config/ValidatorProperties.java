package com.chaininsights.validator.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Externally loaded validator configuration ({@code validator.*} in application.yml).
 */
@Data
@ConfigurationProperties(prefix = "validator")
public class ValidatorProperties {

    /** Protocol version this validator speaks. */
    private int protocolVersion = 5;

    /** Lowest protocol version the network still accepts; checked at startup. */
    private int minProtocolVersion = 5;

    private boolean enforceUpgrade = true;

    /** Runs rounds on a timer; when off, rounds only start through the API. */
    private boolean schedulerEnabled = true;

    /** Miners sampled per round. */
    private int sampleSize = 16;

    private Duration roundInterval = Duration.ofMinutes(2);

    private Duration discoveryTimeout = Duration.ofSeconds(10);

    private Duration crossValidationTimeout = Duration.ofSeconds(10);

    private Duration benchmarkTimeout = Duration.ofSeconds(30);

    /** Timeout for every JSON-RPC call to an authoritative client. */
    private Duration nodeTimeout = Duration.ofSeconds(15);

    /** Concurrent outbound miner calls per pipeline stage. */
    private int transportConcurrency = 16;

    private AntiAbuse antiAbuse = new AntiAbuse();

    private Benchmark benchmark = new Benchmark();

    private Scoring scoring = new Scoring();

    private Uptime uptime = new Uptime();

    private MetadataFetch metadata = new MetadataFetch();

    private Weights weights = new Weights();

    /** Network id → authoritative client and per-network settings. */
    private Map<String, Network> networks = new LinkedHashMap<>();

    /** Static miner registry used when no external registry is wired. */
    private List<Miner> miners = new ArrayList<>();

    @Data
    public static class Network {
        private NetworkType type;
        private String rpcUrl;
        private String rpcUser;
        private String rpcPassword;
        /** Minimum inclusive width of a claimed range, and the challenge sample width. */
        private long minRangeSize = 20;
        /** Benchmark query with {@code {start}}, {@code {end}} and {@code {diff}} placeholders. */
        private String benchmarkQueryTemplate;
    }

    @Data
    public static class AntiAbuse {
        private int maxMinersPerIp = 9;
        private int maxMinersPerColdkey = 9;
        private int maxMinersPerRunId = 9;
    }

    @Data
    public static class Benchmark {
        private int clusterCount = 4;
        private int chunkSize = 8;
        private int diffMin = 1;
        private int diffMax = 100;
    }

    @Data
    public static class Scoring {
        private double timeWeight = 0.25;
        private double coverageWeight = 0.25;
        private double recencyWeight = 0.15;
        private double distributionWeight = 0.10;
        private double uptimeWeight = 0.25;
        private double maxResponseTime = 30.0;
        private long recencyWindow = 100;
        private double crowdingPenalty = 0.5;
        /** While set, miners not on {@code requiredVersion} get {@code graceScore} instead of a computed score. */
        private boolean gracePeriod = false;
        private int requiredVersion = 5;
        private double graceScore = 0.05;
    }

    @Data
    public static class Uptime {
        /** Recent observations the rolling average is taken over. */
        private int window = 100;
        /** Observations loaded per read; bounds the daily/weekly windows. */
        private int historyLimit = 2016;
    }

    @Data
    public static class MetadataFetch {
        private int concurrency = 3;
        private int maxAttempts = 3;
        private Duration backoff = Duration.ofSeconds(12);
        private Duration timeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Weights {
        /** Moving-average factor: {@code score = alpha * reward + (1 - alpha) * score}. */
        private double alpha = 0.9;
    }

    @Data
    public static class Miner {
        private int uid;
        private String hotkey;
        private String coldkey;
        private String ip;
        private int port;
        private String network;
        private String modelType = "funds_flow";
        private int version = 5;
        private String runId;
    }
}
