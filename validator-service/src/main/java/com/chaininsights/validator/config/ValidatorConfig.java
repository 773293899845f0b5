package com.chaininsights.validator.config;

import com.chaininsights.common.consensus.ConsensusEngine;
import com.chaininsights.common.consensus.MajorityVoteConsensus;
import com.chaininsights.common.scoring.ScoringWeights;
import com.chaininsights.common.validation.AbuseThresholds;
import com.chaininsights.common.validation.ResponseValidator;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.netty.channel.ChannelOption;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(ValidatorProperties.class)
public class ValidatorConfig {

    /** Upper bound on a buffered miner reply; benchmark answers can be large. */
    @Value("${validator.http.max-in-memory-size:4194304}")
    private int maxInMemorySize;

    @Value("${validator.http.connect-timeout-ms:5000}")
    private int connectTimeoutMillis;

    /**
     * Shared client for miner calls. Per-call deadlines are applied by the transport, so only
     * the connect timeout is fixed here.
     */
    @Bean
    public WebClient minerWebClient(WebClient.Builder builder) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMillis);

        return builder
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(maxInMemorySize))
            .filter(loggingFilter())
            .build();
    }

    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            LoggerFactory.getLogger(ValidatorConfig.class)
                .debug("Outbound miner request: {} {}", clientRequest.method(), clientRequest.url());
            return Mono.just(clientRequest);
        });
    }

    @Bean
    public ConsensusEngine consensusEngine() {
        return new MajorityVoteConsensus();
    }

    @Bean
    public ResponseValidator responseValidator(ValidatorProperties properties) {
        ValidatorProperties.AntiAbuse caps = properties.getAntiAbuse();
        return new ResponseValidator(new AbuseThresholds(
            caps.getMaxMinersPerIp(), caps.getMaxMinersPerColdkey(), caps.getMaxMinersPerRunId()));
    }

    @Bean
    public ScoringWeights scoringWeights(ValidatorProperties properties) {
        ValidatorProperties.Scoring s = properties.getScoring();
        return new ScoringWeights(
            s.getTimeWeight(), s.getCoverageWeight(), s.getRecencyWeight(),
            s.getDistributionWeight(), s.getUptimeWeight(),
            s.getMaxResponseTime(), s.getRecencyWindow(), s.getCrowdingPenalty());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
