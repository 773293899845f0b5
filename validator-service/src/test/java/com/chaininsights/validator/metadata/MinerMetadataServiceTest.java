package com.chaininsights.validator.metadata;

import com.chaininsights.common.model.MinerAxon;
import com.chaininsights.common.model.MinerMetadata;
import com.chaininsights.validator.config.ValidatorProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MinerMetadataServiceTest {

    @Mock MinerMetadataSource source;

    private MinerMetadataService service;

    @BeforeEach
    void setUp() {
        ValidatorProperties properties = new ValidatorProperties();
        properties.getMetadata().setBackoff(Duration.ofMillis(1));
        properties.getMetadata().setMaxAttempts(3);
        properties.getMetadata().setTimeout(Duration.ofSeconds(2));
        service = new MinerMetadataService(source, properties);
    }

    private static MinerAxon axon(int uid) {
        return new MinerAxon(uid, "hk" + uid, "ck", "10.0.0." + uid, 8091);
    }

    private static MinerMetadata metadata(int uid) {
        return new MinerMetadata("hk" + uid, 1, 1, 5, "run-" + uid, 100);
    }

    @Test
    @DisplayName("transient failure is retried, then the miner is included")
    void retriesTransient() {
        when(source.fetch(axon(1))).thenReturn(
            Mono.error(new MetadataFetchException("hk1", "rate limited", true)),
            Mono.just(metadata(1)));

        StepVerifier.create(service.fetchAll(List.of(axon(1))))
            .assertNext(snapshot -> assertEquals(metadata(1), snapshot.get("hk1")))
            .verifyComplete();
        verify(source, times(2)).fetch(axon(1));
    }

    @Test
    @DisplayName("transient failure on every attempt → miner skipped after max attempts")
    void exhaustsAttempts() {
        when(source.fetch(axon(1))).thenReturn(Mono.error(new MetadataFetchException("hk1", "rate limited", true)));

        StepVerifier.create(service.fetchAll(List.of(axon(1))))
            .assertNext(snapshot -> assertTrue(snapshot.isEmpty()))
            .verifyComplete();
        verify(source, times(3)).fetch(axon(1));
    }

    @Test
    @DisplayName("permanent failure → skipped without retry; other miners unaffected")
    void permanentFailure() {
        when(source.fetch(axon(1))).thenReturn(Mono.error(new MetadataFetchException("hk1", "malformed", false)));
        when(source.fetch(axon(2))).thenReturn(Mono.just(metadata(2)));

        StepVerifier.create(service.fetchAll(List.of(axon(1), axon(2))))
            .assertNext(snapshot -> {
                assertFalse(snapshot.containsKey("hk1"));
                assertTrue(snapshot.containsKey("hk2"));
            })
            .verifyComplete();
        verify(source, times(1)).fetch(axon(1));
    }

    @Test
    @DisplayName("no committed metadata → miner absent from snapshot")
    void nothingCommitted() {
        when(source.fetch(axon(1))).thenReturn(Mono.empty());

        StepVerifier.create(service.fetchAll(List.of(axon(1))))
            .assertNext(snapshot -> assertTrue(snapshot.isEmpty()))
            .verifyComplete();
    }

    @Test
    @DisplayName("at most 3 lookups in flight")
    void boundedConcurrency() {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        when(source.fetch(any())).thenAnswer(inv -> {
            MinerAxon axon = inv.getArgument(0);
            return Mono.delay(Duration.ofMillis(20))
                .doOnSubscribe(s -> peak.accumulateAndGet(inFlight.incrementAndGet(), Math::max))
                .doFinally(s -> inFlight.decrementAndGet())
                .thenReturn(metadata(axon.uid()));
        });

        List<MinerAxon> axons = new ArrayList<>();
        for (int i = 1; i <= 10; i++) axons.add(axon(i));

        StepVerifier.create(service.fetchAll(axons))
            .assertNext(snapshot -> assertEquals(10, snapshot.size()))
            .verifyComplete();
        assertTrue(peak.get() <= 3, "peak concurrency was " + peak.get());
    }
}
