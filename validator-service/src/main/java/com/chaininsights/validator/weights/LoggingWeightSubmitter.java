package com.chaininsights.validator.weights;

import com.chaininsights.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Map;

/** Default submitter: records the weights in the log only. */
@Component
public class LoggingWeightSubmitter implements WeightSubmitter {

    private static final Logger log = LoggerFactory.getLogger(LoggingWeightSubmitter.class);

    @Override
    public Mono<Void> submit(String roundId, Map<Integer, Double> weights) {
        return Mono.fromRunnable(() -> TraceContextUtil.withMdc(roundId, () ->
            log.info("Weights ready for submission. roundId={} uids={} weights={}",
                     roundId, weights.size(), weights)));
    }
}
