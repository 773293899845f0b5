package com.chaininsights.validator.registry;

import com.chaininsights.common.model.MinerAxon;
import com.chaininsights.validator.config.ValidatorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;

/** Registry backed by the {@code validator.miners} list; entries without an endpoint are ignored. */
@Component
public class StaticMinerRegistry implements MinerRegistry {

    private static final Logger log = LoggerFactory.getLogger(StaticMinerRegistry.class);

    private final List<MinerAxon> axons;

    public StaticMinerRegistry(ValidatorProperties properties) {
        this.axons = properties.getMiners().stream()
            .filter(m -> m.getHotkey() != null && m.getIp() != null && m.getPort() > 0)
            .map(m -> new MinerAxon(m.getUid(), m.getHotkey(), m.getColdkey(), m.getIp(), m.getPort()))
            .toList();
        log.info("Static miner registry loaded. miners={}", axons.size());
    }

    @Override
    public Mono<List<MinerAxon>> serving() {
        return Mono.just(axons);
    }
}
