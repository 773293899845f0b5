package com.chaininsights.validator.registry;

import com.chaininsights.common.model.MinerAxon;
import reactor.core.publisher.Mono;

import java.util.List;

/** Source of the miners currently registered and serving. */
public interface MinerRegistry {

    Mono<List<MinerAxon>> serving();
}
