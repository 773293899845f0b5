package com.chaininsights.validator.metadata;

import com.chaininsights.common.model.MinerAxon;
import com.chaininsights.common.model.MinerMetadata;
import reactor.core.publisher.Mono;

/**
 * Reader of the metadata each miner committed to the chain.
 *
 * <p>Completes empty when the miner has committed nothing; signals
 * {@link MetadataFetchException} when the lookup itself failed.
 */
public interface MinerMetadataSource {

    Mono<MinerMetadata> fetch(MinerAxon axon);
}
