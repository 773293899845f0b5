package com.chaininsights.validator.metadata;

import com.chaininsights.common.distribution.NetworkIds;
import com.chaininsights.common.model.MinerAxon;
import com.chaininsights.common.model.MinerMetadata;
import com.chaininsights.validator.config.ValidatorProperties;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/** Metadata taken from the {@code validator.miners} list. */
@Component
public class ConfiguredMinerMetadataSource implements MinerMetadataSource {

    private final Map<String, MinerMetadata> byHotkey;

    public ConfiguredMinerMetadataSource(ValidatorProperties properties) {
        this.byHotkey = properties.getMiners().stream()
            .filter(m -> m.getHotkey() != null && m.getNetwork() != null)
            .map(m -> new MinerMetadata(
                m.getHotkey(),
                NetworkIds.idOf(m.getNetwork()),
                NetworkIds.modelIdOf(m.getModelType()),
                m.getVersion(),
                m.getRunId(),
                0L))
            .collect(Collectors.toUnmodifiableMap(MinerMetadata::hotkey, Function.identity(), (a, b) -> b));
    }

    @Override
    public Mono<MinerMetadata> fetch(MinerAxon axon) {
        return Mono.justOrEmpty(byHotkey.get(axon.hotkey()));
    }
}
