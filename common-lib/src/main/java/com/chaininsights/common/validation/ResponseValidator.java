package com.chaininsights.common.validation;

import com.chaininsights.common.model.DiscoveryOutput;
import com.chaininsights.common.model.MinerAxon;
import com.chaininsights.common.model.NetworkDistribution;
import com.chaininsights.common.model.TransportResponse;
import com.chaininsights.common.model.ValidationVerdict;

import java.util.Set;

/**
 * Stateless filter applied to every discovery response before any expensive round-trip is
 * spent on the miner.
 *
 * <h3>Checks (in order, first failure wins)</h3>
 * <ol>
 *   <li>Transport: failure, blacklist, timeout or a non-2xx status code.</li>
 *   <li>Structure: metadata, network, model type and both heights present; network supported;
 *       heights positive and ordered; version non-negative.</li>
 *   <li>Anti-abuse: more than the allowed number of miners on one IP, one coldkey or one
 *       indexer run id.</li>
 * </ol>
 *
 * <p>Pure function of the response and the round's {@link NetworkDistribution} snapshot.
 */
public final class ResponseValidator {

    private final AbuseThresholds thresholds;

    public ResponseValidator(AbuseThresholds thresholds) {
        this.thresholds = thresholds;
    }

    /**
     * @param response          transport result of the discovery call
     * @param axon              the miner that was queried
     * @param runId             indexer run id from the miner's metadata (nullable)
     * @param distribution      round snapshot used for multiplicity caps
     * @param supportedNetworks networks this validator has an authoritative client for
     * @return never {@code null}
     */
    public ValidationVerdict validate(TransportResponse<DiscoveryOutput> response,
                                      MinerAxon axon,
                                      String runId,
                                      NetworkDistribution distribution,
                                      Set<String> supportedNetworks) {
        ValidationVerdict transport = checkTransport(response);
        if (transport != null) return transport;

        ValidationVerdict structure = checkStructure(response.output(), supportedNetworks);
        if (structure != null) return structure;

        ValidationVerdict abuse = checkMultiplicity(axon, runId, distribution);
        if (abuse != null) return abuse;

        return ValidationVerdict.valid();
    }

    private ValidationVerdict checkTransport(TransportResponse<DiscoveryOutput> response) {
        if (response == null) {
            return ValidationVerdict.transportError(0, "no response");
        }
        if (response.failure()) {
            return ValidationVerdict.transportError(response.statusCode(), "failure: " + response.statusMessage());
        }
        if (response.blacklist()) {
            return ValidationVerdict.transportError(response.statusCode(), "blacklisted: " + response.statusMessage());
        }
        if (response.timeout()) {
            return ValidationVerdict.transportError(response.statusCode(), "timeout");
        }
        if (!response.isSuccess()) {
            return ValidationVerdict.transportError(response.statusCode(), "status " + response.statusCode());
        }
        return null;
    }

    private ValidationVerdict checkStructure(DiscoveryOutput output, Set<String> supportedNetworks) {
        if (output == null)                      return ValidationVerdict.invalid("missing output");
        if (output.metadata() == null)           return ValidationVerdict.invalid("missing metadata");

        String network = output.metadata().network();
        if (network == null || network.isBlank()) return ValidationVerdict.invalid("missing network");
        if (!supportedNetworks.contains(network)) return ValidationVerdict.invalid("unsupported network " + network);
        if (output.metadata().modelType() == null || output.metadata().modelType().isBlank()) {
            return ValidationVerdict.invalid("missing model type");
        }

        Long start = output.startBlockHeight();
        Long end   = output.blockHeight();
        if (start == null || end == null)        return ValidationVerdict.invalid("missing block heights");
        if (start <= 0 || end <= 0)              return ValidationVerdict.invalid("non-positive block height");
        if (start > end)                         return ValidationVerdict.invalid("start height above end height");
        if (output.version() != null && output.version() < 0) {
            return ValidationVerdict.invalid("negative version");
        }
        return null;
    }

    private ValidationVerdict checkMultiplicity(MinerAxon axon, String runId, NetworkDistribution distribution) {
        if (distribution.onIp(axon.ip()) > thresholds.maxMinersPerIp()) {
            return ValidationVerdict.invalid("too many miners on ip " + axon.ip());
        }
        if (distribution.onColdkey(axon.coldkey()) > thresholds.maxMinersPerColdkey()) {
            return ValidationVerdict.invalid("too many miners for coldkey " + axon.coldkey());
        }
        if (distribution.onRunId(runId) > thresholds.maxMinersPerRunId()) {
            return ValidationVerdict.invalid("too many miners sharing run id " + runId);
        }
        return null;
    }
}
