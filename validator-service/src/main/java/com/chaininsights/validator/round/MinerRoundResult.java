package com.chaininsights.validator.round;

import com.chaininsights.common.model.MinerAxon;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Final per-miner record of a round. {@code reward} is {@code null} when the miner received no
 * reward this round (as opposed to a reward of {@code 0.0}).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MinerRoundResult(
    int uid,
    String hotkey,
    String network,
    MinerRoundStatus status,
    String detail,
    Double reward,
    Double adjustedResponseTime
) {
    public static MinerRoundResult of(MinerAxon axon, MinerRoundStatus status, String detail) {
        return new MinerRoundResult(axon.uid(), axon.hotkey(), null, status, detail, null, null);
    }

    public MinerRoundResult withNetwork(String network) {
        return new MinerRoundResult(uid, hotkey, network, status, detail, reward, adjustedResponseTime);
    }

    public MinerRoundResult withReward(double reward) {
        return new MinerRoundResult(uid, hotkey, network, status, detail, reward, adjustedResponseTime);
    }

    public MinerRoundResult withAdjustedResponseTime(double seconds) {
        return new MinerRoundResult(uid, hotkey, network, status, detail, reward, seconds);
    }

    public boolean isRewarded() {
        return reward != null;
    }
}
