package com.chaininsights.common.consensus;

import java.util.List;

/**
 * Immutable output of a {@link ConsensusEngine} run.
 *
 * <p>Fields:
 * <ul>
 *   <li>{@code majorityValue}: the value treated as ground truth; {@code null} when nobody answered</li>
 *   <li>{@code majorityCount}: number of voters that returned {@code majorityValue}</li>
 *   <li>{@code responders}: number of voters with a non-null answer</li>
 *   <li>{@code agreeing}: voters whose answer equals {@code majorityValue}, in vote order</li>
 *   <li>{@code disagreeing}: everyone else, non-responders included, in vote order</li>
 * </ul>
 */
public record ConsensusResult<T>(
    T majorityValue,
    int majorityCount,
    int responders,
    List<String> agreeing,
    List<String> disagreeing
) {
    public ConsensusResult {
        agreeing    = List.copyOf(agreeing);
        disagreeing = List.copyOf(disagreeing);
    }

    /** No responder at all: the group yields no ground truth this round. */
    public boolean isVacant() {
        return responders == 0;
    }

    /** A single responder agrees with itself. */
    public boolean isWeak() {
        return responders == 1;
    }
}
