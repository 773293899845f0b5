package com.chaininsights.common.consensus;

import java.util.List;

/**
 * Strategy contract for deriving ground truth from the answers of mutually distrusting peers.
 *
 * <p>Implementations must be:
 * <ul>
 *   <li><b>Stateless</b>: safe to call concurrently</li>
 *   <li><b>Deterministic</b>: the same vote list always produces the same result</li>
 *   <li><b>Non-null</b>: a vote list without responders yields a vacant result, never {@code null}</li>
 * </ul>
 *
 * <p>Current implementation: {@link MajorityVoteConsensus}.
 */
public interface ConsensusEngine {

    <T> ConsensusResult<T> compute(List<Vote<T>> votes);
}
