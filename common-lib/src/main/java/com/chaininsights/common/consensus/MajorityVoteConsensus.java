package com.chaininsights.common.consensus;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Plain majority vote over answer equality.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Count each distinct non-null answer, remembering first-seen order.</li>
 *   <li>The most frequent answer wins; on an exact tie the first-seen answer wins.</li>
 *   <li>Voters whose answer equals the winner agree; everyone else (non-responders included)
 *       disagrees.</li>
 * </ol>
 *
 * <p>This class is stateless and thread-safe.
 */
public class MajorityVoteConsensus implements ConsensusEngine {

    @Override
    public <T> ConsensusResult<T> compute(List<Vote<T>> votes) {
        Map<T, Integer> counts = new LinkedHashMap<>();
        for (Vote<T> vote : votes) {
            if (vote.answered()) {
                counts.merge(vote.value(), 1, Integer::sum);
            }
        }

        T majority = null;
        int majorityCount = 0;
        int responders = 0;
        for (Map.Entry<T, Integer> entry : counts.entrySet()) {
            responders += entry.getValue();
            // strictly greater keeps the first-seen value on ties
            if (entry.getValue() > majorityCount) {
                majority      = entry.getKey();
                majorityCount = entry.getValue();
            }
        }

        List<String> agreeing    = new ArrayList<>();
        List<String> disagreeing = new ArrayList<>();
        for (Vote<T> vote : votes) {
            if (majority != null && majority.equals(vote.value())) {
                agreeing.add(vote.voter());
            } else {
                disagreeing.add(vote.voter());
            }
        }

        return new ConsensusResult<>(majority, majorityCount, responders, agreeing, disagreeing);
    }
}
