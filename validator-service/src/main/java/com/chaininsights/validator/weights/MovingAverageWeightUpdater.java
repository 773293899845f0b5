package com.chaininsights.validator.weights;

import com.chaininsights.common.model.MinerReward;
import com.chaininsights.validator.config.ValidatorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Folds per-round rewards into long-lived per-uid scores:
 * {@code score[uid] = alpha * reward + (1 - alpha) * score[uid]}, unseen uids starting at 0.
 *
 * <p>A batch is validated before any score changes, so a contract violation leaves the
 * scores untouched.
 */
@Component
public class MovingAverageWeightUpdater {

    private static final Logger log = LoggerFactory.getLogger(MovingAverageWeightUpdater.class);

    private final double alpha;
    private final Map<Integer, Double> scores = new TreeMap<>();

    public MovingAverageWeightUpdater(ValidatorProperties properties) {
        this(properties.getWeights().getAlpha());
    }

    MovingAverageWeightUpdater(double alpha) {
        if (alpha <= 0.0 || alpha > 1.0) {
            throw new IllegalArgumentException("alpha must be in (0, 1], was " + alpha);
        }
        this.alpha = alpha;
    }

    /**
     * @return a copy of every score after the update
     * @throws IllegalArgumentException if any reward is outside [0, 1] or not a number
     */
    public synchronized Map<Integer, Double> update(List<MinerReward> rewards) {
        for (MinerReward reward : rewards) {
            double r = reward.reward();
            if (Double.isNaN(r) || r < 0.0 || r > 1.0) {
                throw new IllegalArgumentException(
                    "reward for uid " + reward.uid() + " outside [0, 1]: " + r);
            }
        }
        for (MinerReward reward : rewards) {
            double previous = scores.getOrDefault(reward.uid(), 0.0);
            scores.put(reward.uid(), alpha * reward.reward() + (1.0 - alpha) * previous);
        }
        log.debug("Moving-average scores updated. rewards={} tracked={}", rewards.size(), scores.size());
        return scores();
    }

    public synchronized Map<Integer, Double> scores() {
        return Collections.unmodifiableMap(new TreeMap<>(scores));
    }
}
