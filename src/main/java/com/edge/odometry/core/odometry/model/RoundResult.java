package com.edge.odometry.core.odometry.model;

import java.util.Collections;
import java.util.Map;

/**
 * 单轮一致性估计结果
 * <p>
 * confidence = 与众数相同的试验数 / 本轮试验总数
 */
public class RoundResult {
    private final DisplacementVector mode;
    private final double confidence;
    private final int trials;
    private final Map<DisplacementVector, Integer> votes;

    public RoundResult(DisplacementVector mode, double confidence, int trials,
                       Map<DisplacementVector, Integer> votes) {
        this.mode = mode;
        this.confidence = confidence;
        this.trials = trials;
        this.votes = Collections.unmodifiableMap(votes);
    }

    public DisplacementVector getMode() {
        return mode;
    }

    public double getConfidence() {
        return confidence;
    }

    public int getTrials() {
        return trials;
    }

    /**
     * 各位移向量的票数，按向量字典序排列
     */
    public Map<DisplacementVector, Integer> getVotes() {
        return votes;
    }

    public int getModeCount() {
        return votes.getOrDefault(mode, 0);
    }

    @Override
    public String toString() {
        return String.format("RoundResult{mode=%s, confidence=%.3f, trials=%d, distinct=%d}",
                mode, confidence, trials, votes.size());
    }
}
