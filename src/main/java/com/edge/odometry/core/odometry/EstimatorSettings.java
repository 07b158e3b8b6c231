package com.edge.odometry.core.odometry;

/**
 * 递归估计参数
 * <p>
 * 构造时校验，实例不可变；用 {@link #with} 系列方法派生新实例
 */
public final class EstimatorSettings {

    public static final double DEFAULT_CONFIDENCE_THRESHOLD = 0.4;
    public static final int DEFAULT_INITIAL_TRIALS = 4;
    public static final int DEFAULT_TRIAL_INCREMENT = 4;
    public static final int DEFAULT_MAX_TRIALS = 50;

    private final double confidenceThreshold;
    private final int initialTrials;
    private final int trialIncrement;
    private final int maxTrials;

    public EstimatorSettings(double confidenceThreshold, int initialTrials, int trialIncrement, int maxTrials) {
        if (!(confidenceThreshold >= 0.0 && confidenceThreshold <= 1.0)) {
            throw new IllegalArgumentException("confidenceThreshold must be within [0, 1]: " + confidenceThreshold);
        }
        if (initialTrials < 1) {
            throw new IllegalArgumentException("initialTrials must be >= 1: " + initialTrials);
        }
        if (trialIncrement < 1) {
            throw new IllegalArgumentException("trialIncrement must be >= 1: " + trialIncrement);
        }
        if (maxTrials < initialTrials) {
            throw new IllegalArgumentException(String.format(
                "maxTrials (%d) must not be smaller than initialTrials (%d)", maxTrials, initialTrials));
        }
        this.confidenceThreshold = confidenceThreshold;
        this.initialTrials = initialTrials;
        this.trialIncrement = trialIncrement;
        this.maxTrials = maxTrials;
    }

    public static EstimatorSettings defaults() {
        return new EstimatorSettings(DEFAULT_CONFIDENCE_THRESHOLD, DEFAULT_INITIAL_TRIALS,
            DEFAULT_TRIAL_INCREMENT, DEFAULT_MAX_TRIALS);
    }

    /**
     * 用非空参数覆盖当前值，生成新的参数对象
     */
    public EstimatorSettings with(Double confidenceThreshold, Integer initialTrials,
                                  Integer trialIncrement, Integer maxTrials) {
        return new EstimatorSettings(
            confidenceThreshold != null ? confidenceThreshold : this.confidenceThreshold,
            initialTrials != null ? initialTrials : this.initialTrials,
            trialIncrement != null ? trialIncrement : this.trialIncrement,
            maxTrials != null ? maxTrials : this.maxTrials);
    }

    /**
     * 最坏情况下的轮数：ceil((max - initial) / increment) + 1
     */
    public int maxRounds() {
        return (maxTrials - initialTrials + trialIncrement - 1) / trialIncrement + 1;
    }

    public double getConfidenceThreshold() { return confidenceThreshold; }
    public int getInitialTrials() { return initialTrials; }
    public int getTrialIncrement() { return trialIncrement; }
    public int getMaxTrials() { return maxTrials; }

    @Override
    public String toString() {
        return String.format("EstimatorSettings{threshold=%.2f, initialTrials=%d, trialIncrement=%d, maxTrials=%d}",
            confidenceThreshold, initialTrials, trialIncrement, maxTrials);
    }
}
