package com.edge.odometry.core.odometry.model;

/**
 * 最终位移估计
 * <p>
 * 位移、置信度与最后一轮的试验数总是一起返回；
 * 达到试验上限仍未超过阈值时 accepted 为 false，但仍返回该轮真实的置信度
 */
public class Estimate {
    private final DisplacementVector displacement;
    private final double confidence;
    private final int trials;
    private final int rounds;
    private final boolean accepted;
    private final long processingTimeMs;

    public Estimate(DisplacementVector displacement, double confidence, int trials,
                    int rounds, boolean accepted, long processingTimeMs) {
        this.displacement = displacement;
        this.confidence = confidence;
        this.trials = trials;
        this.rounds = rounds;
        this.accepted = accepted;
        this.processingTimeMs = processingTimeMs;
    }

    public DisplacementVector getDisplacement() { return displacement; }
    public double getConfidence() { return confidence; }
    public int getTrials() { return trials; }
    public int getRounds() { return rounds; }
    public boolean isAccepted() { return accepted; }
    public long getProcessingTimeMs() { return processingTimeMs; }

    @Override
    public String toString() {
        return String.format("Estimate{displacement=%s, confidence=%.3f, trials=%d, rounds=%d, accepted=%s, %dms}",
                displacement, confidence, trials, rounds, accepted, processingTimeMs);
    }
}
