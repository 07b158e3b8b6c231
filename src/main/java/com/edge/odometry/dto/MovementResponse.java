package com.edge.odometry.dto;

import com.edge.odometry.core.odometry.model.Estimate;

/**
 * 位移估计响应
 */
public class MovementResponse {
    private int dx;
    private int dy;
    private double confidence;
    private int trials;
    private int rounds;
    private boolean accepted;
    private long processingTimeMs;

    public static MovementResponse from(Estimate estimate) {
        MovementResponse response = new MovementResponse();
        response.dx = estimate.getDisplacement().getDx();
        response.dy = estimate.getDisplacement().getDy();
        response.confidence = estimate.getConfidence();
        response.trials = estimate.getTrials();
        response.rounds = estimate.getRounds();
        response.accepted = estimate.isAccepted();
        response.processingTimeMs = estimate.getProcessingTimeMs();
        return response;
    }

    public int getDx() { return dx; }
    public void setDx(int dx) { this.dx = dx; }

    public int getDy() { return dy; }
    public void setDy(int dy) { this.dy = dy; }

    public double getConfidence() { return confidence; }
    public void setConfidence(double confidence) { this.confidence = confidence; }

    public int getTrials() { return trials; }
    public void setTrials(int trials) { this.trials = trials; }

    public int getRounds() { return rounds; }
    public void setRounds(int rounds) { this.rounds = rounds; }

    public boolean isAccepted() { return accepted; }
    public void setAccepted(boolean accepted) { this.accepted = accepted; }

    public long getProcessingTimeMs() { return processingTimeMs; }
    public void setProcessingTimeMs(long processingTimeMs) { this.processingTimeMs = processingTimeMs; }
}
