package com.edge.odometry.dto;

/**
 * 位移估计请求
 * <p>
 * 两帧均为 frame[row][col] 亮度数组（整数或小数）；其余字段为可选覆盖项，为空时使用服务配置
 */
public class MovementRequest {
    private double[][] frame1;
    private double[][] frame2;

    private Double maxIntensity;          // 亮度上限，默认 255；0..1 的小数帧传 1
    private Long seed;                    // 随机种子，用于复现
    private Double confidenceThreshold;
    private Integer initialTrials;
    private Integer trialIncrement;
    private Integer maxTrials;

    public double[][] getFrame1() { return frame1; }
    public void setFrame1(double[][] frame1) { this.frame1 = frame1; }

    public double[][] getFrame2() { return frame2; }
    public void setFrame2(double[][] frame2) { this.frame2 = frame2; }

    public Double getMaxIntensity() { return maxIntensity; }
    public void setMaxIntensity(Double maxIntensity) { this.maxIntensity = maxIntensity; }

    public Long getSeed() { return seed; }
    public void setSeed(Long seed) { this.seed = seed; }

    public Double getConfidenceThreshold() { return confidenceThreshold; }
    public void setConfidenceThreshold(Double confidenceThreshold) { this.confidenceThreshold = confidenceThreshold; }

    public Integer getInitialTrials() { return initialTrials; }
    public void setInitialTrials(Integer initialTrials) { this.initialTrials = initialTrials; }

    public Integer getTrialIncrement() { return trialIncrement; }
    public void setTrialIncrement(Integer trialIncrement) { this.trialIncrement = trialIncrement; }

    public Integer getMaxTrials() { return maxTrials; }
    public void setMaxTrials(Integer maxTrials) { this.maxTrials = maxTrials; }

    /**
     * 是否需要为本次请求单独构建估计器
     */
    public boolean hasOverrides() {
        return maxIntensity != null || seed != null || confidenceThreshold != null
            || initialTrials != null || trialIncrement != null || maxTrials != null;
    }
}
