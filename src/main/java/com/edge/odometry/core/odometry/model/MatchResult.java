package com.edge.odometry.core.odometry.model;

/**
 * 模板匹配结果
 * <p>
 * x 为列，y 为行，score 为相关面在该位置的取值（越大越好）
 */
public class MatchResult {
    private final int x;
    private final int y;
    private final double score;

    public MatchResult(int x, int y, double score) {
        this.x = x;
        this.y = y;
        this.score = score;
    }

    public int getX() { return x; }
    public int getY() { return y; }
    public double getScore() { return score; }

    @Override
    public String toString() {
        return String.format("MatchResult{loc=(%d, %d), score=%.4f}", x, y, score);
    }
}
