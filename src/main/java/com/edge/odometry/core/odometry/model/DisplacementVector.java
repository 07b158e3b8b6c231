package com.edge.odometry.core.odometry.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * 位移向量
 * <p>
 * 单次试验得到的整数平移量：匹配位置减去块在源帧中的原点，
 * 两侧均按 (列, 行) 顺序，dx 为水平方向，dy 为垂直方向
 */
public final class DisplacementVector implements Comparable<DisplacementVector> {

    public static final DisplacementVector ZERO = new DisplacementVector(0, 0);

    private static final Comparator<DisplacementVector> ORDER =
        Comparator.comparingInt(DisplacementVector::getDx).thenComparingInt(DisplacementVector::getDy);

    private final int dx;
    private final int dy;

    public DisplacementVector(int dx, int dy) {
        this.dx = dx;
        this.dy = dy;
    }

    /**
     * 由匹配结果和块原点计算位移
     */
    public static DisplacementVector between(MatchResult match, Patch patch) {
        return new DisplacementVector(match.getX() - patch.getX(), match.getY() - patch.getY());
    }

    public int getDx() {
        return dx;
    }

    public int getDy() {
        return dy;
    }

    /**
     * 字典序：先 dx 后 dy
     */
    @Override
    public int compareTo(DisplacementVector other) {
        return ORDER.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DisplacementVector)) return false;
        DisplacementVector that = (DisplacementVector) o;
        return dx == that.dx && dy == that.dy;
    }

    @Override
    public int hashCode() {
        return Objects.hash(dx, dy);
    }

    @Override
    public String toString() {
        return String.format("(%d, %d)", dx, dy);
    }
}
