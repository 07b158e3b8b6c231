package com.edge.odometry.core.odometry.model;

import org.opencv.core.Mat;
import org.opencv.core.Rect;

/**
 * 随机采样块
 * <p>
 * data 为已归一化到 [0,1] 的 CV_32F 数据，由持有者负责 {@link #release()}
 */
public class Patch {
    private final Mat data;
    private final Rect region;

    public Patch(Mat data, Rect region) {
        this.data = data;
        this.region = region;
    }

    public Mat getData() {
        return data;
    }

    /** 原点列坐标 (x1) */
    public int getX() {
        return region.x;
    }

    /** 原点行坐标 (y1) */
    public int getY() {
        return region.y;
    }

    public int getWidth() {
        return region.width;
    }

    public int getHeight() {
        return region.height;
    }

    public void release() {
        if (data != null) {
            data.release();
        }
    }

    @Override
    public String toString() {
        return "Patch{origin=(" + region.x + ", " + region.y + "), size=" +
                region.width + "x" + region.height + '}';
    }
}
