package com.edge.odometry.core.odometry;

import com.edge.odometry.core.odometry.model.Patch;
import org.opencv.core.Mat;
import org.opencv.core.Rect;

import java.util.Random;

/**
 * 随机块采样器
 * <p>
 * 在帧内随机选取位置和尺寸都随机的矩形区域：
 * <ul>
 *   <li>x1 在 [0, w-5) 内均匀取值，x2 在 (x1, w) 内均匀取值</li>
 *   <li>y1、y2 在高度方向上同理</li>
 *   <li>裁剪半开区间 [x1, x2) × [y1, y2)，宽高至少为 1</li>
 * </ul>
 * 帧的宽高都必须大于 {@value #MARGIN}
 */
public class PatchSampler {

    /** 起点距右/下边界至少保留的像素数 */
    public static final int MARGIN = 5;

    private final Random random;
    private final IntensityNormalizer normalizer;

    public PatchSampler(Random random, IntensityNormalizer normalizer) {
        this.random = random;
        this.normalizer = normalizer;
    }

    /**
     * 从帧中采样一个块并归一化到 [0,1]
     *
     * @param frame 原始帧（不会被修改）
     * @return 归一化后的块，调用方负责释放
     */
    public Patch samplePatch(Mat frame) {
        Rect region = sampleRegion(frame.cols(), frame.rows());
        return crop(frame, region);
    }

    /**
     * 只抽取区域，不触碰像素数据
     */
    public Rect sampleRegion(int width, int height) {
        requireSamplable(width, height);

        int x1 = random.nextInt(width - MARGIN);
        int x2 = x1 + 1 + random.nextInt(width - x1 - 1);

        int y1 = random.nextInt(height - MARGIN);
        int y2 = y1 + 1 + random.nextInt(height - y1 - 1);

        return new Rect(x1, y1, x2 - x1, y2 - y1);
    }

    /**
     * 按给定区域裁剪并归一化
     */
    public Patch crop(Mat frame, Rect region) {
        Mat view = frame.submat(region);
        try {
            return new Patch(normalizer.normalize(view), region);
        } finally {
            view.release();
        }
    }

    /**
     * 检查帧尺寸是否满足采样要求
     *
     * @throws IllegalArgumentException 宽或高不大于 {@value #MARGIN}
     */
    public static void requireSamplable(int width, int height) {
        if (width <= MARGIN || height <= MARGIN) {
            throw new IllegalArgumentException(String.format(
                "Frame %dx%d is too small to sample, width and height must both exceed %d",
                width, height, MARGIN));
        }
    }
}
