package com.edge.odometry.core.odometry;

import org.opencv.core.CvType;
import org.opencv.core.Mat;

/**
 * 亮度归一化
 * <p>
 * 把任意深度的帧转换为 CV_32F 并缩放到 [0,1]。
 * 整型深度按类型可表示的最大值缩放；浮点深度没有固有上限，使用构造时给定的最大亮度
 */
public class IntensityNormalizer {

    private final double floatingPointMax;

    public IntensityNormalizer(double floatingPointMax) {
        if (!(floatingPointMax > 0) || Double.isInfinite(floatingPointMax)) {
            throw new IllegalArgumentException("maxIntensity must be a positive finite number: " + floatingPointMax);
        }
        this.floatingPointMax = floatingPointMax;
    }

    /**
     * 返回新的 CV_32F 矩阵，通道数与输入相同；输入不会被修改
     */
    public Mat normalize(Mat src) {
        Mat dst = new Mat();
        src.convertTo(dst, CvType.CV_32F, 1.0 / maxIntensity(src.depth()));
        return dst;
    }

    /**
     * 给定深度下可表示的最大亮度
     */
    public double maxIntensity(int depth) {
        switch (depth) {
            case CvType.CV_8U:
                return 255.0;
            case CvType.CV_8S:
                return 127.0;
            case CvType.CV_16U:
                return 65535.0;
            case CvType.CV_16S:
                return 32767.0;
            case CvType.CV_32S:
                return Integer.MAX_VALUE;
            case CvType.CV_32F:
            case CvType.CV_64F:
                return floatingPointMax;
            default:
                throw new IllegalArgumentException("Unsupported frame depth: " + depth);
        }
    }
}
