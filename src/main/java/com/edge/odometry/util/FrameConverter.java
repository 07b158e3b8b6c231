package com.edge.odometry.util;

import org.opencv.core.CvType;
import org.opencv.core.Mat;

/**
 * 数组与 Mat 之间的转换
 * <p>
 * 调用方传入的帧是按行组织的亮度数组 frame[row][col]，整数或小数均可（如 0..255 或 0..1），
 * 转换为单通道 CV_32F Mat，亮度值原样保留，由 maxIntensity 决定归一化尺度
 */
public final class FrameConverter {

    private FrameConverter() {
    }

    /**
     * 二维数组转 Mat
     *
     * @param name    帧名称，仅用于错误信息
     * @param pixels  frame[row][col]，值必须是有限数
     * @param maxSide 允许的最大边长
     * @return CV_32FC1 Mat，调用方负责释放
     */
    public static Mat toMat(String name, double[][] pixels, int maxSide) {
        int cols = checkShape(name, pixels, maxSide);
        int rows = pixels.length;

        float[] buffer = new float[rows * cols];
        for (int r = 0; r < rows; r++) {
            double[] row = pixels[r];
            for (int c = 0; c < cols; c++) {
                if (!Double.isFinite(row[c])) {
                    throw new IllegalArgumentException(String.format("%s has a non-finite value at (%d, %d)", name, r, c));
                }
                buffer[r * cols + c] = (float) row[c];
            }
        }
        return wrap(rows, cols, buffer);
    }

    /**
     * 单通道 Mat 转二维数组
     */
    public static double[][] toArray(Mat frame) {
        if (frame.channels() != 1) {
            throw new IllegalArgumentException("Only single-channel frames can be exported, got " + frame.channels());
        }
        Mat asFloat = new Mat();
        try {
            frame.convertTo(asFloat, CvType.CV_32F);
            int rows = asFloat.rows();
            int cols = asFloat.cols();
            float[] buffer = new float[rows * cols];
            asFloat.get(0, 0, buffer);

            double[][] pixels = new double[rows][cols];
            for (int r = 0; r < rows; r++) {
                for (int c = 0; c < cols; c++) {
                    pixels[r][c] = buffer[r * cols + c];
                }
            }
            return pixels;
        } finally {
            asFloat.release();
        }
    }

    private static int checkShape(String name, double[][] pixels, int maxSide) {
        if (pixels == null) {
            throw new IllegalArgumentException(name + " is required");
        }
        int rows = pixels.length;
        if (rows == 0 || pixels[0] == null || pixels[0].length == 0) {
            throw new IllegalArgumentException(name + " must not be empty");
        }
        int cols = pixels[0].length;
        if (rows > maxSide || cols > maxSide) {
            throw new IllegalArgumentException(String.format("%s is %dx%d, exceeds the maximum side of %d",
                name, cols, rows, maxSide));
        }
        for (int r = 0; r < rows; r++) {
            if (pixels[r] == null || pixels[r].length != cols) {
                throw new IllegalArgumentException(String.format("%s is not rectangular: row %d has %s columns, expected %d",
                    name, r, pixels[r] == null ? "no" : String.valueOf(pixels[r].length), cols));
            }
        }
        return cols;
    }

    private static Mat wrap(int rows, int cols, float[] buffer) {
        Mat mat = new Mat(rows, cols, CvType.CV_32FC1);
        mat.put(0, 0, buffer);
        return mat;
    }
}
