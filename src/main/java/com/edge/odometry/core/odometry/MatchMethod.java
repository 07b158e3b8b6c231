package com.edge.odometry.core.odometry;

import org.opencv.imgproc.Imgproc;

/**
 * 相关度量
 * <p>
 * 三者都是"越大越好"，可以直接对相关面取最大值
 */
public enum MatchMethod {
    /**
     * 归一化相关系数（默认）
     * 对块内亮度的均值和幅度都不敏感，理想匹配处取值为 1
     */
    CCOEFF_NORMED(Imgproc.TM_CCOEFF_NORMED),

    /**
     * 未归一化相关系数
     * 计算量最小，但偏向纹理方差大的区域
     */
    CCOEFF(Imgproc.TM_CCOEFF),

    /**
     * 归一化互相关（不去均值）
     */
    CCORR_NORMED(Imgproc.TM_CCORR_NORMED);

    private final int opencvCode;

    MatchMethod(int opencvCode) {
        this.opencvCode = opencvCode;
    }

    public int getOpencvCode() {
        return opencvCode;
    }
}
