package com.edge.odometry.core.odometry;

import com.edge.odometry.core.odometry.model.MatchResult;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

/**
 * 模板匹配器
 * <p>
 * 在归一化帧上计算块的相关面，取最大值位置作为最佳匹配。
 * 多个位置并列最大时，取行优先扫描遇到的第一个
 */
public class TemplateMatcher {

    private final MatchMethod method;

    public TemplateMatcher() {
        this(MatchMethod.CCOEFF_NORMED);
    }

    public TemplateMatcher(MatchMethod method) {
        this.method = method;
    }

    /**
     * 执行匹配
     *
     * @param frame 归一化后的被搜索帧
     * @param patch 归一化后的块，宽高都不能超过帧
     * @return 最佳位置 (列, 行) 与相关值
     */
    public MatchResult match(Mat frame, Mat patch) {
        if (patch.cols() > frame.cols() || patch.rows() > frame.rows()) {
            throw new IllegalArgumentException(String.format(
                "Patch %dx%d does not fit into frame %dx%d",
                patch.cols(), patch.rows(), frame.cols(), frame.rows()));
        }
        if (patch.channels() != frame.channels()) {
            throw new IllegalArgumentException(String.format(
                "Channel mismatch: frame has %d, patch has %d", frame.channels(), patch.channels()));
        }

        Mat surface = new Mat();
        try {
            Imgproc.matchTemplate(frame, patch, surface, method.getOpencvCode());
            Core.MinMaxLocResult mm = Core.minMaxLoc(surface);
            return new MatchResult((int) mm.maxLoc.x, (int) mm.maxLoc.y, mm.maxVal);
        } finally {
            surface.release();
        }
    }

    public MatchMethod getMethod() {
        return method;
    }
}
