package com.edge.odometry.config;

import com.edge.odometry.core.odometry.EstimatorSettings;
import com.edge.odometry.core.odometry.MatchMethod;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "edge-odometry")
public class OdometryProperties {
    private EstimatorConfig estimator = new EstimatorConfig();
    private InputConfig input = new InputConfig();

    @Data
    public static class EstimatorConfig {
        // 置信度阈值，超过即接受本轮结果
        private double confidenceThreshold = EstimatorSettings.DEFAULT_CONFIDENCE_THRESHOLD;
        private int initialTrials = EstimatorSettings.DEFAULT_INITIAL_TRIALS;
        private int trialIncrement = EstimatorSettings.DEFAULT_TRIAL_INCREMENT;
        private int maxTrials = EstimatorSettings.DEFAULT_MAX_TRIALS;
        private MatchMethod matchMethod = MatchMethod.CCOEFF_NORMED;
        // 浮点帧的最大亮度（整型帧按类型最大值归一化）
        private double maxIntensity = 255.0;
        // 每轮试验的并行线程数，1 表示在调用线程中顺序执行
        private int parallelism = 1;
        // 随机种子，为空时每次启动不同
        private Long seed;

        public EstimatorSettings toSettings() {
            return new EstimatorSettings(confidenceThreshold, initialTrials, trialIncrement, maxTrials);
        }
    }

    @Data
    public static class InputConfig {
        // 单帧边长上限（像素），在 JSON 解析之后检查；请求体大小由 RequestSizeLimitFilter 限制
        private int maxFrameSide = 2048;
    }
}
