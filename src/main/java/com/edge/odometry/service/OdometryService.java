package com.edge.odometry.service;

import com.edge.odometry.config.EstimatorBeansConfig.TrialExecutorHolder;
import com.edge.odometry.config.OdometryProperties;
import com.edge.odometry.core.odometry.ConsensusEstimator;
import com.edge.odometry.core.odometry.EstimatorSettings;
import com.edge.odometry.core.odometry.IntensityNormalizer;
import com.edge.odometry.core.odometry.PatchSampler;
import com.edge.odometry.core.odometry.RecursiveEstimator;
import com.edge.odometry.core.odometry.TemplateMatcher;
import com.edge.odometry.core.odometry.model.Estimate;
import com.edge.odometry.dto.MovementRequest;
import com.edge.odometry.util.FrameConverter;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;

/**
 * 视觉里程计服务
 * <p>
 * 对外提供两帧之间的平移估计：
 * - 直接传入 Mat（进程内调用）
 * - 传入亮度数组（REST 调用），可按请求覆盖阈值、试验次数、亮度上限和随机种子
 */
@Service
public class OdometryService {
    private static final Logger logger = LoggerFactory.getLogger(OdometryService.class);

    private final RecursiveEstimator recursiveEstimator;
    private final TemplateMatcher templateMatcher;
    private final Random random;
    private final TrialExecutorHolder trialExecutor;
    private final OdometryProperties properties;

    @Autowired
    public OdometryService(RecursiveEstimator recursiveEstimator,
                           TemplateMatcher templateMatcher,
                           Random odometryRandom,
                           TrialExecutorHolder trialExecutor,
                           OdometryProperties properties) {
        this.recursiveEstimator = recursiveEstimator;
        this.templateMatcher = templateMatcher;
        this.random = odometryRandom;
        this.trialExecutor = trialExecutor;
        this.properties = properties;
    }

    /**
     * 使用服务配置估计 frame1 -> frame2 的平移
     *
     * @param frame1 较早的帧（调用方持有，不会被修改或释放）
     * @param frame2 较晚的帧
     */
    public Estimate estimateMovement(Mat frame1, Mat frame2) {
        return estimate(recursiveEstimator, frame1, frame2);
    }

    /**
     * 处理 REST 请求
     */
    public Estimate estimateMovement(MovementRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Request body is required");
        }
        int maxSide = properties.getInput().getMaxFrameSide();

        Mat frame1 = FrameConverter.toMat("frame1", request.getFrame1(), maxSide);
        Mat frame2 = null;
        try {
            frame2 = FrameConverter.toMat("frame2", request.getFrame2(), maxSide);
            RecursiveEstimator estimator = request.hasOverrides()
                ? buildEstimator(request)
                : recursiveEstimator;
            return estimate(estimator, frame1, frame2);
        } finally {
            frame1.release();
            if (frame2 != null) {
                frame2.release();
            }
        }
    }

    /**
     * 当前生效的估计参数
     */
    public Map<String, Object> getCurrentConfig() {
        EstimatorSettings settings = recursiveEstimator.getSettings();
        OdometryProperties.EstimatorConfig estimator = properties.getEstimator();

        Map<String, Object> config = new LinkedHashMap<>();
        config.put("confidenceThreshold", settings.getConfidenceThreshold());
        config.put("initialTrials", settings.getInitialTrials());
        config.put("trialIncrement", settings.getTrialIncrement());
        config.put("maxTrials", settings.getMaxTrials());
        config.put("maxRounds", settings.maxRounds());
        config.put("matchMethod", templateMatcher.getMethod().name());
        config.put("maxIntensity", estimator.getMaxIntensity());
        config.put("parallelism", estimator.getParallelism());
        config.put("seeded", estimator.getSeed() != null);
        config.put("maxFrameSide", properties.getInput().getMaxFrameSide());
        return config;
    }

    private Estimate estimate(RecursiveEstimator estimator, Mat frame1, Mat frame2) {
        logger.info("Estimating movement: frame1={}x{}, frame2={}x{}",
            frame1.cols(), frame1.rows(), frame2.cols(), frame2.rows());
        Estimate estimate = estimator.estimate(frame1, frame2);
        logger.info("Movement estimated: {}", estimate);
        return estimate;
    }

    private RecursiveEstimator buildEstimator(MovementRequest request) {
        EstimatorSettings settings = recursiveEstimator.getSettings().with(
            request.getConfidenceThreshold(), request.getInitialTrials(),
            request.getTrialIncrement(), request.getMaxTrials());

        double maxIntensity = request.getMaxIntensity() != null
            ? request.getMaxIntensity()
            : properties.getEstimator().getMaxIntensity();
        IntensityNormalizer normalizer = new IntensityNormalizer(maxIntensity);
        Random requestRandom = request.getSeed() != null ? new Random(request.getSeed()) : random;

        logger.debug("Per-request estimator: {}, maxIntensity={}, seed={}", settings, maxIntensity, request.getSeed());
        ConsensusEstimator consensus = new ConsensusEstimator(
            new PatchSampler(requestRandom, normalizer), templateMatcher, normalizer, trialExecutor.get());
        return new RecursiveEstimator(consensus, settings);
    }
}
