package com.edge.odometry.config;

import com.edge.odometry.core.odometry.ConsensusEstimator;
import com.edge.odometry.core.odometry.EstimatorSettings;
import com.edge.odometry.core.odometry.IntensityNormalizer;
import com.edge.odometry.core.odometry.PatchSampler;
import com.edge.odometry.core.odometry.RecursiveEstimator;
import com.edge.odometry.core.odometry.TemplateMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 位移估计器配置
 * <p>
 * 从 application.yml 读取配置并组装估计器
 */
@Configuration
public class EstimatorBeansConfig {
    private static final Logger logger = LoggerFactory.getLogger(EstimatorBeansConfig.class);

    @Autowired
    private OdometryProperties properties;

    @Bean
    public EstimatorSettings estimatorSettings() {
        EstimatorSettings settings = properties.getEstimator().toSettings();
        logger.info("Estimator 配置: {}", settings);
        return settings;
    }

    @Bean
    public IntensityNormalizer intensityNormalizer() {
        return new IntensityNormalizer(properties.getEstimator().getMaxIntensity());
    }

    @Bean
    public TemplateMatcher templateMatcher() {
        logger.info("TemplateMatcher 配置: matchMethod={}", properties.getEstimator().getMatchMethod());
        return new TemplateMatcher(properties.getEstimator().getMatchMethod());
    }

    @Bean
    public Random odometryRandom() {
        Long seed = properties.getEstimator().getSeed();
        if (seed != null) {
            logger.info("使用固定随机种子: {}", seed);
            return new Random(seed);
        }
        return new Random();
    }

    @Bean
    public PatchSampler patchSampler(Random odometryRandom, IntensityNormalizer intensityNormalizer) {
        return new PatchSampler(odometryRandom, intensityNormalizer);
    }

    /**
     * 试验线程池，parallelism 为 1 时不创建线程池（顺序执行）
     */
    @Bean
    public TrialExecutorHolder trialExecutor() {
        int parallelism = properties.getEstimator().getParallelism();
        if (parallelism < 1) {
            throw new IllegalArgumentException("edge-odometry.estimator.parallelism must be >= 1: " + parallelism);
        }
        if (parallelism == 1) {
            return new TrialExecutorHolder(null);
        }
        logger.info("试验并行线程数: {}", parallelism);
        AtomicInteger index = new AtomicInteger();
        return new TrialExecutorHolder(Executors.newFixedThreadPool(parallelism, r -> {
            Thread t = new Thread(r, "Odometry-Trial-" + index.incrementAndGet());
            t.setDaemon(true);
            return t;
        }));
    }

    @Bean
    public ConsensusEstimator consensusEstimator(PatchSampler patchSampler,
                                                 TemplateMatcher templateMatcher,
                                                 IntensityNormalizer intensityNormalizer,
                                                 TrialExecutorHolder trialExecutor) {
        return new ConsensusEstimator(patchSampler, templateMatcher, intensityNormalizer, trialExecutor.get());
    }

    @Bean
    public RecursiveEstimator recursiveEstimator(ConsensusEstimator consensusEstimator,
                                                 EstimatorSettings estimatorSettings) {
        return new RecursiveEstimator(consensusEstimator, estimatorSettings);
    }

    /**
     * 持有可为空的试验线程池，随容器关闭
     */
    public static class TrialExecutorHolder implements AutoCloseable {
        private final ExecutorService executor;

        public TrialExecutorHolder(ExecutorService executor) {
            this.executor = executor;
        }

        public ExecutorService get() {
            return executor;
        }

        @Override
        public void close() {
            if (executor == null) {
                return;
            }
            executor.shutdown();
            try {
                if (!executor.awaitTermination(2, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }
}
