package com.edge.odometry.core.odometry;

import com.edge.odometry.core.odometry.model.DisplacementVector;
import com.edge.odometry.core.odometry.model.MatchResult;
import com.edge.odometry.core.odometry.model.Patch;
import com.edge.odometry.core.odometry.model.RoundResult;
import org.opencv.core.Mat;
import org.opencv.core.Rect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 一致性估计器（单轮）
 * <p>
 * 流程：
 * 1. 将 frame1 归一化到 [0,1]
 * 2. 每次试验从 frame2 随机采样一个块，在 frame1 中做模板匹配
 * 3. 匹配位置减去块原点得到该次试验的位移
 * 4. 统计所有位移，取票数最多的向量为众数，票数占比为置信度
 * <p>
 * 票数并列时取字典序最小的向量，因此结果与试验顺序无关。
 * 提供线程池时，区域仍按顺序从随机源抽取，只有裁剪和匹配在线程池中执行
 */
public class ConsensusEstimator {
    private static final Logger logger = LoggerFactory.getLogger(ConsensusEstimator.class);

    private final PatchSampler sampler;
    private final TemplateMatcher matcher;
    private final IntensityNormalizer normalizer;
    private final ExecutorService trialExecutor;

    public ConsensusEstimator(PatchSampler sampler, TemplateMatcher matcher, IntensityNormalizer normalizer) {
        this(sampler, matcher, normalizer, null);
    }

    /**
     * @param trialExecutor 执行试验的线程池，为 null 时在调用线程中顺序执行；线程池由调用方管理
     */
    public ConsensusEstimator(PatchSampler sampler, TemplateMatcher matcher,
                              IntensityNormalizer normalizer, ExecutorService trialExecutor) {
        this.sampler = sampler;
        this.matcher = matcher;
        this.normalizer = normalizer;
        this.trialExecutor = trialExecutor;
    }

    /**
     * 执行一轮估计
     *
     * @param frame1 较早的帧（被搜索）
     * @param frame2 较晚的帧（采样来源）
     * @param trials 试验次数，至少为 1
     * @return 众数位移、置信度及票数分布
     */
    public RoundResult estimateRound(Mat frame1, Mat frame2, int trials) {
        if (trials < 1) {
            throw new IllegalArgumentException("trials must be >= 1: " + trials);
        }
        PatchSampler.requireSamplable(frame1.cols(), frame1.rows());
        PatchSampler.requireSamplable(frame2.cols(), frame2.rows());

        List<Rect> regions = new ArrayList<>(trials);
        for (int i = 0; i < trials; i++) {
            regions.add(sampler.sampleRegion(frame2.cols(), frame2.rows()));
        }

        Mat searchFrame = normalizer.normalize(frame1);
        try {
            List<DisplacementVector> displacements = trialExecutor == null
                ? runSequential(searchFrame, frame2, regions)
                : runParallel(searchFrame, frame2, regions);

            RoundResult result = tally(displacements);
            logger.debug("Round finished: {}", result);
            return result;
        } finally {
            searchFrame.release();
        }
    }

    /**
     * 统计位移向量，选出众数
     *
     * @param displacements 本轮全部试验的位移，不能为空
     */
    public static RoundResult tally(List<DisplacementVector> displacements) {
        if (displacements.isEmpty()) {
            throw new IllegalArgumentException("At least one displacement is required");
        }

        Map<DisplacementVector, Integer> votes = new TreeMap<>();
        for (DisplacementVector d : displacements) {
            votes.merge(d, 1, Integer::sum);
        }

        // TreeMap 升序遍历，只有严格更多的票才替换，并列时保留字典序最小者
        DisplacementVector mode = null;
        int modeCount = 0;
        for (Map.Entry<DisplacementVector, Integer> entry : votes.entrySet()) {
            if (entry.getValue() > modeCount) {
                mode = entry.getKey();
                modeCount = entry.getValue();
            }
        }

        double confidence = (double) modeCount / displacements.size();
        return new RoundResult(mode, confidence, displacements.size(), votes);
    }

    private List<DisplacementVector> runSequential(Mat searchFrame, Mat source, List<Rect> regions) {
        List<DisplacementVector> displacements = new ArrayList<>(regions.size());
        for (Rect region : regions) {
            displacements.add(runTrial(searchFrame, source, region));
        }
        return displacements;
    }

    private List<DisplacementVector> runParallel(Mat searchFrame, Mat source, List<Rect> regions) {
        // 某次试验失败后，尚未开始的试验直接跳过
        AtomicBoolean aborted = new AtomicBoolean(false);
        List<Future<DisplacementVector>> futures = new ArrayList<>(regions.size());
        for (Rect region : regions) {
            futures.add(trialExecutor.submit(() -> aborted.get() ? null : runTrial(searchFrame, source, region)));
        }

        List<DisplacementVector> displacements = new ArrayList<>(regions.size());
        try {
            for (Future<DisplacementVector> future : futures) {
                displacements.add(future.get());
            }
            return displacements;
        } catch (InterruptedException e) {
            aborted.set(true);
            awaitAll(futures);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for trials", e);
        } catch (ExecutionException e) {
            aborted.set(true);
            awaitAll(futures);
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("Trial failed", cause);
        }
    }

    /**
     * 等待所有已提交的试验结束，忽略其结果
     * <p>
     * matchTemplate 是 native 调用，无法通过 cancel 中断；searchFrame 只能在全部试验退出后释放
     */
    private static void awaitAll(List<Future<DisplacementVector>> futures) {
        boolean interrupted = false;
        for (Future<DisplacementVector> future : futures) {
            while (true) {
                try {
                    future.get();
                    break;
                } catch (InterruptedException e) {
                    interrupted = true;
                } catch (ExecutionException e) {
                    break;
                }
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    private DisplacementVector runTrial(Mat searchFrame, Mat source, Rect region) {
        Patch patch = sampler.crop(source, region);
        try {
            MatchResult match = matcher.match(searchFrame, patch.getData());
            DisplacementVector displacement = DisplacementVector.between(match, patch);
            if (logger.isTraceEnabled()) {
                logger.trace("{} -> {} => {}", patch, match, displacement);
            }
            return displacement;
        } finally {
            patch.release();
        }
    }
}
