package com.edge.odometry.core.odometry;

import com.edge.odometry.core.odometry.model.Estimate;
import com.edge.odometry.core.odometry.model.RoundResult;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 递归蒙特卡洛位移估计
 * <p>
 * 以 initialTrials 次试验运行一轮一致性估计：
 * <ul>
 *   <li>置信度 &gt; 阈值：接受本轮结果</li>
 *   <li>trials + increment &gt; maxTrials：达到上限，返回本轮结果（accepted=false）</li>
 *   <li>否则 trials += increment，再跑一轮</li>
 * </ul>
 * 轮与轮之间严格串行，后一轮是否执行取决于前一轮的置信度
 */
public class RecursiveEstimator {
    private static final Logger logger = LoggerFactory.getLogger(RecursiveEstimator.class);

    private final ConsensusEstimator consensusEstimator;
    private final EstimatorSettings settings;

    public RecursiveEstimator(ConsensusEstimator consensusEstimator, EstimatorSettings settings) {
        this.consensusEstimator = consensusEstimator;
        this.settings = settings;
    }

    /**
     * 估计 frame1 到 frame2 的平移
     *
     * @param frame1 较早的帧
     * @param frame2 较晚的帧
     * @return 最后一轮的位移、置信度和试验数
     */
    public Estimate estimate(Mat frame1, Mat frame2) {
        long startTime = System.currentTimeMillis();

        int trials = settings.getInitialTrials();
        int rounds = 0;
        while (true) {
            RoundResult round = consensusEstimator.estimateRound(frame1, frame2, trials);
            rounds++;

            boolean accepted = round.getConfidence() > settings.getConfidenceThreshold();
            boolean exhausted = trials + settings.getTrialIncrement() > settings.getMaxTrials();
            logger.debug("Round {}: trials={}, mode={}, confidence={}",
                rounds, trials, round.getMode(), String.format("%.3f", round.getConfidence()));

            if (accepted || exhausted) {
                if (!accepted) {
                    logger.info("Trial ceiling {} reached, best confidence {} stays below threshold {}",
                        settings.getMaxTrials(), String.format("%.3f", round.getConfidence()),
                        settings.getConfidenceThreshold());
                }
                return new Estimate(round.getMode(), round.getConfidence(), trials, rounds, accepted,
                    System.currentTimeMillis() - startTime);
            }
            trials += settings.getTrialIncrement();
        }
    }

    public EstimatorSettings getSettings() {
        return settings;
    }
}
