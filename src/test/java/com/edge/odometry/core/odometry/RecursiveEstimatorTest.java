package com.edge.odometry.core.odometry;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

import com.edge.odometry.config.NativeLibraryLoader;
import com.edge.odometry.core.odometry.model.DisplacementVector;
import com.edge.odometry.core.odometry.model.Estimate;
import com.edge.odometry.core.odometry.model.RoundResult;
import java.util.List;
import java.util.Map;
import java.util.Random;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.opencv.core.Mat;

public class RecursiveEstimatorTest {

    private static final DisplacementVector SHIFT = new DisplacementVector(3, -2);

    @BeforeAll
    public static void init() {
        NativeLibraryLoader.loadNativeLibraries();
    }

    private static RoundResult round(double confidence, int trials) {
        return new RoundResult(SHIFT, confidence, trials, Map.of(SHIFT, (int) Math.round(confidence * trials)));
    }

    private static RecursiveEstimator realEstimator(long seed) {
        IntensityNormalizer normalizer = new IntensityNormalizer(255.0);
        ConsensusEstimator consensus = new ConsensusEstimator(
                new PatchSampler(new Random(seed), normalizer), new TemplateMatcher(), normalizer);
        return new RecursiveEstimator(consensus, EstimatorSettings.defaults());
    }

    @Test
    public void testAcceptsFirstRoundAboveThreshold() {
        ConsensusEstimator consensus = mock(ConsensusEstimator.class);
        when(consensus.estimateRound(any(), any(), anyInt())).thenReturn(round(0.75, 4));

        Estimate estimate = new RecursiveEstimator(consensus, EstimatorSettings.defaults()).estimate(null, null);

        assertEquals(SHIFT, estimate.getDisplacement());
        assertEquals(4, estimate.getTrials());
        assertEquals(1, estimate.getRounds());
        assertTrue(estimate.isAccepted());
        verify(consensus, times(1)).estimateRound(any(), any(), eq(4));
    }

    @Test
    public void testEscalatesUntilCeilingWhenConfidenceStaysLow() {
        ConsensusEstimator consensus = mock(ConsensusEstimator.class);
        when(consensus.estimateRound(any(), any(), anyInt()))
                .thenAnswer(inv -> round(0.25, inv.getArgument(2)));
        EstimatorSettings settings = EstimatorSettings.defaults();

        Estimate estimate = new RecursiveEstimator(consensus, settings).estimate(null, null);

        ArgumentCaptor<Integer> trials = ArgumentCaptor.forClass(Integer.class);
        verify(consensus, times(12)).estimateRound(any(), any(), trials.capture());
        assertEquals(List.of(4, 8, 12, 16, 20, 24, 28, 32, 36, 40, 44, 48), trials.getAllValues());

        assertEquals(48, estimate.getTrials());
        assertEquals(12, estimate.getRounds());
        assertTrue(estimate.getRounds() <= settings.maxRounds());
        assertFalse(estimate.isAccepted());
        assertEquals(0.25, estimate.getConfidence(), 1e-9);
    }

    @Test
    public void testConfidenceEqualToThresholdIsNotAccepted() {
        ConsensusEstimator consensus = mock(ConsensusEstimator.class);
        when(consensus.estimateRound(any(), any(), eq(4))).thenReturn(round(0.4, 4));
        when(consensus.estimateRound(any(), any(), eq(8))).thenReturn(round(0.5, 8));

        Estimate estimate = new RecursiveEstimator(consensus, EstimatorSettings.defaults()).estimate(null, null);

        assertEquals(8, estimate.getTrials());
        assertEquals(2, estimate.getRounds());
        assertTrue(estimate.isAccepted());
    }

    @Test
    public void testTrialCountsStayWithinConfiguredRange() {
        ConsensusEstimator consensus = mock(ConsensusEstimator.class);
        when(consensus.estimateRound(any(), any(), anyInt()))
                .thenAnswer(inv -> round(0.1, inv.getArgument(2)));
        EstimatorSettings settings = new EstimatorSettings(0.4, 5, 3, 20);

        Estimate estimate = new RecursiveEstimator(consensus, settings).estimate(null, null);

        // 5, 8, 11, 14, 17; 17 + 3 > 20
        assertEquals(17, estimate.getTrials());
        assertEquals(5, estimate.getRounds());
        assertEquals(0, (estimate.getTrials() - settings.getInitialTrials()) % settings.getTrialIncrement());
    }

    @Test
    public void testRecoversKnownShift() {
        Mat[] pair = SyntheticFrames.shiftedPair(96, 96, 3, -2, 2024);
        try {
            Estimate estimate = realEstimator(17).estimate(pair[0], pair[1]);

            assertEquals(SHIFT, estimate.getDisplacement());
            assertTrue(estimate.getConfidence() >= 0.4, "confidence " + estimate.getConfidence());
            assertTrue(estimate.getConfidence() <= 1.0);
            assertTrue(estimate.getTrials() >= 4 && estimate.getTrials() <= 50);
            assertEquals(0, estimate.getTrials() % 4);
        } finally {
            SyntheticFrames.release(pair);
        }
    }

    @Test
    public void testIdenticalFramesAcceptedInFirstRound() {
        Mat frame = SyntheticFrames.texture(64, 64, 555);
        try {
            Estimate estimate = realEstimator(9).estimate(frame, frame);

            assertEquals(DisplacementVector.ZERO, estimate.getDisplacement());
            assertTrue(estimate.isAccepted());
            assertEquals(4, estimate.getTrials());
            assertEquals(1, estimate.getRounds());
        } finally {
            frame.release();
        }
    }
}
