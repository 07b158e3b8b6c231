package com.edge.odometry.core.odometry;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

public class EstimatorSettingsTest {

    @Test
    public void testDefaults() {
        EstimatorSettings settings = EstimatorSettings.defaults();

        assertEquals(0.4, settings.getConfidenceThreshold());
        assertEquals(4, settings.getInitialTrials());
        assertEquals(4, settings.getTrialIncrement());
        assertEquals(50, settings.getMaxTrials());
        // ceil((50 - 4) / 4) + 1
        assertEquals(13, settings.maxRounds());
    }

    @Test
    public void testOverridesKeepUnsetValues() {
        EstimatorSettings settings = EstimatorSettings.defaults().with(0.6, null, 2, null);

        assertEquals(0.6, settings.getConfidenceThreshold());
        assertEquals(4, settings.getInitialTrials());
        assertEquals(2, settings.getTrialIncrement());
        assertEquals(50, settings.getMaxTrials());
    }

    @Test
    public void testRejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> new EstimatorSettings(-0.1, 4, 4, 50));
        assertThrows(IllegalArgumentException.class, () -> new EstimatorSettings(1.5, 4, 4, 50));
        assertThrows(IllegalArgumentException.class, () -> new EstimatorSettings(Double.NaN, 4, 4, 50));
        assertThrows(IllegalArgumentException.class, () -> new EstimatorSettings(0.4, 0, 4, 50));
        assertThrows(IllegalArgumentException.class, () -> new EstimatorSettings(0.4, 4, 0, 50));
        assertThrows(IllegalArgumentException.class, () -> new EstimatorSettings(0.4, 10, 4, 8));
    }

    @Test
    public void testSingleRoundWhenCeilingEqualsInitialTrials() {
        assertEquals(1, new EstimatorSettings(0.4, 8, 4, 8).maxRounds());
    }
}
