package com.edge.odometry.core.odometry;

import static org.junit.jupiter.api.Assertions.*;

import com.edge.odometry.core.odometry.model.DisplacementVector;
import com.edge.odometry.core.odometry.model.MatchResult;
import com.edge.odometry.core.odometry.model.Patch;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.opencv.core.Rect;

public class DisplacementVectorTest {

    @Test
    public void testSubtractsPatchOriginInColumnRowOrder() {
        Patch patch = new Patch(null, new Rect(10, 20, 5, 7));
        MatchResult match = new MatchResult(13, 18, 0.99);

        assertEquals(new DisplacementVector(3, -2), DisplacementVector.between(match, patch));
    }

    @Test
    public void testLexicographicOrder() {
        List<DisplacementVector> vectors = new ArrayList<>(List.of(
                new DisplacementVector(1, 0),
                new DisplacementVector(0, 5),
                new DisplacementVector(0, -1),
                new DisplacementVector(-3, 9)));
        Collections.sort(vectors);

        assertEquals(List.of(
                new DisplacementVector(-3, 9),
                new DisplacementVector(0, -1),
                new DisplacementVector(0, 5),
                new DisplacementVector(1, 0)), vectors);
    }

    @Test
    public void testEquality() {
        DisplacementVector a = new DisplacementVector(4, -4);
        DisplacementVector b = new DisplacementVector(4, -4);

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, new DisplacementVector(-4, 4));
        assertEquals("(0, 0)", DisplacementVector.ZERO.toString());
    }
}
