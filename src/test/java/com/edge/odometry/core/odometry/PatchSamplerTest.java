package com.edge.odometry.core.odometry;

import static org.junit.jupiter.api.Assertions.*;

import com.edge.odometry.config.NativeLibraryLoader;
import com.edge.odometry.core.odometry.model.Patch;
import java.util.Random;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Rect;
import org.opencv.core.Scalar;

public class PatchSamplerTest {

    @BeforeAll
    public static void init() {
        NativeLibraryLoader.loadNativeLibraries();
    }

    private static PatchSampler sampler(long seed) {
        return new PatchSampler(new Random(seed), new IntensityNormalizer(255.0));
    }

    @Test
    public void testRegionsStayInsideFrameAndAreNonEmpty() {
        PatchSampler sampler = sampler(7);
        int width = 40;
        int height = 23;

        for (int i = 0; i < 2000; i++) {
            Rect r = sampler.sampleRegion(width, height);

            assertTrue(r.x >= 0 && r.x < width - PatchSampler.MARGIN, "x1 out of range: " + r);
            assertTrue(r.y >= 0 && r.y < height - PatchSampler.MARGIN, "y1 out of range: " + r);
            assertTrue(r.width >= 1 && r.height >= 1, "degenerate region: " + r);
            // x2 < w, y2 < h
            assertTrue(r.x + r.width <= width - 1, "x2 out of range: " + r);
            assertTrue(r.y + r.height <= height - 1, "y2 out of range: " + r);
        }
    }

    @Test
    public void testMinimumFrameSize() {
        PatchSampler sampler = sampler(1);

        for (int i = 0; i < 200; i++) {
            Rect r = sampler.sampleRegion(6, 6);
            assertEquals(0, r.x);
            assertEquals(0, r.y);
            assertTrue(r.width >= 1 && r.width <= 5);
            assertTrue(r.height >= 1 && r.height <= 5);
        }
    }

    @Test
    public void testRejectsFramesOfFiveOrLess() {
        PatchSampler sampler = sampler(1);

        assertThrows(IllegalArgumentException.class, () -> sampler.sampleRegion(5, 5));
        assertThrows(IllegalArgumentException.class, () -> sampler.sampleRegion(6, 5));
        assertThrows(IllegalArgumentException.class, () -> sampler.sampleRegion(5, 6));
        assertThrows(IllegalArgumentException.class, () -> sampler.sampleRegion(0, 100));
    }

    @Test
    public void testSameSeedSameRegions() {
        PatchSampler a = sampler(42);
        PatchSampler b = sampler(42);

        for (int i = 0; i < 50; i++) {
            assertEquals(a.sampleRegion(64, 48), b.sampleRegion(64, 48));
        }
    }

    @Test
    public void testSamplePatchNormalizesCrop() {
        Mat frame = SyntheticFrames.texture(32, 24, 3);
        Patch patch = null;
        try {
            patch = sampler(11).samplePatch(frame);

            Mat data = patch.getData();
            assertEquals(CvType.CV_32F, data.depth());
            assertEquals(patch.getWidth(), data.cols());
            assertEquals(patch.getHeight(), data.rows());

            Core.MinMaxLocResult mm = Core.minMaxLoc(data);
            assertTrue(mm.minVal >= 0.0);
            assertTrue(mm.maxVal <= 1.0);

            int col = patch.getX();
            int row = patch.getY();
            double expected = frame.get(row, col)[0] / 255.0;
            assertEquals(expected, data.get(0, 0)[0], 1e-6);
        } finally {
            if (patch != null) {
                patch.release();
            }
            frame.release();
        }
    }

    @Test
    public void testSamplePatchKeepsColorChannels() {
        Mat frame = SyntheticFrames.texture(30, 20, 3, 6);
        Patch patch = null;
        try {
            patch = sampler(13).samplePatch(frame);

            Mat data = patch.getData();
            assertEquals(CvType.CV_32FC3, data.type());
            double[] source = frame.get(patch.getY(), patch.getX());
            double[] normalized = data.get(0, 0);
            for (int c = 0; c < 3; c++) {
                assertEquals(source[c] / 255.0, normalized[c], 1e-6);
            }
        } finally {
            if (patch != null) {
                patch.release();
            }
            frame.release();
        }
    }

    @Test
    public void testSourceFrameIsNotModified() {
        Mat frame = new Mat(10, 10, CvType.CV_8UC1, new Scalar(200));
        try {
            Patch patch = sampler(5).samplePatch(frame);
            patch.release();

            assertEquals(200.0, frame.get(3, 3)[0]);
            assertEquals(CvType.CV_8UC1, frame.type());
        } finally {
            frame.release();
        }
    }
}
