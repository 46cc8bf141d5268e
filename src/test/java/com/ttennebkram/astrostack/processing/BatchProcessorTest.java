package com.ttennebkram.astrostack.processing;

import static org.junit.jupiter.api.Assertions.*;

import com.ttennebkram.astrostack.TestGrids;
import com.ttennebkram.astrostack.model.PixelGrid;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class BatchProcessorTest {

    @Test
    void matchesSequentialProcessingInInputOrder() throws Exception {
        FramePipeline pipeline = new FramePipeline();
        List<PixelGrid> frames = new ArrayList<>();
        List<PixelGrid> expected = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            PixelGrid frame = TestGrids.noisy(10, 7, i);
            frames.add(frame);
            expected.add(pipeline.process(frame.copy()));
        }

        List<PixelGrid> results;
        try (BatchProcessor batch = new BatchProcessor(pipeline::process, 3)) {
            results = batch.processAll(frames);
        }

        assertEquals(6, results.size());
        for (int i = 0; i < 6; i++) {
            assertSame(frames.get(i), results.get(i));
            assertTrue(expected.get(i).equalsPixels(results.get(i)), "frame " + i);
        }
    }

    @Test
    void failureNamesTheFrame() {
        FrameProcessor failing = grid -> {
            if (grid.getWidth() == 3) {
                throw new IllegalStateException("boom");
            }
            return grid;
        };
        List<PixelGrid> frames = List.of(new PixelGrid(2, 2), new PixelGrid(3, 3));

        try (BatchProcessor batch = new BatchProcessor(failing, 2)) {
            FrameProcessingException e = assertThrows(FrameProcessingException.class,
                () -> batch.processAll(frames, List.of("a.tif", "b.tif")));
            assertEquals("b.tif", e.getFrameLabel());
            assertTrue(e.getCause() instanceof IllegalStateException);
        }
    }

    @Test
    void rejectsBadConfiguration() {
        assertThrows(IllegalArgumentException.class, () -> new BatchProcessor(grid -> grid, 0));
        assertThrows(IllegalArgumentException.class, () -> new BatchProcessor(null, 2));
    }

    @Test
    void labelCountMustMatch() {
        try (BatchProcessor batch = new BatchProcessor(grid -> grid, 1)) {
            assertThrows(IllegalArgumentException.class,
                () -> batch.processAll(List.of(new PixelGrid(1, 1)), List.of()));
        }
    }
}
