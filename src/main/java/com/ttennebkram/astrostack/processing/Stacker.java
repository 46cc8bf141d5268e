package com.ttennebkram.astrostack.processing;

import com.ttennebkram.astrostack.model.PixelGrid;

import java.util.Arrays;
import java.util.List;
import java.util.logging.Logger;

/**
 * Averages equally sized, already aligned frames into a new grid.
 * Inputs are read only; the result is freshly allocated and fully opaque.
 */
public class Stacker {

    private static final Logger LOG = Logger.getLogger(Stacker.class.getName());

    /**
     * Mean of the R, G and B channels at every pixel position.
     *
     * @param frames frames to combine, all the same size
     * @return a new grid owned by the caller
     * @throws InvalidFrameException      if the list is null, empty or holds a null frame
     * @throws DimensionMismatchException if any frame differs in size from the first
     */
    public PixelGrid averageStack(List<PixelGrid> frames) {
        validate(frames);

        PixelGrid first = frames.get(0);
        int width = first.getWidth();
        int height = first.getHeight();
        int frameCount = frames.size();
        PixelGrid stacked = new PixelGrid(width, height);

        // Channel sums widened to double; reset per row
        double[] totals = new double[width * 3];

        for (int y = 0; y < height; y++) {
            Arrays.fill(totals, 0.0);
            int rowStart = y * width;

            for (PixelGrid frame : frames) {
                for (int x = 0; x < width; x++) {
                    int index = rowStart + x;
                    totals[x * 3] += (double) frame.red(index);
                    totals[x * 3 + 1] += (double) frame.green(index);
                    totals[x * 3 + 2] += (double) frame.blue(index);
                }
            }

            for (int x = 0; x < width; x++) {
                stacked.set(rowStart + x,
                    PixelGrid.toChannel(totals[x * 3] / frameCount),
                    PixelGrid.toChannel(totals[x * 3 + 1] / frameCount),
                    PixelGrid.toChannel(totals[x * 3 + 2] / frameCount),
                    255);
            }
        }

        LOG.fine(() -> "Averaged " + frameCount + " frames into " + stacked);
        return stacked;
    }

    /**
     * Precondition checks. Runs before any pixel is touched.
     */
    static void validate(List<PixelGrid> frames) {
        if (frames == null || frames.isEmpty()) {
            throw new InvalidFrameException("Provide at least one image to stack.");
        }
        PixelGrid first = frames.get(0);
        if (first == null) {
            throw new InvalidFrameException("Frame 0 is null");
        }
        for (int i = 1; i < frames.size(); i++) {
            PixelGrid frame = frames.get(i);
            if (frame == null) {
                throw new InvalidFrameException("Frame " + i + " is null");
            }
            if (!first.sameSize(frame)) {
                throw new DimensionMismatchException(i,
                    first.getWidth(), first.getHeight(), frame.getWidth(), frame.getHeight());
            }
        }
    }
}
