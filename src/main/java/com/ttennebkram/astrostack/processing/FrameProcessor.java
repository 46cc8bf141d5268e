package com.ttennebkram.astrostack.processing;

import com.ttennebkram.astrostack.model.PixelGrid;

/**
 * A pure in-memory frame operation.
 * No I/O - takes a grid, transforms it in place and returns it.
 */
@FunctionalInterface
public interface FrameProcessor {
    /**
     * Process a frame.
     *
     * @param grid The frame to transform (caller owns it; do not retain)
     * @return The same grid, after the transformation
     */
    PixelGrid process(PixelGrid grid);
}
