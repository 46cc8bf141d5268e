package com.ttennebkram.astrostack.io;

import com.ttennebkram.astrostack.model.PixelGrid;

import java.nio.file.Path;

/**
 * Encodes a grid to an image file. The container is chosen from the file extension.
 */
@FunctionalInterface
public interface FrameWriter {
    void write(PixelGrid grid, Path path) throws FrameIOException;
}
