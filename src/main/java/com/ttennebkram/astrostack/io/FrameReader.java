package com.ttennebkram.astrostack.io;

import com.ttennebkram.astrostack.model.PixelGrid;

import java.nio.file.Path;

/**
 * Decodes an image file into a grid, with any orientation correction already applied.
 */
@FunctionalInterface
public interface FrameReader {
    PixelGrid read(Path path) throws FrameIOException;
}
