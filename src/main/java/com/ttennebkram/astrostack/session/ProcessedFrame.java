package com.ttennebkram.astrostack.session;

import com.ttennebkram.astrostack.model.PixelGrid;

import java.nio.file.Path;
import java.time.Instant;

/**
 * One enhanced light frame kept by a session.
 */
public class ProcessedFrame {

    private final Path sourcePath;
    private final PixelGrid grid;
    private final Instant processedAt;

    public ProcessedFrame(Path sourcePath, PixelGrid grid, Instant processedAt) {
        this.sourcePath = sourcePath;
        this.grid = grid;
        this.processedAt = processedAt;
    }

    public Path getSourcePath() {
        return sourcePath;
    }

    public String getFileName() {
        Path name = sourcePath.getFileName();
        return name != null ? name.toString() : sourcePath.toString();
    }

    public PixelGrid getGrid() {
        return grid;
    }

    public Instant getProcessedAt() {
        return processedAt;
    }

    @Override
    public String toString() {
        return getFileName() + " " + grid;
    }
}
