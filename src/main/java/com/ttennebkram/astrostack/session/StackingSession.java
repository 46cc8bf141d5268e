package com.ttennebkram.astrostack.session;

import com.ttennebkram.astrostack.io.FrameIOException;
import com.ttennebkram.astrostack.io.FrameReader;
import com.ttennebkram.astrostack.io.FrameWriter;
import com.ttennebkram.astrostack.model.PixelGrid;
import com.ttennebkram.astrostack.processing.BatchProcessor;
import com.ttennebkram.astrostack.processing.FramePipeline;
import com.ttennebkram.astrostack.processing.InvalidFrameException;
import com.ttennebkram.astrostack.processing.Stacker;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * Load, enhance, stack and save workflow over a set of light frames.
 * Frames are kept in load order; the latest composite is kept until the next
 * stack or clear.
 */
public class StackingSession {

    private static final Logger LOG = Logger.getLogger(StackingSession.class.getName());

    private final FrameReader reader;
    private final FrameWriter writer;
    private final FramePipeline pipeline;
    private final Stacker stacker;
    private final Clock clock;

    private final List<ProcessedFrame> frames = new ArrayList<>();
    private PixelGrid stacked;

    public StackingSession(FrameReader reader, FrameWriter writer, FramePipeline pipeline) {
        this(reader, writer, pipeline, new Stacker(), Clock.systemUTC());
    }

    public StackingSession(FrameReader reader, FrameWriter writer, FramePipeline pipeline,
                           Stacker stacker, Clock clock) {
        this.reader = reader;
        this.writer = writer;
        this.pipeline = pipeline;
        this.stacker = stacker;
        this.clock = clock;
    }

    /**
     * Read and enhance frames one at a time. Stops at the first failure;
     * frames loaded before it stay in the session.
     *
     * @return number of frames added
     */
    public int load(List<Path> paths) throws FrameIOException {
        int added = 0;
        for (Path path : paths) {
            LOG.info(() -> "Processing " + path.getFileName());
            PixelGrid grid = pipeline.process(reader.read(path));
            frames.add(new ProcessedFrame(path, grid, clock.instant()));
            added++;
        }
        int total = frames.size();
        LOG.info(() -> "Loaded " + total + " frame(s).");
        return added;
    }

    /**
     * Read every frame, then enhance them on a worker pool.
     * Nothing is added unless every frame succeeds.
     *
     * @return number of frames added
     */
    public int loadConcurrently(List<Path> paths, int threads) throws FrameIOException, InterruptedException {
        List<PixelGrid> grids = new ArrayList<>();
        List<String> labels = new ArrayList<>();
        for (Path path : paths) {
            grids.add(reader.read(path));
            labels.add(String.valueOf(path.getFileName()));
        }

        List<PixelGrid> processed;
        try (BatchProcessor batch = new BatchProcessor(pipeline::process, threads)) {
            processed = batch.processAll(grids, labels);
        }

        for (int i = 0; i < paths.size(); i++) {
            frames.add(new ProcessedFrame(paths.get(i), processed.get(i), clock.instant()));
        }
        int total = frames.size();
        LOG.info(() -> "Loaded " + total + " frame(s) on " + threads + " thread(s).");
        return paths.size();
    }

    public List<ProcessedFrame> getFrames() {
        return Collections.unmodifiableList(frames);
    }

    /**
     * Average every loaded frame and refine the result.
     *
     * @throws InvalidFrameException if no frame is loaded
     */
    public PixelGrid stack() {
        if (frames.isEmpty()) {
            throw new InvalidFrameException("Add at least one processed frame before stacking.");
        }

        List<PixelGrid> grids = new ArrayList<>(frames.size());
        for (ProcessedFrame frame : frames) {
            grids.add(frame.getGrid());
        }

        LOG.info(() -> "Stacking " + grids.size() + " frame(s)...");
        PixelGrid result = pipeline.refine(stacker.averageStack(grids));
        stacked = result;
        LOG.info("Stacking completed.");
        return result;
    }

    /**
     * The latest composite, or null if nothing has been stacked.
     */
    public PixelGrid getStacked() {
        return stacked;
    }

    /**
     * Save the latest composite.
     *
     * @throws IllegalStateException if stack() has not been called
     */
    public void save(Path path) throws FrameIOException {
        if (stacked == null) {
            throw new IllegalStateException("Stack the images before saving the combined frame.");
        }
        writer.write(stacked, path);
        LOG.info(() -> "Saved " + path.getFileName() + ".");
    }

    /**
     * Write every enhanced frame into a directory as PNG.
     */
    public void saveFrames(Path directory) throws FrameIOException {
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new FrameIOException("Cannot create output directory " + directory, e);
        }
        for (ProcessedFrame frame : frames) {
            String name = frame.getFileName();
            int dot = name.lastIndexOf('.');
            String base = dot > 0 ? name.substring(0, dot) : name;
            writer.write(frame.getGrid(), directory.resolve(base + "_processed.png"));
        }
    }

    /**
     * Drop all frames and the composite.
     */
    public void clear() {
        frames.clear();
        stacked = null;
        LOG.info("Cleared all frames.");
    }
}
