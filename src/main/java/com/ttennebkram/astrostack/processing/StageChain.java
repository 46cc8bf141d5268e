package com.ttennebkram.astrostack.processing;

import com.ttennebkram.astrostack.model.PixelGrid;
import com.ttennebkram.astrostack.stages.FrameStage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * An ordered, named sequence of stages applied to one grid in place.
 * Disabled stages stay in the chain (so recipes round-trip) but are skipped.
 */
public class StageChain implements FrameProcessor {

    private static final Logger LOG = Logger.getLogger(StageChain.class.getName());

    /**
     * One stage in the chain plus its enabled flag.
     */
    public static class Step {
        public final FrameStage stage;
        public final boolean enabled;

        public Step(FrameStage stage, boolean enabled) {
            this.stage = stage;
            this.enabled = enabled;
        }
    }

    private final String name;
    private final List<Step> steps = new ArrayList<>();

    public StageChain(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public StageChain add(FrameStage stage) {
        return add(stage, true);
    }

    public StageChain add(FrameStage stage, boolean enabled) {
        if (stage == null) {
            throw new IllegalArgumentException("Stage must not be null");
        }
        steps.add(new Step(stage, enabled));
        return this;
    }

    public List<Step> getSteps() {
        return Collections.unmodifiableList(steps);
    }

    /**
     * Stages that will actually run, in order.
     */
    public List<FrameStage> getEnabledStages() {
        List<FrameStage> enabled = new ArrayList<>();
        for (Step step : steps) {
            if (step.enabled) {
                enabled.add(step.stage);
            }
        }
        return enabled;
    }

    @Override
    public PixelGrid process(PixelGrid grid) {
        if (grid == null) {
            throw new InvalidFrameException(name + " requires a frame, got null");
        }
        for (Step step : steps) {
            if (!step.enabled) {
                continue;
            }
            long start = System.nanoTime();
            step.stage.process(grid);
            if (LOG.isLoggable(Level.FINE)) {
                LOG.fine(String.format("[%s] %s on %s took %.1f ms",
                    name, step.stage.getStageType(), grid, (System.nanoTime() - start) / 1e6));
            }
        }
        return grid;
    }

    @Override
    public String toString() {
        return name + getEnabledStages();
    }
}
