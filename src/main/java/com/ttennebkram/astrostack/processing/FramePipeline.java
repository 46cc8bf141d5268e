package com.ttennebkram.astrostack.processing;

import com.ttennebkram.astrostack.model.PixelGrid;
import com.ttennebkram.astrostack.stages.BoostSaturationStage;
import com.ttennebkram.astrostack.stages.GammaStage;
import com.ttennebkram.astrostack.stages.NormalizeChannelsStage;
import com.ttennebkram.astrostack.stages.ReduceNoiseStage;
import com.ttennebkram.astrostack.stages.StretchHistogramStage;

/**
 * Single-frame enhancement.
 *
 * {@link #process} runs the full light-frame chain on a freshly loaded frame;
 * {@link #refine} runs the lighter chain used on an averaged stack, which
 * leaves out noise reduction. Both mutate and return the grid they are given.
 */
public class FramePipeline {

    public static final double LIGHT_FRAME_GAMMA = 0.85;
    public static final double LIGHT_FRAME_SATURATION = 1.15;
    public static final double REFINE_GAMMA = 0.9;
    public static final double REFINE_SATURATION = 1.08;

    private final StageChain frameChain;
    private final StageChain refineChain;

    /**
     * Pipeline with the built-in light-frame and refinement chains.
     */
    public FramePipeline() {
        this(lightFrameChain(), stackRefinementChain());
    }

    public FramePipeline(StageChain frameChain, StageChain refineChain) {
        if (frameChain == null || refineChain == null) {
            throw new IllegalArgumentException("Both stage chains are required");
        }
        this.frameChain = frameChain;
        this.refineChain = refineChain;
    }

    /**
     * normalize, stretch, gamma 0.85, noise reduction, saturation 1.15.
     */
    public static StageChain lightFrameChain() {
        return new StageChain("light-frame")
            .add(new NormalizeChannelsStage())
            .add(new StretchHistogramStage())
            .add(new GammaStage(LIGHT_FRAME_GAMMA))
            .add(new ReduceNoiseStage())
            .add(new BoostSaturationStage(LIGHT_FRAME_SATURATION));
    }

    /**
     * normalize, stretch, gamma 0.9, saturation 1.08.
     * Averaging already suppresses noise, so there is no smoothing step.
     */
    public static StageChain stackRefinementChain() {
        return new StageChain("stack-refine")
            .add(new NormalizeChannelsStage())
            .add(new StretchHistogramStage())
            .add(new GammaStage(REFINE_GAMMA))
            .add(new BoostSaturationStage(REFINE_SATURATION));
    }

    /**
     * Enhance one light frame in place.
     */
    public PixelGrid process(PixelGrid grid) {
        return frameChain.process(grid);
    }

    /**
     * Final tone pass over an averaged stack, in place.
     */
    public PixelGrid refine(PixelGrid grid) {
        return refineChain.process(grid);
    }

    public StageChain getFrameChain() {
        return frameChain;
    }

    public StageChain getRefineChain() {
        return refineChain;
    }
}
