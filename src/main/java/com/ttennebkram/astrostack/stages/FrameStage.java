package com.ttennebkram.astrostack.stages;

import com.google.gson.JsonObject;
import com.ttennebkram.astrostack.model.PixelGrid;
import com.ttennebkram.astrostack.processing.FrameProcessor;

/**
 * Interface for self-contained frame enhancement stages.
 * Each stage encapsulates:
 * - Processing logic (in-place pixel operation)
 * - Serialization/deserialization of its parameters (JSON recipes)
 *
 * A stage takes exclusive access to the grid for the duration of
 * process() and keeps no reference to it afterwards.
 */
public interface FrameStage {

    /**
     * Get the stage type name (e.g., "Gamma", "ReduceNoise").
     * Must match the type name used in recipes.
     */
    String getStageType();

    /**
     * Get the category for grouping (e.g., "Tone", "Color").
     */
    String getCategory();

    /**
     * Get a one-line description of what this stage does.
     */
    String getDescription();

    /**
     * Transform the grid in place.
     *
     * @param grid The frame to transform
     * @return The same grid
     */
    PixelGrid process(PixelGrid grid);

    /**
     * Adapt this stage to the plain FrameProcessor contract.
     */
    default FrameProcessor asFrameProcessor() {
        return this::process;
    }

    /**
     * Check if this stage has configurable parameters.
     */
    default boolean hasProperties() {
        return true;
    }

    /**
     * Serialize stage-specific parameters to JSON.
     *
     * @param json The JSON object to add properties to
     */
    void serializeProperties(JsonObject json);

    /**
     * Deserialize stage-specific parameters from JSON.
     * Missing keys keep their defaults.
     *
     * @param json The JSON object to read properties from
     */
    void deserializeProperties(JsonObject json);
}
