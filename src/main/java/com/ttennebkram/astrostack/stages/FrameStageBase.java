package com.ttennebkram.astrostack.stages;

import com.google.gson.JsonObject;
import com.ttennebkram.astrostack.model.PixelGrid;
import com.ttennebkram.astrostack.processing.InvalidFrameException;

/**
 * Abstract base class for frame stages.
 * Provides the metadata lookup from {@link StageInfo} and JSON helpers.
 */
public abstract class FrameStageBase implements FrameStage {

    @Override
    public String getStageType() {
        StageInfo info = getClass().getAnnotation(StageInfo.class);
        return info != null ? info.stageType() : getClass().getSimpleName();
    }

    @Override
    public String getCategory() {
        StageInfo info = getClass().getAnnotation(StageInfo.class);
        return info != null ? info.category() : "";
    }

    /**
     * Standard null check. Call at the start of process().
     */
    protected void requireGrid(PixelGrid grid) {
        if (grid == null) {
            throw new InvalidFrameException(getStageType() + " requires a frame, got null");
        }
    }

    /**
     * Helper to safely get a double from JSON.
     */
    protected double getJsonDouble(JsonObject json, String key, double defaultValue) {
        if (json.has(key)) {
            return json.get(key).getAsDouble();
        }
        return defaultValue;
    }

    @Override
    public String toString() {
        JsonObject json = new JsonObject();
        serializeProperties(json);
        return json.size() == 0 ? getStageType() : getStageType() + json;
    }
}
