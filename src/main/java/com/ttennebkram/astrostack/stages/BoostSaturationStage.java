package com.ttennebkram.astrostack.stages;

import com.google.gson.JsonObject;
import com.ttennebkram.astrostack.model.PixelGrid;

/**
 * Saturation boost.
 * Pushes each channel away from the pixel's own gray point (plain mean of R, G, B)
 * by the given factor. Alpha is untouched.
 */
@StageInfo(stageType = "BoostSaturation", category = "Color")
public class BoostSaturationStage extends FrameStageBase {

    public static final double DEFAULT_FACTOR = 1.0;

    // Properties with defaults
    private double factor = DEFAULT_FACTOR;

    public BoostSaturationStage() {
    }

    public BoostSaturationStage(double factor) {
        setFactor(factor);
    }

    @Override
    public String getDescription() {
        return "Saturation boost\nc' = gray + (c - gray) * factor, gray = (R + G + B) / 3";
    }

    @Override
    public PixelGrid process(PixelGrid grid) {
        requireGrid(grid);

        int count = grid.getPixelCount();
        for (int i = 0; i < count; i++) {
            int r = grid.red(i);
            int g = grid.green(i);
            int b = grid.blue(i);
            double gray = (r + g + b) / 3.0;
            grid.setRgb(i,
                PixelGrid.toChannel(gray + (r - gray) * factor),
                PixelGrid.toChannel(gray + (g - gray) * factor),
                PixelGrid.toChannel(gray + (b - gray) * factor));
        }
        return grid;
    }

    public double getFactor() {
        return factor;
    }

    public void setFactor(double factor) {
        if (Double.isNaN(factor) || Double.isInfinite(factor)) {
            throw new IllegalArgumentException("Saturation factor must be finite, got " + factor);
        }
        this.factor = factor;
    }

    @Override
    public void serializeProperties(JsonObject json) {
        json.addProperty("factor", factor);
    }

    @Override
    public void deserializeProperties(JsonObject json) {
        setFactor(getJsonDouble(json, "factor", DEFAULT_FACTOR));
    }
}
