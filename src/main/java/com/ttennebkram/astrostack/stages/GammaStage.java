package com.ttennebkram.astrostack.stages;

import com.google.gson.JsonObject;
import com.ttennebkram.astrostack.model.PixelGrid;

/**
 * Gamma correction.
 * Each channel becomes (v/255)^(1/gamma) * 255. With this convention a gamma
 * below 1 raises values to a power above 1 and so darkens the midtones;
 * the default recipes are tuned against it.
 */
@StageInfo(stageType = "Gamma", category = "Tone")
public class GammaStage extends FrameStageBase {

    public static final double DEFAULT_GAMMA = 1.0;

    // Properties with defaults
    private double gamma = DEFAULT_GAMMA;

    public GammaStage() {
    }

    public GammaStage(double gamma) {
        setGamma(gamma);
    }

    @Override
    public String getDescription() {
        return "Gamma correction\nv' = 255 * (v / 255)^(1 / gamma)";
    }

    @Override
    public PixelGrid process(PixelGrid grid) {
        requireGrid(grid);

        int[] table = buildTable(gamma);
        int count = grid.getPixelCount();
        for (int i = 0; i < count; i++) {
            grid.setRgb(i, table[grid.red(i)], table[grid.green(i)], table[grid.blue(i)]);
        }
        return grid;
    }

    /**
     * Lookup table for all 256 channel values.
     */
    static int[] buildTable(double gamma) {
        double inverseGamma = 1.0 / gamma;
        int[] table = new int[256];
        for (int v = 0; v < 256; v++) {
            table[v] = correct(v, inverseGamma);
        }
        return table;
    }

    static int correct(int value, double inverseGamma) {
        double normalized = value / 255.0;
        double corrected = Math.pow(normalized, inverseGamma);
        return PixelGrid.toChannel(corrected * 255.0);
    }

    public double getGamma() {
        return gamma;
    }

    public void setGamma(double gamma) {
        if (!(gamma > 0) || Double.isInfinite(gamma)) {
            throw new IllegalArgumentException("Gamma must be a positive finite number, got " + gamma);
        }
        this.gamma = gamma;
    }

    @Override
    public void serializeProperties(JsonObject json) {
        json.addProperty("gamma", gamma);
    }

    @Override
    public void deserializeProperties(JsonObject json) {
        setGamma(getJsonDouble(json, "gamma", DEFAULT_GAMMA));
    }
}
