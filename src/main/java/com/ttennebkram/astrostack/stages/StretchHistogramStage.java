package com.ttennebkram.astrostack.stages;

import com.google.gson.JsonObject;
import com.ttennebkram.astrostack.model.PixelGrid;

import java.util.logging.Logger;

/**
 * Percentile histogram stretch.
 * Maps the low/high luminance percentiles (1st and 99th by default) onto 0..255,
 * so a handful of hot or dead pixels cannot pin the range.
 */
@StageInfo(stageType = "StretchHistogram", category = "Tone", twoPhase = true)
public class StretchHistogramStage extends FrameStageBase {

    private static final Logger LOG = Logger.getLogger(StretchHistogramStage.class.getName());

    public static final double DEFAULT_LOW_PERCENTILE = 0.01;
    public static final double DEFAULT_HIGH_PERCENTILE = 0.99;

    // Properties with defaults
    private double lowPercentile = DEFAULT_LOW_PERCENTILE;
    private double highPercentile = DEFAULT_HIGH_PERCENTILE;

    public StretchHistogramStage() {
    }

    public StretchHistogramStage(double lowPercentile, double highPercentile) {
        setPercentiles(lowPercentile, highPercentile);
    }

    @Override
    public String getDescription() {
        return "Histogram stretch\nluminance percentiles " + lowPercentile + " .. " + highPercentile + " -> 0 .. 255";
    }

    @Override
    public PixelGrid process(PixelGrid grid) {
        requireGrid(grid);

        StretchRange range = StretchRange.measure(grid, lowPercentile, highPercentile);
        LOG.finer(() -> "Measured " + range);

        int count = grid.getPixelCount();
        for (int i = 0; i < count; i++) {
            range.apply(grid, i);
        }
        return grid;
    }

    public double getLowPercentile() {
        return lowPercentile;
    }

    public double getHighPercentile() {
        return highPercentile;
    }

    public void setPercentiles(double low, double high) {
        if (!(low >= 0 && low <= 1) || !(high >= 0 && high <= 1) || low > high) {
            throw new IllegalArgumentException(
                "Percentiles must satisfy 0 <= low <= high <= 1, got " + low + " and " + high);
        }
        this.lowPercentile = low;
        this.highPercentile = high;
    }

    @Override
    public void serializeProperties(JsonObject json) {
        json.addProperty("lowPercentile", lowPercentile);
        json.addProperty("highPercentile", highPercentile);
    }

    @Override
    public void deserializeProperties(JsonObject json) {
        setPercentiles(
            getJsonDouble(json, "lowPercentile", DEFAULT_LOW_PERCENTILE),
            getJsonDouble(json, "highPercentile", DEFAULT_HIGH_PERCENTILE));
    }
}
