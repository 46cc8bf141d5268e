package com.ttennebkram.astrostack.stages;

import com.google.gson.JsonObject;
import com.ttennebkram.astrostack.model.PixelGrid;

/**
 * Local noise smoothing.
 * Blends each pixel with the mean of its 3x3 neighbourhood, read from a snapshot
 * taken before any pixel is written. Neighbours outside the frame are skipped,
 * so edges and corners average over fewer samples. Alpha is forced to 255.
 */
@StageInfo(stageType = "ReduceNoise", category = "Noise", forcesOpaque = true)
public class ReduceNoiseStage extends FrameStageBase {

    public static final double DEFAULT_ORIGINAL_WEIGHT = 0.4;

    // Properties with defaults
    private double originalWeight = DEFAULT_ORIGINAL_WEIGHT;

    public ReduceNoiseStage() {
    }

    public ReduceNoiseStage(double originalWeight) {
        setOriginalWeight(originalWeight);
    }

    @Override
    public String getDescription() {
        return "Noise reduction\n" + originalWeight + " * pixel + " + (1.0 - originalWeight) + " * mean(3x3)";
    }

    @Override
    public PixelGrid process(PixelGrid grid) {
        requireGrid(grid);

        PixelGrid snapshot = grid.copy();
        int width = grid.getWidth();
        int height = grid.getHeight();
        double smoothedWeight = 1.0 - originalWeight;
        double[] mean = new double[3];

        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                neighbourhoodMean(snapshot, x, y, mean);
                int index = y * width + x;
                grid.set(index,
                    PixelGrid.toChannel(snapshot.red(index) * originalWeight + mean[0] * smoothedWeight),
                    PixelGrid.toChannel(snapshot.green(index) * originalWeight + mean[1] * smoothedWeight),
                    PixelGrid.toChannel(snapshot.blue(index) * originalWeight + mean[2] * smoothedWeight),
                    255);
            }
        }
        return grid;
    }

    /**
     * Mean R, G, B of the in-bounds 3x3 neighbourhood around (x, y).
     *
     * @return number of samples averaged
     */
    static int neighbourhoodMean(PixelGrid source, int x, int y, double[] out) {
        int width = source.getWidth();
        int height = source.getHeight();
        double sumR = 0;
        double sumG = 0;
        double sumB = 0;
        int count = 0;

        for (int dy = -1; dy <= 1; dy++) {
            int sy = y + dy;
            if (sy < 0 || sy >= height) continue;
            for (int dx = -1; dx <= 1; dx++) {
                int sx = x + dx;
                if (sx < 0 || sx >= width) continue;
                int index = sy * width + sx;
                sumR += source.red(index);
                sumG += source.green(index);
                sumB += source.blue(index);
                count++;
            }
        }

        out[0] = sumR / count;
        out[1] = sumG / count;
        out[2] = sumB / count;
        return count;
    }

    public double getOriginalWeight() {
        return originalWeight;
    }

    public void setOriginalWeight(double originalWeight) {
        if (!(originalWeight >= 0 && originalWeight <= 1)) {
            throw new IllegalArgumentException("Original weight must be within [0, 1], got " + originalWeight);
        }
        this.originalWeight = originalWeight;
    }

    @Override
    public void serializeProperties(JsonObject json) {
        json.addProperty("originalWeight", originalWeight);
    }

    @Override
    public void deserializeProperties(JsonObject json) {
        setOriginalWeight(getJsonDouble(json, "originalWeight", DEFAULT_ORIGINAL_WEIGHT));
    }
}
