package com.ttennebkram.astrostack.stages;

import com.ttennebkram.astrostack.model.PixelGrid;

/**
 * Per-channel scale factors computed from the channel means of a whole frame.
 * Immutable; produced by {@link #measure(PixelGrid)} and applied pixel by pixel.
 */
public final class ChannelBalance {

    private final double meanRed;
    private final double meanGreen;
    private final double meanBlue;
    private final double scaleRed;
    private final double scaleGreen;
    private final double scaleBlue;

    private ChannelBalance(double meanRed, double meanGreen, double meanBlue) {
        this.meanRed = meanRed;
        this.meanGreen = meanGreen;
        this.meanBlue = meanBlue;

        double target = (meanRed + meanGreen + meanBlue) / 3.0;
        this.scaleRed = meanRed > 0 ? target / meanRed : 1.0;
        this.scaleGreen = meanGreen > 0 ? target / meanGreen : 1.0;
        this.scaleBlue = meanBlue > 0 ? target / meanBlue : 1.0;
    }

    /**
     * Reduction pass: average R, G and B over every pixel.
     */
    public static ChannelBalance measure(PixelGrid grid) {
        double sumR = 0;
        double sumG = 0;
        double sumB = 0;
        int count = grid.getPixelCount();

        for (int i = 0; i < count; i++) {
            sumR += grid.red(i);
            sumG += grid.green(i);
            sumB += grid.blue(i);
        }

        return new ChannelBalance(sumR / count, sumG / count, sumB / count);
    }

    public double getMeanRed() {
        return meanRed;
    }

    public double getMeanGreen() {
        return meanGreen;
    }

    public double getMeanBlue() {
        return meanBlue;
    }

    public double getScaleRed() {
        return scaleRed;
    }

    public double getScaleGreen() {
        return scaleGreen;
    }

    public double getScaleBlue() {
        return scaleBlue;
    }

    /**
     * Mapping pass for one pixel. Alpha is kept.
     */
    public void apply(PixelGrid grid, int index) {
        grid.setRgb(index,
            PixelGrid.toChannel(grid.red(index) * scaleRed),
            PixelGrid.toChannel(grid.green(index) * scaleGreen),
            PixelGrid.toChannel(grid.blue(index) * scaleBlue));
    }

    @Override
    public String toString() {
        return String.format("ChannelBalance[means=%.2f/%.2f/%.2f, scales=%.4f/%.4f/%.4f]",
            meanRed, meanGreen, meanBlue, scaleRed, scaleGreen, scaleBlue);
    }
}
