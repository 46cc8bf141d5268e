package com.ttennebkram.astrostack.stages;

import com.ttennebkram.astrostack.model.PixelGrid;

/**
 * Black and white points of a luminance histogram stretch.
 * Immutable; produced by {@link #measure} and applied pixel by pixel.
 */
public final class StretchRange {

    public static final int BUCKETS = 256;

    private static final double LUMA_RED = 0.2126;
    private static final double LUMA_GREEN = 0.7152;
    private static final double LUMA_BLUE = 0.0722;

    private final int low;
    private final int high;
    private final double scale;

    StretchRange(int low, int high) {
        // A zero-width range would divide by zero; widen it by one bucket
        if (high <= low) {
            high = Math.min(255, low + 1);
            low = Math.max(0, high - 1);
        }
        this.low = low;
        this.high = high;
        this.scale = 255.0 / Math.max(1, high - low);
    }

    /**
     * Reduction pass: histogram of Rec.709 luminance and percentile cutoffs.
     *
     * @param lowPercentile  fraction of pixels at or below the black point (e.g. 0.01)
     * @param highPercentile fraction of pixels at or below the white point (e.g. 0.99)
     */
    public static StretchRange measure(PixelGrid grid, double lowPercentile, double highPercentile) {
        int[] histogram = luminanceHistogram(grid);
        int pixelCount = grid.getPixelCount();

        int lowThreshold = (int) (pixelCount * lowPercentile);
        int highThreshold = (int) (pixelCount * highPercentile);

        return new StretchRange(
            firstBucketReaching(histogram, lowThreshold, 0),
            firstBucketReaching(histogram, highThreshold, 255));
    }

    static int[] luminanceHistogram(PixelGrid grid) {
        int[] histogram = new int[BUCKETS];
        int count = grid.getPixelCount();
        for (int i = 0; i < count; i++) {
            histogram[luminance(grid.red(i), grid.green(i), grid.blue(i))]++;
        }
        return histogram;
    }

    static int luminance(int r, int g, int b) {
        return PixelGrid.toChannel(LUMA_RED * r + LUMA_GREEN * g + LUMA_BLUE * b);
    }

    private static int firstBucketReaching(int[] histogram, int threshold, int fallback) {
        int cumulative = 0;
        for (int i = 0; i < histogram.length; i++) {
            cumulative += histogram[i];
            if (cumulative >= threshold) {
                return i;
            }
        }
        return fallback;
    }

    public int getLow() {
        return low;
    }

    public int getHigh() {
        return high;
    }

    public double getScale() {
        return scale;
    }

    /**
     * Remap one channel value into the stretched range.
     */
    public int stretch(int value) {
        return PixelGrid.toChannel((value - low) * scale);
    }

    /**
     * Mapping pass for one pixel. Alpha is kept.
     */
    public void apply(PixelGrid grid, int index) {
        grid.setRgb(index,
            stretch(grid.red(index)),
            stretch(grid.green(index)),
            stretch(grid.blue(index)));
    }

    @Override
    public String toString() {
        return "StretchRange[low=" + low + ", high=" + high + "]";
    }
}
