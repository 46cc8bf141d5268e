package com.ttennebkram.astrostack.processing;

/**
 * Thrown when frames to be stacked do not share the same width and height.
 */
public class DimensionMismatchException extends IllegalArgumentException {

    private final int frameIndex;

    public DimensionMismatchException(int frameIndex, int expectedWidth, int expectedHeight,
                                      int actualWidth, int actualHeight) {
        super("Frame " + frameIndex + " is " + actualWidth + "x" + actualHeight +
              ", expected " + expectedWidth + "x" + expectedHeight +
              ". All frames must share the same resolution before stacking.");
        this.frameIndex = frameIndex;
    }

    /**
     * Index of the first frame whose size differs from frame 0.
     */
    public int getFrameIndex() {
        return frameIndex;
    }
}
