package com.ttennebkram.astrostack.model;

import com.ttennebkram.astrostack.processing.InvalidFrameException;

import java.util.Arrays;

/**
 * Rectangular 8-bit RGBA image buffer.
 * Pixels are stored row-major, packed as 0xAARRGGBB in an int[].
 *
 * Stages mutate a grid in place; anything that needs a stable view
 * of the pixels while writing (noise reduction) works from {@link #copy()}.
 */
public class PixelGrid {

    private final int width;
    private final int height;
    private final int[] pixels;

    /**
     * Create a fully transparent black grid.
     */
    public PixelGrid(int width, int height) {
        this(width, height, new int[checkedLength(width, height)]);
    }

    /**
     * Wrap an existing packed ARGB buffer. The array is not copied.
     */
    public PixelGrid(int width, int height, int[] pixels) {
        int expected = checkedLength(width, height);
        if (pixels == null || pixels.length != expected) {
            throw new InvalidFrameException("Pixel buffer length " +
                (pixels == null ? "null" : String.valueOf(pixels.length)) +
                " does not match " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.pixels = pixels;
    }

    private static int checkedLength(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new InvalidFrameException("Grid dimensions must be positive: " + width + "x" + height);
        }
        long length = (long) width * height;
        if (length > Integer.MAX_VALUE) {
            throw new InvalidFrameException("Grid too large: " + width + "x" + height);
        }
        return (int) length;
    }

    /**
     * Create a grid filled with a single color.
     */
    public static PixelGrid filled(int width, int height, int r, int g, int b, int a) {
        PixelGrid grid = new PixelGrid(width, height);
        Arrays.fill(grid.pixels, pack(r, g, b, a));
        return grid;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getPixelCount() {
        return pixels.length;
    }

    public boolean sameSize(PixelGrid other) {
        return other != null && other.width == width && other.height == height;
    }

    // Packed access by linear index (row-major)

    public int getArgb(int index) {
        return pixels[index];
    }

    public void setArgb(int index, int argb) {
        pixels[index] = argb;
    }

    public int red(int index) {
        return (pixels[index] >>> 16) & 0xFF;
    }

    public int green(int index) {
        return (pixels[index] >>> 8) & 0xFF;
    }

    public int blue(int index) {
        return pixels[index] & 0xFF;
    }

    public int alpha(int index) {
        return (pixels[index] >>> 24) & 0xFF;
    }

    /**
     * Write RGBA at a linear index. Values are clamped into [0,255].
     */
    public void set(int index, int r, int g, int b, int a) {
        pixels[index] = pack(r, g, b, a);
    }

    /**
     * Write RGB at a linear index, keeping the pixel's current alpha.
     */
    public void setRgb(int index, int r, int g, int b) {
        pixels[index] = pack(r, g, b, alpha(index));
    }

    // Coordinate access

    public int indexOf(int x, int y) {
        if (x < 0 || x >= width || y < 0 || y >= height) {
            throw new IndexOutOfBoundsException("(" + x + "," + y + ") outside " + width + "x" + height);
        }
        return y * width + x;
    }

    public int getArgb(int x, int y) {
        return pixels[indexOf(x, y)];
    }

    public void set(int x, int y, int r, int g, int b, int a) {
        set(indexOf(x, y), r, g, b, a);
    }

    /**
     * Get the (R,G,B,A) channels of one pixel.
     */
    public int[] getRgba(int x, int y) {
        int index = indexOf(x, y);
        return new int[] { red(index), green(index), blue(index), alpha(index) };
    }

    /**
     * Deep copy of this grid.
     */
    public PixelGrid copy() {
        return new PixelGrid(width, height, pixels.clone());
    }

    /**
     * True if both grids have the same size and identical pixel values.
     */
    public boolean equalsPixels(PixelGrid other) {
        return sameSize(other) && Arrays.equals(pixels, other.pixels);
    }

    /**
     * Clamp a channel value into the 8-bit domain.
     */
    public static int clamp(int value) {
        if (value < 0) return 0;
        if (value > 255) return 255;
        return value;
    }

    /**
     * Round half-to-even and clamp into the 8-bit domain.
     */
    public static int toChannel(double value) {
        if (Double.isNaN(value)) {
            return 0;
        }
        double rounded = Math.rint(value);
        if (rounded <= 0) return 0;
        if (rounded >= 255) return 255;
        return (int) rounded;
    }

    public static int pack(int r, int g, int b, int a) {
        return (clamp(a) << 24) | (clamp(r) << 16) | (clamp(g) << 8) | clamp(b);
    }

    @Override
    public String toString() {
        return "PixelGrid[" + width + "x" + height + "]";
    }
}
