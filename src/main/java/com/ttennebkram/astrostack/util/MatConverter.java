package com.ttennebkram.astrostack.util;

import com.ttennebkram.astrostack.model.PixelGrid;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

/**
 * Utility methods for converting between OpenCV Mat and PixelGrid.
 * OpenCV stores color as BGR / BGRA; PixelGrid is RGBA.
 */
public class MatConverter {

    /**
     * Convert an 8-bit OpenCV Mat (1, 3 or 4 channels) to a new PixelGrid.
     * Grayscale and BGR inputs become opaque.
     *
     * @param mat The Mat to convert (not modified or released)
     * @return A new grid
     * @throws IllegalArgumentException if the Mat is empty, not 8-bit, or has another channel count
     */
    public static PixelGrid toPixelGrid(Mat mat) {
        if (mat == null || mat.empty()) {
            throw new IllegalArgumentException("Cannot convert an empty Mat");
        }
        if (mat.depth() != CvType.CV_8U) {
            throw new IllegalArgumentException("Only 8-bit images are supported, got " + CvType.typeToString(mat.type()));
        }

        int channels = mat.channels();
        Mat bgra;
        if (channels == 4) {
            bgra = mat;
        } else if (channels == 3) {
            bgra = new Mat();
            Imgproc.cvtColor(mat, bgra, Imgproc.COLOR_BGR2BGRA);
        } else if (channels == 1) {
            bgra = new Mat();
            Imgproc.cvtColor(mat, bgra, Imgproc.COLOR_GRAY2BGRA);
        } else {
            throw new IllegalArgumentException("Unsupported channel count: " + channels);
        }

        try {
            int width = bgra.width();
            int height = bgra.height();
            byte[] buffer = new byte[width * height * 4];
            // get() needs a continuous Mat
            Mat continuous = bgra.isContinuous() ? bgra : bgra.clone();
            continuous.get(0, 0, buffer);
            if (continuous != bgra) {
                continuous.release();
            }

            int[] pixels = new int[width * height];
            for (int i = 0, p = 0; i < pixels.length; i++, p += 4) {
                int b = buffer[p] & 0xFF;
                int g = buffer[p + 1] & 0xFF;
                int r = buffer[p + 2] & 0xFF;
                int a = buffer[p + 3] & 0xFF;
                pixels[i] = (a << 24) | (r << 16) | (g << 8) | b;
            }
            return new PixelGrid(width, height, pixels);
        } finally {
            // Release temp mat if we created one
            if (bgra != mat) {
                bgra.release();
            }
        }
    }

    /**
     * Convert a grid to a new 8-bit BGRA (or BGR when alpha is dropped) Mat.
     * The caller must release the result.
     */
    public static Mat toMat(PixelGrid grid, boolean includeAlpha) {
        int width = grid.getWidth();
        int height = grid.getHeight();
        int channels = includeAlpha ? 4 : 3;
        byte[] buffer = new byte[width * height * channels];

        for (int i = 0, p = 0; i < grid.getPixelCount(); i++, p += channels) {
            buffer[p] = (byte) grid.blue(i);
            buffer[p + 1] = (byte) grid.green(i);
            buffer[p + 2] = (byte) grid.red(i);
            if (includeAlpha) {
                buffer[p + 3] = (byte) grid.alpha(i);
            }
        }

        Mat mat = new Mat(height, width, includeAlpha ? CvType.CV_8UC4 : CvType.CV_8UC3);
        mat.put(0, 0, buffer);
        return mat;
    }
}
