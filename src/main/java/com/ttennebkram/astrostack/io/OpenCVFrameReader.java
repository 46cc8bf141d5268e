package com.ttennebkram.astrostack.io;

import com.ttennebkram.astrostack.model.PixelGrid;
import com.ttennebkram.astrostack.util.MatConverter;
import org.opencv.core.CvException;
import org.opencv.core.Mat;
import org.opencv.imgcodecs.Imgcodecs;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * Reads frames with OpenCV's Imgcodecs.
 * IMREAD_COLOR applies the EXIF orientation tag, so frames arrive upright.
 * Requires the OpenCV native library to be loaded.
 */
public class OpenCVFrameReader implements FrameReader {

    private static final Logger LOG = Logger.getLogger(OpenCVFrameReader.class.getName());

    @Override
    public PixelGrid read(Path path) throws FrameIOException {
        if (!Files.isRegularFile(path)) {
            throw new FrameIOException("Frame file not found: " + path);
        }

        Mat mat;
        try {
            mat = Imgcodecs.imread(path.toString(), Imgcodecs.IMREAD_COLOR);
        } catch (CvException e) {
            throw new FrameIOException("OpenCV failed to decode " + path, e);
        }

        try {
            if (mat.empty()) {
                throw new FrameIOException("Unsupported or corrupt image file: " + path);
            }
            PixelGrid grid = MatConverter.toPixelGrid(mat);
            LOG.fine(() -> "Read " + grid + " from " + path);
            return grid;
        } catch (IllegalArgumentException e) {
            throw new FrameIOException("Cannot convert " + path + ": " + e.getMessage(), e);
        } finally {
            mat.release();
        }
    }
}
