package com.ttennebkram.astrostack.io;

import com.ttennebkram.astrostack.model.PixelGrid;
import com.ttennebkram.astrostack.util.MatConverter;
import org.opencv.core.CvException;
import org.opencv.core.Mat;
import org.opencv.core.MatOfByte;
import org.opencv.imgcodecs.Imgcodecs;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * Writes frames with OpenCV's Imgcodecs. PNG and TIFF keep alpha, JPEG drops it.
 * The container comes from {@link OutputFormat#forPath}; the bytes always go to
 * the exact path given, whatever its extension.
 * Requires the OpenCV native library to be loaded.
 */
public class OpenCVFrameWriter implements FrameWriter {

    private static final Logger LOG = Logger.getLogger(OpenCVFrameWriter.class.getName());

    @Override
    public void write(PixelGrid grid, Path path) throws FrameIOException {
        OutputFormat format = OutputFormat.forPath(path);
        byte[] encoded = encode(grid, format);
        try {
            Files.write(path, encoded);
        } catch (IOException e) {
            throw new FrameIOException("Cannot write " + path, e);
        }
        LOG.fine(() -> "Wrote " + grid + " as " + format + " to " + path);
    }

    static byte[] encode(PixelGrid grid, OutputFormat format) throws FrameIOException {
        Mat mat = MatConverter.toMat(grid, format.keepsAlpha());
        MatOfByte buffer = new MatOfByte();
        try {
            if (!Imgcodecs.imencode(format.getExtension(), mat, buffer)) {
                throw new FrameIOException("OpenCV could not encode " + grid + " as " + format);
            }
            return buffer.toArray();
        } catch (CvException e) {
            throw new FrameIOException("OpenCV failed to encode " + grid + " as " + format, e);
        } finally {
            buffer.release();
            mat.release();
        }
    }
}
