package com.ttennebkram.astrostack.io;

import java.io.IOException;

/**
 * Thrown when a frame cannot be decoded from or encoded to an image file.
 */
public class FrameIOException extends IOException {

    public FrameIOException(String message) {
        super(message);
    }

    public FrameIOException(String message, Throwable cause) {
        super(message, cause);
    }
}
