package com.ttennebkram.astrostack.io;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Output containers supported when saving a frame.
 */
public enum OutputFormat {
    PNG(".png", true),
    JPEG(".jpg", false),
    TIFF(".tif", true);

    private final String extension;
    private final boolean keepsAlpha;

    OutputFormat(String extension, boolean keepsAlpha) {
        this.extension = extension;
        this.keepsAlpha = keepsAlpha;
    }

    public String getExtension() {
        return extension;
    }

    public boolean keepsAlpha() {
        return keepsAlpha;
    }

    /**
     * Pick the container from a file name: .png, .jpg/.jpeg, anything else TIFF.
     */
    public static OutputFormat forPath(Path path) {
        Path fileName = path.getFileName();
        String name = fileName == null ? "" : fileName.toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".png")) {
            return PNG;
        }
        if (name.endsWith(".jpg") || name.endsWith(".jpeg")) {
            return JPEG;
        }
        return TIFF;
    }
}
