package com.ttennebkram.astrostack.io;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Paths;
import org.junit.jupiter.api.Test;

class OutputFormatTest {

    @Test
    void picksContainerFromExtension() {
        assertEquals(OutputFormat.PNG, OutputFormat.forPath(Paths.get("out/stack.PNG")));
        assertEquals(OutputFormat.JPEG, OutputFormat.forPath(Paths.get("stack.jpg")));
        assertEquals(OutputFormat.JPEG, OutputFormat.forPath(Paths.get("stack.jpeg")));
        assertEquals(OutputFormat.TIFF, OutputFormat.forPath(Paths.get("StackedResult.tif")));
        assertEquals(OutputFormat.TIFF, OutputFormat.forPath(Paths.get("stack.bmp")));
    }

    @Test
    void fileWithoutNameFallsBackToTiff() {
        assertEquals(OutputFormat.TIFF, OutputFormat.forPath(Paths.get("/")));
        assertEquals(".tif", OutputFormat.TIFF.getExtension());
    }

    @Test
    void onlyJpegDropsAlpha() {
        assertTrue(OutputFormat.PNG.keepsAlpha());
        assertTrue(OutputFormat.TIFF.keepsAlpha());
        assertFalse(OutputFormat.JPEG.keepsAlpha());
    }
}
