package com.ttennebkram.astrostack.stages;

import static org.junit.jupiter.api.Assertions.*;

import com.google.gson.JsonObject;
import com.ttennebkram.astrostack.model.PixelGrid;
import org.junit.jupiter.api.Test;

class GammaStageTest {

    @Test
    void midGrayDarkensBelowGammaOne() {
        // (128/255)^(1/0.85) = 0.4445, * 255 = 113.34
        PixelGrid grid = PixelGrid.filled(1, 1, 128, 128, 128, 255);

        new GammaStage(0.85).process(grid);

        assertArrayEquals(new int[] {113, 113, 113, 255}, grid.getRgba(0, 0));
    }

    @Test
    void refinementGammaOnMidGray() {
        // (128/255)^(1/0.9) * 255 = 118.56
        PixelGrid grid = PixelGrid.filled(1, 1, 128, 128, 128, 255);

        new GammaStage(0.9).process(grid);

        assertEquals(119, grid.red(0));
    }

    @Test
    void endpointsAreFixed() {
        int[] table = GammaStage.buildTable(0.85);
        assertEquals(0, table[0]);
        assertEquals(255, table[255]);
    }

    @Test
    void gammaOneIsIdentity() {
        int[] table = GammaStage.buildTable(1.0);
        for (int v = 0; v < 256; v++) {
            assertEquals(v, table[v]);
        }
    }

    @Test
    void preservesAlpha() {
        PixelGrid grid = PixelGrid.filled(2, 2, 10, 128, 250, 33);
        new GammaStage(0.85).process(grid);
        assertEquals(33, grid.alpha(3));
    }

    @Test
    void rejectsNonPositiveGamma() {
        assertThrows(IllegalArgumentException.class, () -> new GammaStage(0));
        assertThrows(IllegalArgumentException.class, () -> new GammaStage(-1.5));
        assertThrows(IllegalArgumentException.class, () -> new GammaStage(Double.NaN));
    }

    @Test
    void deserializesGamma() {
        JsonObject json = new JsonObject();
        json.addProperty("gamma", 0.9);
        GammaStage stage = new GammaStage();
        stage.deserializeProperties(json);
        assertEquals(0.9, stage.getGamma(), 0.0);
    }
}
