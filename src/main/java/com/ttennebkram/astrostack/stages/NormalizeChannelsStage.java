package com.ttennebkram.astrostack.stages;

import com.google.gson.JsonObject;
import com.ttennebkram.astrostack.model.PixelGrid;

import java.util.logging.Logger;

/**
 * Channel normalization.
 * Scales R, G and B so their means meet at the average of the three means,
 * removing a global color cast without changing overall brightness.
 */
@StageInfo(stageType = "NormalizeChannels", category = "Color", twoPhase = true)
public class NormalizeChannelsStage extends FrameStageBase {

    private static final Logger LOG = Logger.getLogger(NormalizeChannelsStage.class.getName());

    @Override
    public String getDescription() {
        return "Channel normalization\nscale = mean(R,G,B means) / channel mean";
    }

    @Override
    public PixelGrid process(PixelGrid grid) {
        requireGrid(grid);

        ChannelBalance balance = ChannelBalance.measure(grid);
        LOG.finer(() -> "Measured " + balance);

        int count = grid.getPixelCount();
        for (int i = 0; i < count; i++) {
            balance.apply(grid, i);
        }
        return grid;
    }

    @Override
    public boolean hasProperties() {
        return false;
    }

    @Override
    public void serializeProperties(JsonObject json) {
        // No properties
    }

    @Override
    public void deserializeProperties(JsonObject json) {
        // No properties
    }
}
