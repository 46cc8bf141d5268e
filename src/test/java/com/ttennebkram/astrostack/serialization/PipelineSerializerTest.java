package com.ttennebkram.astrostack.serialization;

import static org.junit.jupiter.api.Assertions.*;

import com.ttennebkram.astrostack.TestGrids;
import com.ttennebkram.astrostack.model.PixelGrid;
import com.ttennebkram.astrostack.processing.FramePipeline;
import com.ttennebkram.astrostack.processing.StageChain;
import com.ttennebkram.astrostack.stages.GammaStage;
import com.ttennebkram.astrostack.stages.ReduceNoiseStage;
import java.io.IOException;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PipelineSerializerTest {

    @TempDir
    Path tempDir;

    @Test
    void savedBuiltInChainsProduceSameFrames() throws IOException {
        Path frameRecipe = tempDir.resolve("light-frame.json");
        Path refineRecipe = tempDir.resolve("stack-refine.json");
        PipelineSerializer.save(frameRecipe, FramePipeline.lightFrameChain());
        PipelineSerializer.save(refineRecipe, FramePipeline.stackRefinementChain());

        FramePipeline fromRecipes = new FramePipeline(
            PipelineSerializer.load(frameRecipe),
            PipelineSerializer.load(refineRecipe));
        FramePipeline builtIn = new FramePipeline();
        PixelGrid a = TestGrids.noisy(9, 9, 5L);
        PixelGrid b = a.copy();

        fromRecipes.refine(fromRecipes.process(a));
        builtIn.refine(builtIn.process(b));

        assertEquals(PipelineSerializer.toJson(builtIn.getFrameChain()), PipelineSerializer.toJson(fromRecipes.getFrameChain()));
        assertTrue(a.equalsPixels(b));
    }

    @Test
    void savesAndLoadsFile() throws IOException {
        StageChain chain = new StageChain("custom")
            .add(new GammaStage(1.3))
            .add(new ReduceNoiseStage(0.7), false);
        Path file = tempDir.resolve("custom.json");

        PipelineSerializer.save(file, chain);
        StageChain loaded = PipelineSerializer.load(file);

        assertEquals("custom", loaded.getName());
        assertEquals(2, loaded.getSteps().size());
        assertEquals(1.3, ((GammaStage) loaded.getSteps().get(0).stage).getGamma(), 0.0);
        assertFalse(loaded.getSteps().get(1).enabled);
        assertEquals(0.7, ((ReduceNoiseStage) loaded.getSteps().get(1).stage).getOriginalWeight(), 0.0);
    }

    @Test
    void missingParametersUseDefaults() {
        StageChain chain = PipelineSerializer.fromJsonString(
            "{\"name\": \"x\", \"stages\": [{\"type\": \"ReduceNoise\"}]}");

        assertTrue(chain.getSteps().get(0).enabled);
        assertEquals(0.4, ((ReduceNoiseStage) chain.getSteps().get(0).stage).getOriginalWeight(), 0.0);
    }

    @Test
    void unknownStageTypeIsRejected() {
        PipelineRecipeException e = assertThrows(PipelineRecipeException.class,
            () -> PipelineSerializer.fromJsonString("{\"stages\": [{\"type\": \"Sharpen\"}]}"));
        assertTrue(e.getMessage().contains("Sharpen"));
    }

    @Test
    void invalidParameterIsRejected() {
        assertThrows(PipelineRecipeException.class,
            () -> PipelineSerializer.fromJsonString("{\"stages\": [{\"type\": \"Gamma\", \"gamma\": 0}]}"));
        assertThrows(PipelineRecipeException.class,
            () -> PipelineSerializer.fromJsonString("{\"stages\": [{\"type\": \"Gamma\", \"gamma\": \"bright\"}]}"));
    }

    @Test
    void malformedDocumentsAreRejected() {
        assertThrows(PipelineRecipeException.class, () -> PipelineSerializer.fromJsonString("{\"stages\": ["));
        assertThrows(PipelineRecipeException.class, () -> PipelineSerializer.fromJsonString("[]"));
        assertThrows(PipelineRecipeException.class, () -> PipelineSerializer.fromJsonString("{\"name\": \"none\"}"));
        assertThrows(PipelineRecipeException.class, () -> PipelineSerializer.fromJsonString("{\"stages\": [42]}"));
        assertThrows(PipelineRecipeException.class, () -> PipelineSerializer.fromJsonString("{\"stages\": [{}]}"));
    }

    @Test
    void nullStructuralValuesAreRejected() {
        assertThrows(PipelineRecipeException.class,
            () -> PipelineSerializer.fromJsonString("{\"stages\": [{\"type\": null}]}"));
        assertThrows(PipelineRecipeException.class,
            () -> PipelineSerializer.fromJsonString("{\"name\": null, \"stages\": []}"));
        assertThrows(PipelineRecipeException.class,
            () -> PipelineSerializer.fromJsonString("{\"stages\": [{\"type\": \"Gamma\", \"enabled\": null}]}"));
        assertThrows(PipelineRecipeException.class,
            () -> PipelineSerializer.fromJsonString("{\"stages\": null}"));
    }

    @Test
    void nonStringTypeIsRejected() {
        assertThrows(PipelineRecipeException.class,
            () -> PipelineSerializer.fromJsonString("{\"stages\": [{\"type\": 7}]}"));
        assertThrows(PipelineRecipeException.class,
            () -> PipelineSerializer.fromJsonString("{\"stages\": [{\"type\": [\"Gamma\"]}]}"));
    }

    @Test
    void enabledMustBeABoolean() {
        PipelineRecipeException e = assertThrows(PipelineRecipeException.class,
            () -> PipelineSerializer.fromJsonString("{\"stages\": [{\"type\": \"Gamma\", \"enabled\": \"yes\"}]}"));
        assertTrue(e.getMessage().contains("enabled"));

        StageChain chain = PipelineSerializer.fromJsonString(
            "{\"stages\": [{\"type\": \"Gamma\", \"enabled\": false}]}");
        assertFalse(chain.getSteps().get(0).enabled);
    }

    @Test
    void missingFileIsAnIOException() {
        assertThrows(IOException.class, () -> PipelineSerializer.load(tempDir.resolve("nope.json")));
    }
}
