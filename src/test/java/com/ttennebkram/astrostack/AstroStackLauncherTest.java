package com.ttennebkram.astrostack;

import static org.junit.jupiter.api.Assertions.*;

import com.ttennebkram.astrostack.io.FrameIOException;
import com.ttennebkram.astrostack.io.FrameReader;
import com.ttennebkram.astrostack.io.FrameWriter;
import com.ttennebkram.astrostack.model.PixelGrid;
import com.ttennebkram.astrostack.processing.FramePipeline;
import com.ttennebkram.astrostack.processing.StageChain;
import com.ttennebkram.astrostack.serialization.PipelineSerializer;
import com.ttennebkram.astrostack.stages.GammaStage;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AstroStackLauncherTest {

    @TempDir
    Path tempDir;

    private final Map<Path, PixelGrid> written = new HashMap<>();
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private final FrameReader reader = path -> {
        if (path.toString().contains("missing")) {
            throw new FrameIOException("Frame file not found: " + path);
        }
        if (path.toString().contains("small")) {
            return TestGrids.noisy(3, 3, 9L);
        }
        return TestGrids.noisy(6, 4, path.toString().length());
    };
    private final FrameWriter writer = (grid, path) -> written.put(path, grid);

    private int run(String... args) {
        return AstroStackLauncher.run(args, reader, writer,
            new PrintStream(out, true), new PrintStream(err, true));
    }

    private String errText() {
        return new String(err.toByteArray(), StandardCharsets.UTF_8);
    }

    @Test
    void stacksFramesToDefaultOutput() {
        assertEquals(AstroStackLauncher.EXIT_OK, run("a.tif", "bb.tif", "ccc.tif"));
        assertTrue(written.containsKey(Paths.get("StackedResult.tif")));
        assertEquals(255, written.get(Paths.get("StackedResult.tif")).alpha(0));
    }

    @Test
    void threadedRunWritesRequestedOutputAndFrames() {
        Path frames = tempDir.resolve("frames");
        assertEquals(AstroStackLauncher.EXIT_OK,
            run("-t", "2", "-o", "m42.png", "--save-frames", frames.toString(), "a.tif", "bb.tif"));
        assertTrue(written.containsKey(Paths.get("m42.png")));
        assertTrue(written.containsKey(frames.resolve("a_processed.png")));
    }

    @Test
    void usageErrorsExitWithTwo() {
        assertEquals(AstroStackLauncher.EXIT_USAGE, run());
        assertTrue(errText().contains("Usage"));
    }

    @Test
    void helpExitsCleanly() {
        assertEquals(AstroStackLauncher.EXIT_OK, run("-h"));
        assertTrue(written.isEmpty());
    }

    @Test
    void unreadableFrameFails() {
        assertEquals(AstroStackLauncher.EXIT_FAILURE, run("a.tif", "missing.tif"));
        assertTrue(written.isEmpty());
    }

    @Test
    void mismatchedFramesFail() {
        assertEquals(AstroStackLauncher.EXIT_FAILURE, run("a.tif", "small.tif"));
        assertTrue(errText().contains("same resolution"));
    }

    @Test
    void customRecipeIsUsed() throws Exception {
        Path recipe = tempDir.resolve("bright.json");
        PipelineSerializer.save(recipe, new StageChain("bright").add(new GammaStage(2.0)));
        CommandLineOptions options = CommandLineOptions.parse(new String[] {"--recipe", recipe.toString(), "a.tif"});

        FramePipeline pipeline = AstroStackLauncher.createPipeline(options);

        assertEquals("bright", pipeline.getFrameChain().getName());
        assertEquals("stack-refine", pipeline.getRefineChain().getName());
    }

    @Test
    void brokenRecipeFails() throws Exception {
        Path recipe = tempDir.resolve("broken.json");
        Files.write(recipe, "{\"stages\": [{\"type\": \"Sharpen\"}]}".getBytes(StandardCharsets.UTF_8));

        assertEquals(AstroStackLauncher.EXIT_FAILURE, run("--recipe", recipe.toString(), "a.tif"));
    }

    @Test
    void recipeWithNullTypeFailsCleanly() throws Exception {
        Path recipe = tempDir.resolve("null-type.json");
        Files.write(recipe, "{\"stages\": [{\"type\": null}]}".getBytes(StandardCharsets.UTF_8));

        assertEquals(AstroStackLauncher.EXIT_FAILURE, run("--recipe", recipe.toString(), "a.tif"));
        assertTrue(errText().contains("must be a string"));
        assertTrue(written.isEmpty());
    }

    @Test
    void unknownOutputExtensionIsWrittenToTheRequestedPath() {
        Path output = tempDir.resolve("stack.bmp");

        assertEquals(AstroStackLauncher.EXIT_OK, run("-o", output.toString(), "a.tif"));

        assertEquals(1, written.size());
        assertTrue(written.containsKey(output));
        assertTrue(new String(out.toByteArray(), StandardCharsets.UTF_8).contains(output.toString()));
    }
}
