package com.ttennebkram.astrostack;

import com.ttennebkram.astrostack.io.FrameIOException;
import com.ttennebkram.astrostack.io.FrameReader;
import com.ttennebkram.astrostack.io.FrameWriter;
import com.ttennebkram.astrostack.io.OpenCVFrameReader;
import com.ttennebkram.astrostack.io.OpenCVFrameWriter;
import com.ttennebkram.astrostack.processing.FramePipeline;
import com.ttennebkram.astrostack.processing.FrameProcessingException;
import com.ttennebkram.astrostack.processing.StageChain;
import com.ttennebkram.astrostack.serialization.PipelineRecipeException;
import com.ttennebkram.astrostack.serialization.PipelineSerializer;
import com.ttennebkram.astrostack.session.StackingSession;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Command-line entry point: enhance light frames, stack them and save the composite.
 */
public class AstroStackLauncher {

    private static final Logger LOG = Logger.getLogger(AstroStackLauncher.class.getName());

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_USAGE = 2;

    public static void main(String[] args) {
        configureLogging();

        // Load OpenCV native library
        nu.pattern.OpenCV.loadLocally();

        int code = run(args, new OpenCVFrameReader(), new OpenCVFrameWriter(), System.out, System.err);
        System.exit(code);
    }

    /**
     * Run the tool with the given collaborators.
     *
     * @return process exit code
     */
    public static int run(String[] args, FrameReader reader, FrameWriter writer, PrintStream out, PrintStream err) {
        CommandLineOptions options;
        try {
            options = CommandLineOptions.parse(args);
        } catch (CommandLineOptions.UsageException e) {
            err.println("Error: " + e.getMessage());
            printHelp(err);
            return EXIT_USAGE;
        }
        if (options.isHelp()) {
            printHelp(out);
            return EXIT_OK;
        }

        try {
            FramePipeline pipeline = createPipeline(options);
            StackingSession session = new StackingSession(reader, writer, pipeline);

            if (options.getThreads() > 1) {
                session.loadConcurrently(options.getFrames(), options.getThreads());
            } else {
                session.load(options.getFrames());
            }
            if (options.getSaveFramesDir() != null) {
                session.saveFrames(options.getSaveFramesDir());
            }

            session.stack();
            session.save(options.getOutput());
            out.println("Stacked " + session.getFrames().size() + " frame(s) into " + options.getOutput());
            return EXIT_OK;

        } catch (FrameIOException | FrameProcessingException | PipelineRecipeException | IllegalArgumentException e) {
            LOG.log(Level.SEVERE, "Processing failed", e);
            err.println("Processing failed: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (IOException e) {
            LOG.log(Level.SEVERE, "Cannot read recipe", e);
            err.println("Cannot read recipe: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            err.println("Interrupted");
            return EXIT_FAILURE;
        }
    }

    static FramePipeline createPipeline(CommandLineOptions options) throws IOException {
        StageChain frameChain = options.getRecipe() != null
            ? PipelineSerializer.load(options.getRecipe())
            : FramePipeline.lightFrameChain();
        StageChain refineChain = options.getRefineRecipe() != null
            ? PipelineSerializer.load(options.getRefineRecipe())
            : FramePipeline.stackRefinementChain();
        LOG.info(() -> "Frame chain: " + frameChain + ", refine chain: " + refineChain);
        return new FramePipeline(frameChain, refineChain);
    }

    /**
     * Apply the bundled logging.properties unless the JVM was given its own.
     */
    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = AstroStackLauncher.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("Could not load logging.properties: " + e.getMessage());
        }
    }

    private static void printHelp(PrintStream out) {
        out.println("AstroStack - light frame enhancement and stacking");
        out.println();
        out.println("Usage: java -jar astrostack.jar [options] <frame> [<frame> ...]");
        out.println();
        out.println("Options:");
        out.println("  -h, --help                     Show this help message and exit");
        out.println("  -o, --output FILE              Stacked output (.tif, .png, .jpg); default " + CommandLineOptions.DEFAULT_OUTPUT);
        out.println("  -t, --threads N                Enhance frames on N worker threads (default 1)");
        out.println("  --recipe FILE                  JSON recipe for the light-frame pass");
        out.println("  --refine-recipe FILE           JSON recipe for the post-stack pass");
        out.println("  --save-frames DIR              Also write each enhanced frame as PNG");
        out.println();
        out.println("Examples:");
        out.println("  java -jar astrostack.jar light_001.tif light_002.tif light_003.tif");
        out.println("  java -jar astrostack.jar -t 4 -o m42.png lights/*.jpg");
    }
}
