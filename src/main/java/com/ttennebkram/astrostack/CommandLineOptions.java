package com.ttennebkram.astrostack;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Parsed command line of the stacking tool.
 */
public class CommandLineOptions {

    public static final String DEFAULT_OUTPUT = "StackedResult.tif";

    /**
     * Thrown for malformed command lines. The message is shown to the user.
     */
    public static class UsageException extends Exception {
        public UsageException(String message) {
            super(message);
        }
    }

    private final List<Path> frames = new ArrayList<>();
    private Path output = Paths.get(DEFAULT_OUTPUT);
    private int threads = 1;
    private Path recipe;
    private Path refineRecipe;
    private Path saveFramesDir;
    private boolean help;

    private CommandLineOptions() {
    }

    public static CommandLineOptions parse(String[] args) throws UsageException {
        CommandLineOptions options = new CommandLineOptions();
        for (int i = 0; i < args.length; i++) {
            String param = args[i];
            if ("-h".equals(param) || "--help".equals(param)) {
                options.help = true;
            } else if ("-o".equals(param) || "--output".equals(param)) {
                options.output = Paths.get(requireValue(args, ++i, param));
            } else if ("-t".equals(param) || "--threads".equals(param)) {
                String value = requireValue(args, ++i, param);
                try {
                    options.threads = Integer.parseInt(value);
                } catch (NumberFormatException e) {
                    throw new UsageException(param + " requires a numeric value, got '" + value + "'");
                }
                if (options.threads < 1) {
                    throw new UsageException(param + " must be at least 1");
                }
            } else if ("--recipe".equals(param)) {
                options.recipe = Paths.get(requireValue(args, ++i, param));
            } else if ("--refine-recipe".equals(param)) {
                options.refineRecipe = Paths.get(requireValue(args, ++i, param));
            } else if ("--save-frames".equals(param)) {
                options.saveFramesDir = Paths.get(requireValue(args, ++i, param));
            } else if (!param.startsWith("-")) {
                // Non-flag arguments are light frames
                options.frames.add(Paths.get(param));
            } else {
                throw new UsageException("Unknown option: " + param);
            }
        }

        if (!options.help && options.frames.isEmpty()) {
            throw new UsageException("Select at least one light frame to process");
        }
        return options;
    }

    private static String requireValue(String[] args, int index, String param) throws UsageException {
        if (index >= args.length) {
            throw new UsageException(param + " requires a value");
        }
        return args[index];
    }

    public List<Path> getFrames() {
        return Collections.unmodifiableList(frames);
    }

    public Path getOutput() {
        return output;
    }

    public int getThreads() {
        return threads;
    }

    /** Custom light-frame recipe, or null for the built-in one. */
    public Path getRecipe() {
        return recipe;
    }

    /** Custom refinement recipe, or null for the built-in one. */
    public Path getRefineRecipe() {
        return refineRecipe;
    }

    /** Directory for enhanced frames, or null to skip writing them. */
    public Path getSaveFramesDir() {
        return saveFramesDir;
    }

    public boolean isHelp() {
        return help;
    }
}
