package com.ttennebkram.astrostack.serialization;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.ttennebkram.astrostack.processing.StageChain;
import com.ttennebkram.astrostack.stages.FrameStage;
import com.ttennebkram.astrostack.stages.StageRegistry;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * Handles serialization and deserialization of pipeline recipes.
 * A recipe is a named, ordered list of stages with their parameters:
 * <pre>
 * {
 *   "name": "light-frame",
 *   "stages": [
 *     { "type": "NormalizeChannels", "enabled": true },
 *     { "type": "Gamma", "enabled": true, "gamma": 0.85 }
 *   ]
 * }
 * </pre>
 */
public class PipelineSerializer {

    private static final Logger LOG = Logger.getLogger(PipelineSerializer.class.getName());

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    /**
     * Convert a chain to its JSON form.
     */
    public static JsonObject toJson(StageChain chain) {
        JsonObject root = new JsonObject();
        root.addProperty("name", chain.getName());

        JsonArray stagesArray = new JsonArray();
        for (StageChain.Step step : chain.getSteps()) {
            JsonObject stageJson = new JsonObject();
            stageJson.addProperty("type", step.stage.getStageType());
            stageJson.addProperty("enabled", step.enabled);
            step.stage.serializeProperties(stageJson);
            stagesArray.add(stageJson);
        }
        root.add("stages", stagesArray);
        return root;
    }

    /**
     * Build a chain from its JSON form.
     *
     * @throws PipelineRecipeException if the structure is wrong or a stage type is unknown
     */
    public static StageChain fromJson(JsonObject root) {
        String name = root.has("name") ? readString(root.get("name"), "Recipe name") : "unnamed";
        if (!root.has("stages") || !root.get("stages").isJsonArray()) {
            throw new PipelineRecipeException("Recipe '" + name + "' has no \"stages\" array");
        }

        StageChain chain = new StageChain(name);
        JsonArray stagesArray = root.getAsJsonArray("stages");
        for (int i = 0; i < stagesArray.size(); i++) {
            JsonElement element = stagesArray.get(i);
            if (!element.isJsonObject()) {
                throw new PipelineRecipeException("Stage " + i + " of '" + name + "' is not an object");
            }
            JsonObject stageJson = element.getAsJsonObject();
            if (!stageJson.has("type")) {
                throw new PipelineRecipeException("Stage " + i + " of '" + name + "' has no type");
            }

            String type = readString(stageJson.get("type"), "Type of stage " + i + " in '" + name + "'");
            FrameStage stage = StageRegistry.createStage(type);
            if (stage == null) {
                throw new PipelineRecipeException("Unknown stage type '" + type + "' in recipe '" + name + "'");
            }

            try {
                stage.deserializeProperties(stageJson);
            } catch (IllegalArgumentException | IllegalStateException | UnsupportedOperationException e) {
                // Gson's getAs* accessors throw the latter two on type mismatches
                throw new PipelineRecipeException("Invalid parameters for " + type + " in recipe '" + name + "': " + e.getMessage(), e);
            }

            boolean enabled = !stageJson.has("enabled")
                || readBoolean(stageJson.get("enabled"), "\"enabled\" of stage " + i + " in '" + name + "'");
            chain.add(stage, enabled);
        }
        return chain;
    }

    private static String readString(JsonElement element, String what) {
        if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isString()) {
            throw new PipelineRecipeException(what + " must be a string, got " + element);
        }
        return element.getAsString();
    }

    private static boolean readBoolean(JsonElement element, String what) {
        if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isBoolean()) {
            throw new PipelineRecipeException(what + " must be true or false, got " + element);
        }
        return element.getAsBoolean();
    }

    public static StageChain fromJsonString(String json) {
        return read(new StringReader(json), "<string>");
    }

    /**
     * Save a chain as a pretty-printed JSON recipe.
     */
    public static void save(Path path, StageChain chain) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            GSON.toJson(toJson(chain), writer);
        }
        LOG.info(() -> "Saved recipe '" + chain.getName() + "' to " + path);
    }

    /**
     * Load a recipe from a file.
     */
    public static StageChain load(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader, path.toString());
        }
    }

    private static StageChain read(Reader reader, String source) {
        JsonElement root;
        try {
            root = JsonParser.parseReader(reader);
        } catch (JsonParseException e) {
            throw new PipelineRecipeException("Malformed recipe JSON in " + source, e);
        }
        if (root == null || !root.isJsonObject()) {
            throw new PipelineRecipeException("Recipe in " + source + " is not a JSON object");
        }
        StageChain chain = fromJson(root.getAsJsonObject());
        LOG.fine(() -> "Loaded recipe " + chain + " from " + source);
        return chain;
    }
}
