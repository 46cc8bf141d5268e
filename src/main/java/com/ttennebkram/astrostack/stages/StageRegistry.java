package com.ttennebkram.astrostack.stages;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Registry for FrameStage implementations, keyed by the stage type declared
 * in each class's @StageInfo annotation.
 *
 * Usage:
 *   FrameStage stage = StageRegistry.createStage("Gamma");
 *   stage.deserializeProperties(json);
 *   stage.process(grid);
 */
public class StageRegistry {

    private static final Logger LOG = Logger.getLogger(StageRegistry.class.getName());

    private static final class Entry {
        final StageInfo info;
        final Supplier<? extends FrameStage> factory;

        Entry(StageInfo info, Supplier<? extends FrameStage> factory) {
            this.info = info;
            this.factory = factory;
        }
    }

    // Registration order is kept for listing
    private static final Map<String, Entry> stages = new LinkedHashMap<>();

    private static boolean initialized = false;

    /**
     * Register the built-in stages.
     * Safe to call multiple times - only initializes once.
     */
    public static synchronized void initialize() {
        if (initialized) return;

        register(NormalizeChannelsStage.class, NormalizeChannelsStage::new);
        register(StretchHistogramStage.class, StretchHistogramStage::new);
        register(GammaStage.class, GammaStage::new);
        register(ReduceNoiseStage.class, ReduceNoiseStage::new);
        register(BoostSaturationStage.class, BoostSaturationStage::new);

        LOG.fine(() -> "Registered stages: " + stages.keySet());
        initialized = true;
    }

    /**
     * Add a stage under the type named by its @StageInfo annotation.
     *
     * @throws IllegalArgumentException if the class is not annotated or its type is taken
     */
    static synchronized <T extends FrameStage> void register(Class<T> stageClass, Supplier<T> factory) {
        StageInfo info = stageClass.getAnnotation(StageInfo.class);
        if (info == null) {
            throw new IllegalArgumentException(stageClass.getName() + " has no @StageInfo annotation");
        }
        if (stages.containsKey(info.stageType())) {
            throw new IllegalArgumentException("Stage type '" + info.stageType() + "' is already registered");
        }
        stages.put(info.stageType(), new Entry(info, factory));
    }

    /**
     * Check if a stage exists for the given type.
     */
    public static synchronized boolean hasStage(String stageType) {
        initialize();
        return stages.containsKey(stageType);
    }

    /**
     * Get the annotation metadata for a stage type, or null if unknown.
     */
    public static synchronized StageInfo getInfo(String stageType) {
        initialize();
        Entry entry = stages.get(stageType);
        return entry != null ? entry.info : null;
    }

    /**
     * Create a new stage instance with default parameters.
     * Returns null if no stage is registered for this type.
     */
    public static synchronized FrameStage createStage(String stageType) {
        initialize();
        Entry entry = stages.get(stageType);
        return entry != null ? entry.factory.get() : null;
    }

    /**
     * Get all registered stage types, in registration order.
     */
    public static synchronized Set<String> getRegisteredTypes() {
        initialize();
        return Collections.unmodifiableSet(stages.keySet());
    }

    public static synchronized int getRegisteredCount() {
        initialize();
        return stages.size();
    }
}
