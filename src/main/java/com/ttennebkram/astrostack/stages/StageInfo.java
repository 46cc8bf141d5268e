package com.ttennebkram.astrostack.stages;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Annotation for FrameStage classes to declare their metadata.
 * Used for auto-registration at runtime by {@link StageRegistry}.
 *
 * Example usage:
 * <pre>
 * {@literal @}StageInfo(stageType = "Gamma", category = "Tone")
 * public class GammaStage extends FrameStageBase { ... }
 * </pre>
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface StageInfo {

    /**
     * The stage type name used in recipes.
     */
    String stageType();

    /**
     * Category for grouping (e.g., "Tone", "Color", "Noise").
     */
    String category();

    /**
     * Whether the stage needs a whole-grid reduction pass before it can map pixels.
     */
    boolean twoPhase() default false;

    /**
     * Whether the stage overwrites alpha with 255.
     */
    boolean forcesOpaque() default false;
}
