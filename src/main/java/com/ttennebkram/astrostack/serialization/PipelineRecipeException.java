package com.ttennebkram.astrostack.serialization;

/**
 * Thrown when a pipeline recipe cannot be parsed or names an unknown stage.
 */
public class PipelineRecipeException extends RuntimeException {

    public PipelineRecipeException(String message) {
        super(message);
    }

    public PipelineRecipeException(String message, Throwable cause) {
        super(message, cause);
    }
}
