package com.ttennebkram.astrostack.processing;

/**
 * Wraps a failure raised while processing one frame of a batch.
 */
public class FrameProcessingException extends RuntimeException {

    private final String frameLabel;

    public FrameProcessingException(String frameLabel, Throwable cause) {
        super("Failed to process frame " + frameLabel + ": " + cause.getMessage(), cause);
        this.frameLabel = frameLabel;
    }

    public String getFrameLabel() {
        return frameLabel;
    }
}
