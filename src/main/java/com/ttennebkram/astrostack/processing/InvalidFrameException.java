package com.ttennebkram.astrostack.processing;

/**
 * Thrown when an operation receives a structurally invalid frame argument,
 * such as an empty stack or a grid with non-positive dimensions.
 */
public class InvalidFrameException extends IllegalArgumentException {

    public InvalidFrameException(String message) {
        super(message);
    }
}
