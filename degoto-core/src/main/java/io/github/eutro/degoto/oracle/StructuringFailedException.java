package io.github.eutro.degoto.oracle;

/**
 * Thrown when structuring could not produce any region for a graph.
 * Passes treat this as "no improvement" and keep their last good graph.
 */
public class StructuringFailedException extends Exception {
    public StructuringFailedException(String message) {
        super(message);
    }

    public StructuringFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
