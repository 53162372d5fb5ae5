package io.github.eutro.degoto.passes;

/**
 * Thrown when a pass finds its own working graph in a state it should never reach.
 * The pass stops and reports no result.
 */
public class InvariantViolationException extends RuntimeException {
    public InvariantViolationException(String message) {
        super(message);
    }
}
