package io.github.eutro.degoto.passes;

/**
 * Thrown when collapsing blocks would leave a removed block still referenced.
 * The whole rewrite of the current pass invocation is dropped.
 */
public class UnsafeMergeException extends RuntimeException {
    public UnsafeMergeException(String message) {
        super(message);
    }
}
