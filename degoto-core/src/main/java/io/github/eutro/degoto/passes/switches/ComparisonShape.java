package io.github.eutro.degoto.passes.switches;

/**
 * The syntactic forms of a block ending in a comparison against a constant.
 */
public enum ComparisonShape {
    /**
     * An (in)equality test preceded by other statements in the same block.
     */
    A,
    /**
     * An (in)equality test that is the only non-label statement of its block.
     */
    B,
    /**
     * An ordering test ({@code < <= > >=}) that is the only non-label statement of its block,
     * splitting a binary search over case values.
     */
    C,
}
