package io.github.eutro.degoto.passes;

/**
 * When, relative to the decompiler's other stages, a pass is meant to run.
 */
public enum PassStage {
    AFTER_AIL_GRAPH_CREATION,
    BEFORE_REGION_IDENTIFICATION,
    DURING_REGION_IDENTIFICATION,
    AFTER_STRUCTURING,
}
