package io.github.eutro.degoto.oracle;

import io.github.eutro.degoto.cfg.ControlFlowGraph;

/**
 * The structuring algorithm of the decompiler: turns a graph into a tree of nested regions,
 * reporting the transfers that could not be nested.
 * <p>
 * This library only consumes it, through a {@link StructuringOracle}.
 */
public interface Structurer {
    /**
     * Structure a graph. Implementations may mutate the graph they are given.
     *
     * @param graph The graph, which the caller does not use again.
     * @return The result.
     */
    Result structure(ControlFlowGraph graph);

    interface Result {
        /**
         * @return The number of top-level regions produced; zero means structuring failed.
         */
        int regionCount();

        GotoSet gotos();
    }
}
