package io.github.eutro.degoto.oracle;

import io.github.eutro.degoto.cfg.ControlFlowGraph;
import io.github.eutro.degoto.cfg.Function;
import io.github.eutro.degoto.ext.CommonExts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Measures a graph by structuring a copy of it and collecting the remaining gotos.
 * <p>
 * The graph passed in is never modified.
 */
public class StructuringOracle {
    private static final Logger LOGGER = LoggerFactory.getLogger(StructuringOracle.class);

    private final Structurer structurer;

    public StructuringOracle(Structurer structurer) {
        this.structurer = structurer;
    }

    /**
     * Structure {@code graph} and return its gotos.
     *
     * @param graph The graph to measure.
     * @return The gotos left after structuring.
     * @throws StructuringFailedException If structuring produced no regions, or threw.
     */
    public GotoSet structure(ControlFlowGraph graph) throws StructuringFailedException {
        Structurer.Result result;
        try {
            result = structurer.structure(graph.copy());
        } catch (RuntimeException e) {
            LOGGER.error("Structuring threw on {}", targetName(graph), e);
            throw new StructuringFailedException("structuring threw on " + targetName(graph), e);
        }
        if (result == null || result.regionCount() == 0) {
            LOGGER.error("Failed to redo structuring on {}", targetName(graph));
            throw new StructuringFailedException("no regions for " + targetName(graph));
        }
        GotoSet gotos = result.gotos();
        LOGGER.debug("{} has {} gotos", targetName(graph), gotos.size());
        return gotos;
    }

    private static String targetName(ControlFlowGraph graph) {
        Function function = graph.getNullable(CommonExts.OWNING_FUNCTION);
        return function == null ? "<detached graph>" : function.targetName();
    }
}
