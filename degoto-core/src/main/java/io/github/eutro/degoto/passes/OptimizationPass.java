package io.github.eutro.degoto.passes;

import io.github.eutro.degoto.cfg.ControlFlowGraph;
import io.github.eutro.degoto.cfg.Function;
import io.github.eutro.degoto.oracle.StructuringOracle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * A pass that speculatively rewrites a function's graph, and keeps the rewrite only if
 * structuring the result is no worse than before.
 * <p>
 * Subclasses work on a private copy of the function's graph. The function itself is only
 * touched by {@link #runInPlace(Function)}, which replaces its graph in a single assignment
 * once {@link #analyze(Function)} has produced an accepted graph.
 */
public abstract class OptimizationPass implements InPlaceIRPass<Function> {
    private static final Logger LOGGER = LoggerFactory.getLogger(OptimizationPass.class);

    protected final StructuringOracle oracle;
    protected final PassConfig config;

    protected OptimizationPass(StructuringOracle oracle, PassConfig config) {
        this.oracle = oracle;
        this.config = config;
    }

    public abstract PassInfo info();

    public boolean isApplicable(Function function) {
        return info().supports(function.arch, function.platform);
    }

    /**
     * Run the pass without touching {@code function}.
     *
     * @param function The function.
     * @return The rewritten graph, or empty if the pass made no accepted change.
     */
    public Optional<ControlFlowGraph> analyze(Function function) {
        if (!isApplicable(function)) {
            LOGGER.debug("{} does not apply to {} ({} on {})",
                    info().name, function.targetName(), function.arch, function.platform);
            return Optional.empty();
        }
        try {
            return analyzeGraph(function.getGraph().copy());
        } catch (InvariantViolationException e) {
            LOGGER.warn("{} produced no result for {}", info().name, function.targetName(), e);
            return Optional.empty();
        } catch (UnsafeMergeException e) {
            LOGGER.debug("{} aborted on {}: {}", info().name, function.targetName(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Rewrite a private copy of the function's graph.
     *
     * @param graph The copy, owned by this call.
     * @return The accepted graph, or empty to leave the function unchanged.
     */
    protected abstract Optional<ControlFlowGraph> analyzeGraph(ControlFlowGraph graph);

    @Override
    public void runInPlace(Function function) {
        analyze(function).ifPresent(function::setGraph);
    }

    @Override
    public String toString() {
        return info().toString();
    }
}
