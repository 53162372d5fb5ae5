package io.github.eutro.degoto.passes.dup;

import io.github.eutro.degoto.cfg.Block;
import io.github.eutro.degoto.cfg.BlockId;
import io.github.eutro.degoto.cfg.ControlFlowGraph;
import io.github.eutro.degoto.ext.CommonExts;
import io.github.eutro.degoto.oracle.Goto;
import io.github.eutro.degoto.oracle.GotoSet;
import io.github.eutro.degoto.oracle.StructuringFailedException;
import io.github.eutro.degoto.oracle.StructuringOracle;
import io.github.eutro.degoto.passes.InvariantViolationException;
import io.github.eutro.degoto.passes.OptimizationPass;
import io.github.eutro.degoto.passes.PassConfig;
import io.github.eutro.degoto.passes.PassInfo;
import io.github.eutro.degoto.passes.PassStage;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Reverts cross-jumping: when structuring leaves a goto into a block that has a single successor,
 * give the jumping block its own copy of the target instead.
 * <p>
 * Each round structures the working graph, then duplicates the target of every block that holds
 * exactly one goto. Rounds repeat until no gotos are left, a round finds nothing to duplicate,
 * structuring fails, or {@link PassConfig#maxLevel} rounds have run. The result is kept only if it
 * has strictly fewer gotos than the input.
 * <p>
 * Only the goto target itself is copied. Draining a goto that leads into a longer run of
 * single-successor blocks would need the whole run copied; such blocks are left alone.
 */
public class CrossJumpReverter extends OptimizationPass {
    private static final Logger LOGGER = LoggerFactory.getLogger(CrossJumpReverter.class);

    public static final PassInfo INFO = new PassInfo(
            "Duplicate blocks destroyed with gotos",
            "DUPLICATE",
            PassStage.DURING_REGION_IDENTIFICATION,
            PassInfo.setOf("X86", "AMD64", "ARMCortexM", "ARMHF", "ARMEL"),
            PassInfo.setOf("cgc", "linux"),
            Collections.emptySet()
    );

    public CrossJumpReverter(StructuringOracle oracle, PassConfig config) {
        super(oracle, config);
    }

    public CrossJumpReverter(StructuringOracle oracle) {
        this(oracle, PassConfig.DEFAULT);
    }

    @Override
    public PassInfo info() {
        return INFO;
    }

    @Override
    protected Optional<ControlFlowGraph> analyzeGraph(ControlFlowGraph graph) {
        Session session = new Session(graph);
        return session.run();
    }

    /**
     * The state of one invocation of the pass: the working graph, the rollback snapshot,
     * and the counter handing out indices to duplicates.
     */
    private class Session {
        private ControlFlowGraph working;
        private @Nullable ControlFlowGraph snapshot = null;
        private int snapshotGotos = -1;
        private int nextIdx = config.nodeIndexStart;

        Session(ControlFlowGraph working) {
            this.working = working;
        }

        Optional<ControlFlowGraph> run() {
            GotoSet initial = null;
            Integer finalGotos = null;
            boolean updated = false;

            for (int level = 0; level < config.maxLevel; level++) {
                GotoSet gotos;
                try {
                    gotos = oracle.structure(working);
                } catch (StructuringFailedException e) {
                    if (!rollBack()) return Optional.empty();
                    finalGotos = snapshotGotos;
                    break;
                }
                if (initial == null) initial = gotos;
                finalGotos = gotos.size();

                if (gotos.isEmpty()) {
                    LOGGER.debug("Graph has no gotos, stopping at level {}", level);
                    break;
                }

                snapshot = working.copy();
                snapshotGotos = gotos.size();
                if (!duplicateRound(working, gotos)) {
                    LOGGER.debug("Nothing left to duplicate at level {}", level);
                    break;
                }
                updated = true;
                finalGotos = null;
            }

            if (!updated || initial == null) return Optional.empty();

            if (finalGotos == null) {
                try {
                    finalGotos = oracle.structure(working).size();
                } catch (StructuringFailedException e) {
                    if (!rollBack()) return Optional.empty();
                    finalGotos = snapshotGotos;
                }
            }

            if (finalGotos < initial.size()) {
                LOGGER.debug("Reduced gotos from {} to {}", initial.size(), finalGotos);
                return Optional.of(working);
            }
            LOGGER.debug("Gotos not reduced ({} -> {}), discarding", initial.size(), finalGotos);
            return Optional.empty();
        }

        private boolean rollBack() {
            if (snapshot == null) return false;
            working = snapshot;
            snapshot = null;
            return true;
        }

        /**
         * Run one round of duplication on {@code graph}.
         *
         * @param graph The graph to edit.
         * @param gotos The gotos of the graph.
         * @return Whether any block was duplicated.
         */
        boolean duplicateRound(ControlFlowGraph graph, GotoSet gotos) {
            Map<Block, Block> toUpdate = new LinkedHashMap<>();
            for (Block node : graph.blocks()) {
                Set<Goto> inNode = gotos.gotosIn(node);
                // blocks with several gotos would need to pick a target; not handled
                if (inNode.size() != 1) continue;
                Goto theGoto = inNode.iterator().next();

                Block gotoTarget = null;
                for (Block succ : graph.successors(node)) {
                    if (succ.addr == theGoto.targetAddr) {
                        gotoTarget = succ;
                        break;
                    }
                }
                if (gotoTarget == null) continue;
                if (graph.outDegree(gotoTarget) != 1) continue;

                toUpdate.put(node, gotoTarget);
            }

            boolean changed = false;
            for (Map.Entry<Block, Block> entry : toUpdate.entrySet()) {
                Block node = entry.getKey();
                Block gotoTarget = entry.getValue();
                if (!graph.contains(node) || !graph.hasEdge(node, gotoTarget)) {
                    // absorbed by an earlier duplication this round
                    continue;
                }
                duplicate(graph, node, gotoTarget);
                changed = true;
            }
            return changed;
        }

        private void duplicate(ControlFlowGraph graph, Block node, Block gotoTarget) {
            List<Block> targetSuccs = graph.successors(gotoTarget);
            if (targetSuccs.size() != 1) {
                throw new InvariantViolationException("goto target " + gotoTarget.toTargetString()
                        + " has " + targetSuccs.size() + " successors");
            }
            Block succ = targetSuccs.get(0);

            Block copy = gotoTarget.withIdx(freshIndex(graph, gotoTarget.addr));
            BlockId origin = gotoTarget.getNullable(CommonExts.DUPLICATED_FROM);
            copy.attachExt(CommonExts.DUPLICATED_FROM, origin == null ? gotoTarget.id() : origin);

            graph.removeEdge(node, gotoTarget);
            graph.addEdge(node, copy);
            graph.addEdge(copy, succ);

            if (!graph.successors(copy).equals(targetSuccs)) {
                throw new InvariantViolationException("duplicate " + copy.toTargetString()
                        + " has successors " + graph.successors(copy) + ", expected " + targetSuccs);
            }

            if (graph.inDegree(gotoTarget) == 0) {
                graph.removeBlock(gotoTarget);
            }
            LOGGER.debug("Duplicated {} as {} for {}",
                    gotoTarget.toTargetString(), copy.toTargetString(), node.toTargetString());
        }

        private int freshIndex(ControlFlowGraph graph, long addr) {
            while (graph.get(new BlockId(addr, nextIdx)) != null) {
                nextIdx++;
            }
            return nextIdx++;
        }
    }
}
