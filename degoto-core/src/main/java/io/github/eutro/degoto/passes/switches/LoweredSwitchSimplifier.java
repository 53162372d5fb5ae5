package io.github.eutro.degoto.passes.switches;

import io.github.eutro.degoto.cfg.Block;
import io.github.eutro.degoto.cfg.BlockId;
import io.github.eutro.degoto.cfg.ControlFlowGraph;
import io.github.eutro.degoto.ext.CommonExts;
import io.github.eutro.degoto.ir.DispatchPlaceholder;
import io.github.eutro.degoto.ir.Expr;
import io.github.eutro.degoto.ir.Stmt;
import io.github.eutro.degoto.oracle.GotoSet;
import io.github.eutro.degoto.oracle.StructuringFailedException;
import io.github.eutro.degoto.oracle.StructuringOracle;
import io.github.eutro.degoto.passes.OptimizationPass;
import io.github.eutro.degoto.passes.PassConfig;
import io.github.eutro.degoto.passes.PassInfo;
import io.github.eutro.degoto.passes.PassStage;
import io.github.eutro.degoto.passes.UnsafeMergeException;
import io.github.eutro.degoto.util.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Collapses lowered switch ladders into a single head block ending in a {@link DispatchPlaceholder}.
 * <p>
 * The rewrite is only kept if structuring the result leaves no more gotos than before.
 * Graphs this pass returns may contain placeholders, which must be expanded with
 * {@link DispatchRestorer} before code is emitted.
 */
public class LoweredSwitchSimplifier extends OptimizationPass {
    private static final Logger LOGGER = LoggerFactory.getLogger(LoweredSwitchSimplifier.class);

    public static final PassInfo INFO = new PassInfo(
            "Convert lowered switch-cases (if-else) to switch-cases",
            "Convert lowered switch-cases (if-else) to switch-cases. " +
                    "Only works when the Phoenix structuring algorithm is in use.",
            PassStage.DURING_REGION_IDENTIFICATION,
            PassInfo.setOf("AMD64"),
            PassInfo.setOf("linux", "windows"),
            PassInfo.setOf("phoenix")
    );

    public LoweredSwitchSimplifier(StructuringOracle oracle, PassConfig config) {
        super(oracle, config);
    }

    public LoweredSwitchSimplifier(StructuringOracle oracle) {
        this(oracle, PassConfig.DEFAULT);
    }

    @Override
    public PassInfo info() {
        return INFO;
    }

    @Override
    protected Optional<ControlFlowGraph> analyzeGraph(ControlFlowGraph graph) {
        GotoSet initial;
        try {
            initial = oracle.structure(graph);
        } catch (StructuringFailedException e) {
            return Optional.empty();
        }
        if (initial.isEmpty()) return Optional.empty();

        Map<ExprKey, List<SwitchChain>> chainsByKey = LoweredSwitchRecognizer.recognize(graph);
        if (chainsByKey.isEmpty()) return Optional.empty();

        Rewrite rewrite = new Rewrite(graph.copy());
        for (List<SwitchChain> chains : chainsByKey.values()) {
            for (SwitchChain chain : chains) {
                rewrite.collapse(chain);
            }
        }
        rewrite.splitSharedSuccessors();

        GotoSet after;
        try {
            after = oracle.structure(rewrite.out);
        } catch (StructuringFailedException e) {
            return Optional.empty();
        }
        if (after.size() > initial.size()) {
            LOGGER.debug("Collapsing switches increased gotos from {} to {}, discarding",
                    initial.size(), after.size());
            return Optional.empty();
        }
        LOGGER.debug("Collapsed {} switch head(s), gotos {} -> {}",
                rewrite.heads.size(), initial.size(), after.size());
        return Optional.of(rewrite.out);
    }

    private static boolean onlyLabelsAndCondJumps(Block block) {
        for (Stmt stmt : block.getStatements()) {
            if (!(stmt instanceof Stmt.Label || stmt instanceof Stmt.CondJump)) return false;
        }
        return true;
    }

    /**
     * The edits of one invocation, applied to a private copy of the graph.
     */
    private class Rewrite {
        final ControlFlowGraph out;
        final Set<Block> heads = new LinkedHashSet<>();
        final Map<Block, Set<Block>> nodeToHeads = new LinkedHashMap<>();
        private int nextIdx = config.nodeIndexStart;

        Rewrite(ControlFlowGraph out) {
            this.out = out;
        }

        void collapse(SwitchChain chain) {
            List<Block> caseNodes = new ArrayList<>();
            for (Case c : chain.nonDefaultCases()) {
                caseNodes.add(c.originalNode);
            }
            Block head = caseNodes.get(0);
            List<Block> rest = caseNodes.subList(1, caseNodes.size());

            Map<Long, Block> existingByAddr = new HashMap<>();
            for (Block block : out.blocks()) {
                existingByAddr.put(block.addr, block);
            }

            List<DispatchPlaceholder.Entry> entries = new ArrayList<>();
            List<Pair<Block, Block>> delayedEdges = new ArrayList<>();
            for (int i = 0; i < chain.cases.size(); i++) {
                Case c = chain.cases.get(i);
                if (i == 0 || onlyLabelsAndCondJumps(c.originalNode)) {
                    entries.add(new DispatchPlaceholder.Entry(c.originalNode, c.value, c.target, c.nextAddr));
                    continue;
                }
                Block trimmed = trimmedCopy(c);
                entries.add(new DispatchPlaceholder.Entry(trimmed, c.value, trimmed.addr, c.nextAddr));
                Block target = existingByAddr.get(c.target);
                if (target == null) {
                    throw new UnsafeMergeException(String.format("no block at case target %#x", c.target));
                }
                delayedEdges.add(Pair.of(null, trimmed));
                delayedEdges.add(Pair.of(trimmed, target));
            }

            Block current = out.get(head);
            if (current == null) {
                throw new UnsafeMergeException("switch head " + head.toTargetString() + " was already merged");
            }
            Stmt oldLast = Objects.requireNonNull(current.lastStatement());
            DispatchPlaceholder placeholder = new DispatchPlaceholder(chain.expr(), entries);
            Long insAddr = oldLast.getNullable(CommonExts.INS_ADDR);
            if (insAddr != null) CommonExts.withInsAddr(placeholder, insAddr);
            Block newHead = current.withLastStatement(placeholder);
            out.replaceBlock(newHead);
            heads.add(newHead);

            Set<Block> absorbed = new HashSet<>(caseNodes);
            absorbed.addAll(chain.redundantNodes);
            for (Block node : rest) {
                if (!out.contains(node)) {
                    throw new UnsafeMergeException(node.toTargetString() + " is no longer in the graph");
                }
                for (Block pred : out.predecessors(node)) {
                    if (!absorbed.contains(pred)) {
                        throw new UnsafeMergeException(node.toTargetString()
                                + " is still entered from " + pred.toTargetString());
                    }
                }
            }

            for (Block node : rest) {
                for (Block succ : out.successors(node)) {
                    if (rest.contains(succ)) continue;
                    out.addEdge(newHead, succ);
                    nodeToHeads.computeIfAbsent(succ, $ -> new LinkedHashSet<>()).add(newHead);
                }
                out.removeBlock(node);
            }
            for (Block node : chain.redundantNodes) {
                if (!out.contains(node)) continue;
                for (Block pred : out.predecessors(node)) {
                    if (!absorbed.contains(pred)) out.addEdge(pred, newHead);
                }
                out.removeBlock(node);
            }

            for (Pair<Block, Block> edge : delayedEdges) {
                out.addEdge(edge.left == null ? newHead : edge.left, edge.right);
            }
            LOGGER.debug("Collapsed {} cases on {} into {}",
                    entries.size(), chain.expr(), newHead.toTargetString());
        }

        private Block trimmedCopy(Case c) {
            List<Stmt> stmts = new ArrayList<>();
            for (Stmt stmt : c.originalNode.getStatements()) {
                if (stmt instanceof Stmt.Label || stmt instanceof Stmt.Assign) stmts.add(stmt);
            }
            stmts.add(CommonExts.withInsAddr(new Stmt.Jump(Expr.constant(c.target)), c.originalNode.addr));
            Block copy = c.originalNode.copy(freshIndex(c.originalNode.addr), stmts);
            copy.attachExt(CommonExts.DUPLICATED_FROM, c.originalNode.id());
            return copy;
        }

        private int freshIndex(long addr) {
            while (out.get(new BlockId(addr, nextIdx)) != null) {
                nextIdx++;
            }
            return nextIdx++;
        }

        /**
         * Give each dispatch head its own copy of a block that several heads jump to.
         */
        void splitSharedSuccessors() {
            for (Map.Entry<Block, Set<Block>> entry : nodeToHeads.entrySet()) {
                Block shared = entry.getKey();
                Set<Block> sharingHeads = entry.getValue();
                if (sharingHeads.size() < 2 || !out.contains(shared)) continue;
                shared = out.get(shared);

                List<Block> succs = out.successors(shared);
                int nextId = shared.idx == null ? 0 : shared.idx + 1;
                for (Block head : sharingHeads) {
                    while (out.get(new BlockId(shared.addr, nextId)) != null) nextId++;
                    Block copy = shared.withIdx(nextId++);
                    BlockId origin = shared.getNullable(CommonExts.DUPLICATED_FROM);
                    copy.attachExt(CommonExts.DUPLICATED_FROM, origin == null ? shared.id() : origin);

                    out.removeEdge(head, shared);
                    out.addEdge(head, copy);
                    for (Block succ : succs) {
                        out.addEdge(copy, succ.equals(shared) ? copy : succ);
                    }
                    LOGGER.debug("Split {} for {} as {}",
                            shared.toTargetString(), head.toTargetString(), copy.toTargetString());
                }

                boolean entered = false;
                for (Block pred : out.predecessors(shared)) {
                    if (!pred.equals(shared)) {
                        entered = true;
                        break;
                    }
                }
                if (!entered) out.removeBlock(shared);
            }
        }
    }
}
