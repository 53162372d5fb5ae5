package io.github.eutro.degoto.passes.switches;

import io.github.eutro.degoto.cfg.AmbiguousAddressException;
import io.github.eutro.degoto.cfg.Block;
import io.github.eutro.degoto.cfg.ControlFlowGraph;
import io.github.eutro.degoto.cfg.GraphUtils;
import io.github.eutro.degoto.ir.CaseValue;
import io.github.eutro.degoto.ir.Stmt;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Finds ladders of comparisons of one expression against constants, as compilers lower
 * switch statements into.
 * <p>
 * Recognition never edits the graph. Chains are keyed by the {@link StableExprHasher key}
 * of the expression they switch on.
 */
public final class LoweredSwitchRecognizer {
    private static final Logger LOGGER = LoggerFactory.getLogger(LoweredSwitchRecognizer.class);

    private final ControlFlowGraph graph;
    private final Map<Block, Comparison> comparisons = new LinkedHashMap<>();
    private final Set<Block> used = new HashSet<>();
    private final Map<ExprKey, List<SwitchChain>> chainsByKey = new LinkedHashMap<>();

    private LoweredSwitchRecognizer(ControlFlowGraph graph) {
        this.graph = graph;
    }

    /**
     * Recognise the switch ladders of a graph.
     *
     * @param graph The graph, which is not modified.
     * @return The accepted chains, grouped by expression key.
     */
    public static Map<ExprKey, List<SwitchChain>> recognize(ControlFlowGraph graph) {
        LoweredSwitchRecognizer recognizer = new LoweredSwitchRecognizer(graph);
        recognizer.classifyAll();
        recognizer.assembleChains();
        recognizer.filterChains();
        return recognizer.chainsByKey;
    }

    private void classifyAll() {
        for (Block block : GraphUtils.quasiTopologicalSort(graph)) {
            Comparison comparison = Comparison.classify(block);
            if (comparison != null) comparisons.put(block, comparison);
        }
    }

    private void assembleChains() {
        for (Block head : comparisons.keySet()) {
            if (used.contains(head)) continue;
            ChainWalk walk = new ChainWalk(head);
            walk.run();
            if (walk.cases.isEmpty() || walk.defaultCandidates.size() > 1) continue;
            if (!walk.defaultCandidates.isEmpty()) {
                walk.cases.add(walk.defaultCandidates.values().iterator().next());
            }
            merge(new SwitchChain(walk.cases, walk.extraComparisons));
        }
    }

    private void merge(SwitchChain chain) {
        List<SwitchChain> chains = chainsByKey.computeIfAbsent(chain.exprKey(), k -> new ArrayList<>());
        for (ListIterator<SwitchChain> it = chains.listIterator(); it.hasNext(); ) {
            SwitchChain existing = it.next();
            if (existing.isSubsetOf(chain)) {
                List<Block> redundant = new ArrayList<>(existing.redundantNodes);
                redundant.addAll(chain.redundantNodes);
                it.set(new SwitchChain(chain.cases, redundant));
                return;
            }
            if (chain.isSubsetOf(existing)) return;
        }
        chains.add(chain);
    }

    private void filterChains() {
        for (Iterator<Map.Entry<ExprKey, List<SwitchChain>>> it = chainsByKey.entrySet().iterator(); it.hasNext(); ) {
            List<SwitchChain> chains = it.next().getValue();
            chains.removeIf(chain -> !isAcceptable(chain));
            if (chains.isEmpty()) it.remove();
        }
    }

    private boolean isAcceptable(SwitchChain chain) {
        if (chain.nonDefaultCases().size() < 2) {
            LOGGER.debug("Dropping {}: fewer than two cases", chain);
            return false;
        }

        // comparisons after the head may only carry assignments along
        for (Case c : chain.cases.subList(1, chain.cases.size())) {
            if (c.isDefault() || c.shape != ComparisonShape.A) continue;
            for (Stmt stmt : c.originalNode.getStatements()) {
                if (!(stmt instanceof Stmt.Label || stmt instanceof Stmt.CondJump || stmt instanceof Stmt.Assign)) {
                    LOGGER.debug("Dropping {}: {} has a side effect", chain, c.originalNode.toTargetString());
                    return false;
                }
            }
        }

        Set<Block> caseNodes = chain.caseNodes();
        for (Case c : chain.cases) {
            Block target = null;
            int found = 0;
            for (Block succ : graph.successors(c.originalNode)) {
                if (succ.addr == c.target) {
                    target = succ;
                    found++;
                }
            }
            if (found != 1) {
                LOGGER.debug("Dropping {}: {} has {} successors at {}",
                        chain, c.originalNode.toTargetString(), found, String.format("%#x", c.target));
                return false;
            }
            for (Block pred : graph.predecessors(target)) {
                boolean mustBeCase = !c.isDefault() || pred.addr == c.target;
                if (mustBeCase && !caseNodes.contains(pred)) {
                    LOGGER.debug("Dropping {}: {} is also entered from {}",
                            chain, target.toTargetString(), pred.toTargetString());
                    return false;
                }
            }
        }
        return true;
    }

    private static final class WorkItem {
        final Block block;
        final long low;
        final long high;

        WorkItem(Block block, long low, long high) {
            this.block = block;
            this.low = low;
            this.high = high;
        }
    }

    /**
     * The walk of one chain from its head. The bounds of the work items narrow under range splits
     * but nothing checks case values against them.
     */
    private final class ChainWalk {
        final Block head;
        final List<Case> cases = new ArrayList<>();
        final List<Block> extraComparisons = new ArrayList<>();
        final Map<Long, Case> defaultCandidates = new LinkedHashMap<>();
        @Nullable Block lastComp = null;

        ChainWalk(Block head) {
            this.head = head;
        }

        void run() {
            Deque<WorkItem> worklist = new ArrayDeque<>();
            worklist.add(new WorkItem(head, 0, -1L));
            while (!worklist.isEmpty()) {
                WorkItem item = worklist.poll();
                Comparison comp = comparisons.get(item.block);
                boolean keepGoing;
                switch (comp.kind) {
                    case EQ:
                        keepGoing = visitEq(item, comp, worklist);
                        break;
                    case GT:
                        keepGoing = visitGt(item, comp, worklist);
                        break;
                    default:
                        throw new IllegalStateException(comp.kind.name());
                }
                if (!keepGoing) break;
            }
        }

        private @Nullable ExprKey lastKey() {
            return cases.isEmpty() ? null : cases.get(cases.size() - 1).exprKey;
        }

        private boolean visitEq(WorkItem item, Comparison comp, Deque<WorkItem> worklist) {
            Block node = item.block;
            ExprKey lastKey = lastKey();
            if (lastKey != null && !lastKey.equals(comp.exprKey)) {
                if (lastComp != null && !defaultCandidates.containsKey(node.addr)) {
                    defaultCandidates.put(node.addr, Case.defaultCase(lastComp, lastKey, null, node.addr));
                }
                return false;
            }
            if (comp.target == node.addr) return false;
            cases.add(new Case(node, comp.shape, comp.exprKey, comp.expr,
                    CaseValue.of(comp.value), comp.target, comp.next));
            used.add(node);

            if (!node.equals(head) && graph.inDegree(node) > 1) return false;

            Set<Long> succAddrs = successorAddresses(node);
            if (!succAddrs.contains(comp.target)) return true;
            Long nextAddr = null;
            for (Long addr : succAddrs) {
                if (addr != comp.target) {
                    nextAddr = addr;
                    break;
                }
            }
            if (nextAddr == null) return false;

            Block next;
            try {
                next = graph.blockAt(nextAddr);
            } catch (AmbiguousAddressException e) {
                // an earlier pass may have duplicated the default block
                if (!comparisons.containsKey(e.getBlocks().get(0))) {
                    cases.add(Case.defaultCase(node, comp.exprKey, comp.expr, nextAddr));
                }
                return false;
            }
            if (next == null) return false;
            if (comparisons.containsKey(next)) {
                lastComp = node;
                worklist.add(new WorkItem(next, item.low, item.high));
            } else if (!defaultCandidates.containsKey(nextAddr)) {
                defaultCandidates.put(nextAddr, Case.defaultCase(node, comp.exprKey, comp.expr, nextAddr));
            }
            return true;
        }

        private boolean visitGt(WorkItem item, Comparison comp, Deque<WorkItem> worklist) {
            ExprKey lastKey = lastKey();
            if (lastKey != null && !lastKey.equals(comp.exprKey)) return false;
            Block node = item.block;
            Block gtNode = null;
            Block leNode = null;
            Set<Long> succAddrs = new HashSet<>();
            for (Block succ : graph.successors(node)) {
                if (succ.equals(node)) continue;
                succAddrs.add(succ.addr);
                if (succ.addr == comp.target && gtNode == null) gtNode = succ;
                if (succ.addr == comp.next && leNode == null) leNode = succ;
            }
            if (!succAddrs.equals(new HashSet<>(Arrays.asList(comp.target, comp.next)))) return false;
            if (!comparisons.containsKey(gtNode) || !comparisons.containsKey(leNode)) return false;
            worklist.add(new WorkItem(gtNode, comp.value, item.high));
            worklist.add(new WorkItem(leNode, item.low, comp.value - 1));
            extraComparisons.add(node);
            used.add(node);
            return true;
        }

        private Set<Long> successorAddresses(Block node) {
            Set<Long> addrs = new LinkedHashSet<>();
            for (Block succ : graph.successors(node)) {
                if (!succ.equals(node)) addrs.add(succ.addr);
            }
            return addrs;
        }
    }
}
