package io.github.eutro.degoto.passes.switches;

import io.github.eutro.degoto.cfg.Block;
import io.github.eutro.degoto.cfg.BlockId;
import io.github.eutro.degoto.cfg.ControlFlowGraph;
import io.github.eutro.degoto.ir.BinaryOperator;
import io.github.eutro.degoto.ir.DispatchPlaceholder;
import io.github.eutro.degoto.ir.Expr;
import io.github.eutro.degoto.ir.Stmt;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Expands a {@link DispatchPlaceholder} back into a ladder of comparison blocks.
 */
public final class DispatchRestorer {
    private DispatchRestorer() {
    }

    /**
     * Expand the placeholder ending {@code node} into explicit edges, in both graphs.
     * <p>
     * Non-default cases are chained from the head following their next addresses, each
     * reduced to its comparison alone; the default case is wired from the last of them.
     * Cases whose block was trimmed to its assignments get their comparison back, testing
     * the switched expression against the case value.
     * The placeholder is then removed from the head.
     *
     * @param node      The head block holding the placeholder.
     * @param stmt      The placeholder.
     * @param graph     The graph of the region being laid out.
     * @param fullGraph The graph of the whole function.
     * @return The head block, without the placeholder.
     * @throws IllegalStateException If a case target is not in {@code fullGraph}.
     */
    public static Block restore(Block node, DispatchPlaceholder stmt, ControlFlowGraph graph, ControlFlowGraph fullGraph) {
        Map<Long, DispatchPlaceholder.Entry> others = new LinkedHashMap<>();
        DispatchPlaceholder.Entry defaultEntry = null;
        for (DispatchPlaceholder.Entry entry : stmt.entries) {
            if (entry.value.isDefault()) {
                if (defaultEntry == null) defaultEntry = entry;
            } else {
                others.put(entry.caseBlock.addr, entry);
            }
        }

        Block lastNode = node;
        Long nextAddr = node.addr;
        while (nextAddr != null && others.containsKey(nextAddr)) {
            DispatchPlaceholder.Entry entry = others.remove(nextAddr);
            nextAddr = entry.nextAddr;

            Block onode = entry.caseBlock;
            Stmt last = onode.lastStatement();
            Stmt test = comparisonOf(stmt, entry, last);
            boolean trim = test != last || onode.firstNonLabelStatement() != last;
            if (trim || isTaken(onode.id(), graph, fullGraph)) {
                onode = onode.copy(freshIndex(onode.addr, graph, fullGraph),
                        trim ? Collections.<Stmt>singletonList(test) : onode.getStatements());
            }

            link(graph, lastNode, onode);
            link(fullGraph, lastNode, onode);
            Block target = findTarget(fullGraph, entry.targetAddr, onode);
            link(graph, onode, target);
            link(fullGraph, onode, target);
            unlink(graph, node, target);
            unlink(fullGraph, node, target);

            lastNode = onode;
        }

        if (defaultEntry != null) {
            Block target = findTarget(fullGraph, defaultEntry.targetAddr, null);
            link(graph, lastNode, target);
            link(fullGraph, lastNode, target);
            unlink(graph, node, target);
            unlink(fullGraph, node, target);
        }

        Block current = fullGraph.get(node);
        Block restored = (current == null ? node : current).withoutLastStatement();
        if (graph.contains(restored)) graph.replaceBlock(restored);
        if (fullGraph.contains(restored)) fullGraph.replaceBlock(restored);
        return restored;
    }

    /**
     * The test a case block performs. A trimmed copy of a case ends in a jump to its target,
     * so its comparison is rebuilt from the switched expression and the case value.
     */
    private static Stmt comparisonOf(DispatchPlaceholder stmt, DispatchPlaceholder.Entry entry, @Nullable Stmt last) {
        if (last == null) throw new IllegalStateException("empty case block " + entry.caseBlock.toTargetString());
        if (last instanceof Stmt.CondJump || entry.nextAddr == null) return last;
        Stmt.CondJump test = new Stmt.CondJump(
                Expr.binOp(BinaryOperator.CMP_EQ, stmt.expr, Expr.constant(entry.value.value())),
                Expr.constant(entry.targetAddr),
                Expr.constant(entry.nextAddr)
        );
        test.copyExtsFrom(last);
        return test;
    }

    private static void link(ControlFlowGraph graph, Block from, Block to) {
        Block stored = graph.get(to);
        graph.addEdge(from, stored == null ? to : stored);
    }

    private static void unlink(ControlFlowGraph graph, Block from, Block to) {
        if (graph.hasEdge(from, to)) graph.removeEdge(from, to);
    }

    private static Block findTarget(ControlFlowGraph fullGraph, long addr, @Nullable Block exclude) {
        for (Block block : fullGraph.blocksAt(addr)) {
            if (!block.equals(exclude)) return block;
        }
        throw new IllegalStateException(String.format("no block at case target %#x", addr));
    }

    private static boolean isTaken(BlockId id, ControlFlowGraph graph, ControlFlowGraph fullGraph) {
        return graph.get(id) != null || fullGraph.get(id) != null;
    }

    private static int freshIndex(long addr, ControlFlowGraph graph, ControlFlowGraph fullGraph) {
        int idx = 0;
        while (isTaken(new BlockId(addr, idx), graph, fullGraph)) idx++;
        return idx;
    }
}
