package io.github.eutro.degoto.test;

import io.github.eutro.degoto.cfg.Block;
import io.github.eutro.degoto.cfg.BlockId;
import io.github.eutro.degoto.cfg.ControlFlowGraph;
import io.github.eutro.degoto.cfg.GraphUtils;
import io.github.eutro.degoto.ir.BinaryOperator;
import io.github.eutro.degoto.ir.CaseValue;
import io.github.eutro.degoto.ir.DispatchPlaceholder;
import io.github.eutro.degoto.ir.Expr;
import io.github.eutro.degoto.ir.Stmt;
import io.github.eutro.degoto.oracle.StructuringOracle;
import io.github.eutro.degoto.passes.switches.DispatchRestorer;
import io.github.eutro.degoto.passes.switches.LoweredSwitchSimplifier;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

import static io.github.eutro.degoto.test.Blocks.*;
import static io.github.eutro.degoto.test.Ladders.*;
import static org.junit.jupiter.api.Assertions.*;

public class DispatchRestorerTest {
    static ControlFlowGraph collapse(ControlFlowGraph graph) {
        LoweredSwitchSimplifier pass = new LoweredSwitchSimplifier(new StructuringOracle(
                new ScriptedStructurer(ScriptedStructurer.gotosInto(END))));
        return pass.analyze(function(graph)).orElseThrow(AssertionError::new);
    }

    static Block restoreAt(ControlFlowGraph collapsed, ControlFlowGraph region, long addr) {
        Block head = collapsed.blockAt(addr);
        assertNotNull(head);
        Stmt last = head.lastStatement();
        assertInstanceOf(DispatchPlaceholder.class, last);
        return DispatchRestorer.restore(head, (DispatchPlaceholder) last, region, collapsed);
    }

    static Set<Long> addrs(Iterable<Block> blocks) {
        Set<Long> ret = new HashSet<>();
        for (Block block : blocks) {
            ret.add(block.addr);
        }
        return ret;
    }

    @Test
    void testRoundTrip() {
        ControlFlowGraph original = fourWay();
        ControlFlowGraph collapsed = collapse(original);
        ControlFlowGraph region = collapsed.copy();

        Block restored = restoreAt(collapsed, region, H);

        assertEquals(GraphUtils.reachableAddresses(original), GraphUtils.reachableAddresses(collapsed));
        assertEquals(GraphUtils.reachableAddresses(original), GraphUtils.reachableAddresses(region));

        assertSame(restored, collapsed.get(restored));
        assertSame(restored, region.get(restored));
        assertEquals(Collections.singletonList(label(H)), restored.getStatements());

        assertEquals(1, collapsed.outDegree(restored));
        Block comparison = collapsed.successors(restored).get(0);
        assertEquals(new BlockId(H, 0), comparison.id());
        assertInstanceOf(Stmt.CondJump.class, comparison.lastStatement());
        assertEquals(new HashSet<>(Arrays.asList(T1, A2)), addrs(collapsed.successors(comparison)));

        Block a2 = collapsed.blockAt(A2);
        Block a3 = collapsed.blockAt(A3);
        assertNotNull(a2);
        assertNotNull(a3);
        assertEquals(new HashSet<>(Arrays.asList(T2, A3)), addrs(collapsed.successors(a2)));
        assertEquals(new HashSet<>(Arrays.asList(T3, T4)), addrs(collapsed.successors(a3)));
    }

    @Test
    void testTrimsCaseBlocks() {
        ControlFlowGraph original = fourWayWithAssignment();
        ControlFlowGraph collapsed = collapse(original);
        ControlFlowGraph region = collapsed.copy();

        restoreAt(collapsed, region, H);

        assertEquals(GraphUtils.reachableAddresses(original), GraphUtils.reachableAddresses(collapsed));
        Block comparison = null;
        Block body = null;
        for (Block block : collapsed.blocksAt(A2)) {
            if (block.lastStatement() instanceof Stmt.CondJump) comparison = block;
            else body = block;
        }
        assertNotNull(comparison);
        assertNotNull(body);

        // the comparison is rebuilt, the assignment stays on the way to the case body
        assertEquals(1, comparison.getStatements().size());
        Stmt.CondJump test = (Stmt.CondJump) comparison.lastStatement();
        assertEquals(Expr.binOp(BinaryOperator.CMP_EQ, Expr.var("x"), Expr.constant(2)), test.condition);
        assertEquals(Expr.constant(A2), test.trueTarget);
        assertEquals(Expr.constant(A3), test.falseTarget);
        assertEquals(2, collapsed.outDegree(comparison));
        assertTrue(collapsed.hasEdge(comparison, body));
        assertEquals(new HashSet<>(Arrays.asList(A2, A3)), addrs(collapsed.successors(comparison)));

        assertTrue(body.getStatements().contains(assign("y", 7)));
        assertInstanceOf(Stmt.Jump.class, body.lastStatement());
        assertEquals(Collections.singleton(T2), addrs(collapsed.successors(body)));
    }

    @Test
    void testMissingTargetFails() {
        Block caseBlock = eq(H, "x", 1, T1, A2);
        DispatchPlaceholder placeholder = new DispatchPlaceholder(Expr.var("x"), Arrays.asList(
                new DispatchPlaceholder.Entry(caseBlock, CaseValue.of(1), T1, null),
                new DispatchPlaceholder.Entry(caseBlock, CaseValue.DEFAULT, T4, null)
        ));
        Block head = new Block(H, label(H), placeholder);
        ControlFlowGraph graph = new ControlFlowGraph();
        graph.addBlock(head);

        assertThrows(IllegalStateException.class,
                () -> DispatchRestorer.restore(head, placeholder, graph.copy(), graph));
    }
}
