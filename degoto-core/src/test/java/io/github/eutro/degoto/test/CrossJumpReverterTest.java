package io.github.eutro.degoto.test;

import io.github.eutro.degoto.cfg.Block;
import io.github.eutro.degoto.cfg.BlockId;
import io.github.eutro.degoto.cfg.ControlFlowGraph;
import io.github.eutro.degoto.cfg.Function;
import io.github.eutro.degoto.ext.CommonExts;
import io.github.eutro.degoto.oracle.Goto;
import io.github.eutro.degoto.oracle.GotoSet;
import io.github.eutro.degoto.oracle.StructuringOracle;
import io.github.eutro.degoto.passes.PassConfig;
import io.github.eutro.degoto.passes.dup.CrossJumpReverter;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.Optional;

import static io.github.eutro.degoto.test.Blocks.*;
import static io.github.eutro.degoto.test.ScriptedStructurer.*;
import static org.junit.jupiter.api.Assertions.*;

public class CrossJumpReverterTest {
    static final long E = 0x10, P1 = 0x20, P2 = 0x30, B = 0x40, C = 0x50;

    /**
     * Two predecessors both jumping to a block with a single successor.
     */
    static ControlFlowGraph crossJumped() {
        return graphOf(
                branch(E, "c", P1, P2),
                jump(P1, B, assign("a", 1)),
                jump(P2, B, assign("a", 2)),
                jump(B, C, assign("r", 0)),
                ret(C)
        );
    }

    static CrossJumpReverter reverter(ScriptedStructurer structurer) {
        return new CrossJumpReverter(new StructuringOracle(structurer));
    }

    @Test
    void testDuplicatesSharedBlock() {
        ControlFlowGraph original = crossJumped();
        Function function = function(original);
        ScriptedStructurer structurer = new ScriptedStructurer(gotosInto(B));

        reverter(structurer).run(function);

        ControlFlowGraph graph = function.getGraph();
        assertNotSame(original, graph);
        assertSame(function, graph.getNullable(CommonExts.OWNING_FUNCTION));
        assertEquals(2, structurer.calls);

        Block b0 = graph.get(new BlockId(B, 0));
        Block b1 = graph.get(new BlockId(B, 1));
        assertNotNull(b0);
        assertNotNull(b1);
        assertNull(graph.get(new BlockId(B, null)));
        assertEquals(2, graph.blocksAt(B).size());

        Block p1 = graph.blockAt(P1);
        Block p2 = graph.blockAt(P2);
        Block c = graph.blockAt(C);
        assertNotNull(p1);
        assertNotNull(p2);
        assertNotNull(c);
        assertEquals(Collections.singletonList(b0), graph.successors(p1));
        assertEquals(Collections.singletonList(b1), graph.successors(p2));
        assertEquals(Collections.singletonList(c), graph.successors(b0));
        assertEquals(Collections.singletonList(c), graph.successors(b1));
        assertEquals(new BlockId(B, null), b0.getExtOrThrow(CommonExts.DUPLICATED_FROM));
        assertEquals(original.blockAt(B).getStatements(), b1.getStatements());

        // the caller's graph was never edited
        assertEquals(5, original.size());
        assertNotNull(original.blockAt(B));
    }

    @Test
    void testNodeIndexStart() {
        Function function = function(crossJumped());
        new CrossJumpReverter(
                new StructuringOracle(new ScriptedStructurer(gotosInto(B))),
                PassConfig.builder().setNodeIndexStart(5).build()
        ).run(function);
        assertNotNull(function.getGraph().get(new BlockId(B, 5)));
        assertNotNull(function.getGraph().get(new BlockId(B, 6)));
    }

    @Test
    void testRejectsWithoutImprovement() {
        ControlFlowGraph original = crossJumped();
        Function function = function(original);
        GotoSet stuck = new GotoSet(Arrays.asList(
                new Goto(original.blockAt(P1), B),
                new Goto(original.blockAt(P2), B)
        ));
        ScriptedStructurer structurer = new ScriptedStructurer(fixed(stuck));
        CrossJumpReverter pass = new CrossJumpReverter(new StructuringOracle(structurer),
                PassConfig.builder().setMaxLevel(3).build());

        String before = original.toString();
        assertFalse(pass.analyze(function).isPresent());
        pass.run(function);
        pass.run(function);

        assertSame(original, function.getGraph());
        assertEquals(before, original.toString());
        // three rounds and a final measurement, for each of the three invocations
        assertEquals(3 * 4, structurer.calls);
    }

    @Test
    void testNoGotosNoChange() {
        Function function = function(crossJumped());
        ScriptedStructurer structurer = new ScriptedStructurer(fixed(GotoSet.EMPTY));
        assertFalse(reverter(structurer).analyze(function).isPresent());
        assertEquals(1, structurer.calls);
    }

    @Test
    void testFailureBeforeAnyEditIsNoChange() {
        ControlFlowGraph original = crossJumped();
        Function function = function(original);
        reverter(new ScriptedStructurer(throwing())).run(function);
        assertSame(original, function.getGraph());
    }

    @Test
    void testFailureRollsBackToLastGoodGraph() {
        ControlFlowGraph original = crossJumped();
        Function function = function(original);
        GotoSet oneLeft = new GotoSet(Collections.singletonList(new Goto(original.blockAt(P1), B)));
        ScriptedStructurer structurer = new ScriptedStructurer(gotosInto(B), fixed(oneLeft), failing());

        Optional<ControlFlowGraph> result = reverter(structurer).analyze(function);

        assertTrue(result.isPresent());
        ControlFlowGraph graph = result.get();
        // the second round's duplicate of b#0 was rolled back
        assertNotNull(graph.get(new BlockId(B, 0)));
        assertNotNull(graph.get(new BlockId(B, 1)));
        assertNull(graph.get(new BlockId(B, 2)));
        assertEquals(3, structurer.calls);
    }

    @Test
    void testSelfLoopingTargetKeepsItsSuccessors() {
        ControlFlowGraph original = graphOf(
                branch(E, "c", P1, P2),
                jump(P1, B),
                jump(P2, B),
                jump(B, B, assign("spin", 1))
        );
        Function function = function(original);
        GotoSet intoB = new GotoSet(Arrays.asList(
                new Goto(original.blockAt(P1), B),
                new Goto(original.blockAt(P2), B)
        ));
        reverter(new ScriptedStructurer(fixed(intoB), fixed(GotoSet.EMPTY))).run(function);

        ControlFlowGraph graph = function.getGraph();
        Block b = graph.get(new BlockId(B, null));
        Block b0 = graph.get(new BlockId(B, 0));
        Block b1 = graph.get(new BlockId(B, 1));
        assertNotNull(b);
        assertNotNull(b0);
        assertNotNull(b1);
        assertEquals(Collections.singletonList(b), graph.successors(b0));
        assertEquals(Collections.singletonList(b), graph.successors(b1));
        assertEquals(Collections.singletonList(b), graph.successors(b));
    }

    @Test
    void testInapplicableArchitecture() {
        ControlFlowGraph original = crossJumped();
        Function function = function(original, "MIPS32", "linux");
        ScriptedStructurer structurer = new ScriptedStructurer(gotosInto(B));
        reverter(structurer).run(function);
        assertSame(original, function.getGraph());
        assertEquals(0, structurer.calls);
    }

    @Test
    void testTargetWithSeveralSuccessorsIsSkipped() {
        ControlFlowGraph original = graphOf(
                branch(E, "c", P1, P2),
                jump(P1, B),
                jump(P2, B),
                branch(B, "d", C, 0x48),
                ret(0x48),
                ret(C)
        );
        Function function = function(original);
        ScriptedStructurer structurer = new ScriptedStructurer(gotosInto(B));
        reverter(structurer).run(function);

        assertSame(original, function.getGraph());
        assertEquals(1, structurer.calls);
    }
}
