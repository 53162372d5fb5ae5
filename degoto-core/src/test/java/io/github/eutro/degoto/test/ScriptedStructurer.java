package io.github.eutro.degoto.test;

import io.github.eutro.degoto.cfg.Block;
import io.github.eutro.degoto.cfg.ControlFlowGraph;
import io.github.eutro.degoto.oracle.Goto;
import io.github.eutro.degoto.oracle.GotoSet;
import io.github.eutro.degoto.oracle.Structurer;
import io.github.eutro.degoto.util.F;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * A stand-in structurer reporting gotos by a rule over the graph. Rules are used in order,
 * one per call, the last one repeating. A rule returning null reports a failed structuring.
 */
public class ScriptedStructurer implements Structurer {
    private final List<F<ControlFlowGraph, GotoSet>> script;
    public int calls = 0;

    @SafeVarargs
    public ScriptedStructurer(F<ControlFlowGraph, GotoSet>... script) {
        this.script = Arrays.asList(script);
    }

    @Override
    public Result structure(ControlFlowGraph graph) {
        F<ControlFlowGraph, GotoSet> rule = script.get(Math.min(calls, script.size() - 1));
        calls++;
        GotoSet gotos = rule.apply(graph);
        return new Result() {
            @Override
            public int regionCount() {
                return gotos == null ? 0 : 1;
            }

            @Override
            public GotoSet gotos() {
                return gotos == null ? GotoSet.EMPTY : gotos;
            }
        };
    }

    /**
     * Every edge into a block at one of {@code addrs} is a goto, if that block has several predecessors.
     */
    public static F<ControlFlowGraph, GotoSet> gotosInto(long... addrs) {
        Set<Long> bad = new HashSet<>();
        for (long addr : addrs) bad.add(addr);
        return graph -> {
            List<Goto> gotos = new ArrayList<>();
            for (Block block : graph.blocks()) {
                if (!bad.contains(block.addr) || graph.inDegree(block) < 2) continue;
                for (Block pred : graph.predecessors(block)) {
                    gotos.add(new Goto(pred, block.addr));
                }
            }
            return new GotoSet(gotos);
        };
    }

    /**
     * Every incoming edge of a block but its first is a goto.
     */
    public static F<ControlFlowGraph, GotoSet> extraEntries() {
        return graph -> {
            List<Goto> gotos = new ArrayList<>();
            for (Block block : graph.blocks()) {
                List<Block> preds = graph.predecessors(block);
                for (Block pred : preds.subList(Math.min(1, preds.size()), preds.size())) {
                    gotos.add(new Goto(pred, block.addr));
                }
            }
            return new GotoSet(gotos);
        };
    }

    public static F<ControlFlowGraph, GotoSet> fixed(GotoSet gotos) {
        return graph -> gotos;
    }

    public static F<ControlFlowGraph, GotoSet> failing() {
        return graph -> null;
    }

    public static F<ControlFlowGraph, GotoSet> throwing() {
        return graph -> {
            throw new IllegalStateException("structurer crashed");
        };
    }

    /**
     * Report {@code rule}'s gotos plus one for every block {@code extra} matches.
     */
    public static F<ControlFlowGraph, GotoSet> plus(F<ControlFlowGraph, GotoSet> rule, F<Block, Boolean> extra) {
        return graph -> {
            GotoSet base = rule.apply(graph);
            if (base == null) return null;
            List<Goto> gotos = new ArrayList<>(base.asSet());
            for (Block block : graph.blocks()) {
                if (extra.apply(block)) gotos.add(new Goto(block, -1));
            }
            return new GotoSet(gotos);
        };
    }
}
