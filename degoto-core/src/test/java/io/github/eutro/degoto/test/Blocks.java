package io.github.eutro.degoto.test;

import io.github.eutro.degoto.cfg.Block;
import io.github.eutro.degoto.cfg.ControlFlowGraph;
import io.github.eutro.degoto.cfg.Function;
import io.github.eutro.degoto.ext.CommonExts;
import io.github.eutro.degoto.ir.BinaryOperator;
import io.github.eutro.degoto.ir.Expr;
import io.github.eutro.degoto.ir.Stmt;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Small builders for test graphs. Edges are inferred from the constant targets of each
 * block's last statement.
 */
public class Blocks {
    public static Stmt.Label label(long addr) {
        return new Stmt.Label(String.format("LABEL_%x", addr));
    }

    @NotNull
    public static Block block(long addr, Stmt... stmts) {
        List<Stmt> list = new ArrayList<>();
        list.add(label(addr));
        list.addAll(Arrays.asList(stmts));
        Block block = new Block(addr, list);
        for (Stmt stmt : stmts) {
            if (stmt.getNullable(CommonExts.INS_ADDR) == null) CommonExts.withInsAddr(stmt, addr);
        }
        return block;
    }

    public static Stmt.CondJump cmp(BinaryOperator op, Expr lhs, long value, long ifTrue, long ifFalse) {
        return new Stmt.CondJump(
                Expr.binOp(op, lhs, Expr.constant(value)),
                Expr.constant(ifTrue),
                Expr.constant(ifFalse)
        );
    }

    /**
     * A ladder step: {@code if (var == value) goto target; else goto next;}
     */
    public static Block eq(long addr, String var, long value, long target, long next) {
        return block(addr, cmp(BinaryOperator.CMP_EQ, Expr.var(var), value, target, next));
    }

    public static Block gt(long addr, String var, long value, long ifGreater, long otherwise) {
        return block(addr, cmp(BinaryOperator.CMP_GT, Expr.var(var), value, ifGreater, otherwise));
    }

    /**
     * A two-way branch on a plain variable, which is never a ladder step.
     */
    public static Block branch(long addr, String cond, long ifTrue, long ifFalse) {
        return block(addr, new Stmt.CondJump(Expr.var(cond), Expr.constant(ifTrue), Expr.constant(ifFalse)));
    }

    public static Block jump(long addr, long target, Stmt... before) {
        Stmt[] stmts = Arrays.copyOf(before, before.length + 1);
        stmts[before.length] = new Stmt.Jump(Expr.constant(target));
        return block(addr, stmts);
    }

    public static Block ret(long addr) {
        return block(addr, new Stmt.Return(null));
    }

    public static Stmt.Assign assign(String var, long value) {
        return new Stmt.Assign(Expr.var(var), Expr.constant(value));
    }

    public static ControlFlowGraph graphOf(Block... blocks) {
        ControlFlowGraph graph = new ControlFlowGraph();
        for (Block block : blocks) {
            graph.addBlock(block);
        }
        for (Block block : blocks) {
            for (long target : targets(block)) {
                Block to = graph.blockAt(target);
                if (to == null) throw new IllegalArgumentException(String.format("no block at %#x", target));
                graph.addEdge(block, to);
            }
        }
        return graph;
    }

    private static List<Long> targets(Block block) {
        List<Long> targets = new ArrayList<>();
        Stmt last = block.lastStatement();
        if (last instanceof Stmt.Jump) {
            addTarget(targets, ((Stmt.Jump) last).target);
        } else if (last instanceof Stmt.CondJump) {
            addTarget(targets, ((Stmt.CondJump) last).trueTarget);
            addTarget(targets, ((Stmt.CondJump) last).falseTarget);
        }
        return targets;
    }

    private static void addTarget(List<Long> targets, Expr target) {
        if (target instanceof Expr.Const) targets.add(((Expr.Const) target).value);
    }

    public static Function function(ControlFlowGraph graph) {
        return function(graph, "AMD64", "linux");
    }

    public static Function function(ControlFlowGraph graph, String arch, String platform) {
        return new Function("test_fn", 0x1000, "test.bin", arch, platform, graph);
    }
}
