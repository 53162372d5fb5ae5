package io.github.eutro.degoto.passes.switches;

import io.github.eutro.degoto.cfg.Block;
import io.github.eutro.degoto.ir.Expr;
import io.github.eutro.degoto.ir.Stmt;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * The comparison a block ends with, normalised so that:
 * <ul>
 *     <li>for {@link Kind#EQ}, {@link #target} is taken when the expression equals {@link #value},
 *     and {@link #next} otherwise;</li>
 *     <li>for {@link Kind#GT}, {@link #target} is taken when the expression is greater than {@link #value},
 *     and {@link #next} otherwise.</li>
 * </ul>
 */
public final class Comparison {
    public enum Kind {
        EQ,
        GT,
    }

    public final ComparisonShape shape;
    public final ExprKey exprKey;
    public final Kind kind;
    public final Expr expr;
    public final long value;
    public final long target;
    public final long next;

    public Comparison(ComparisonShape shape, ExprKey exprKey, Kind kind, Expr expr, long value, long target, long next) {
        this.shape = shape;
        this.exprKey = exprKey;
        this.kind = kind;
        this.expr = expr;
        this.value = value;
        this.target = target;
        this.next = next;
    }

    /**
     * Classify a block by its terminating comparison.
     *
     * @param block The block.
     * @return The comparison, or null if the block is not a ladder comparison of any shape.
     */
    public static @Nullable Comparison classify(Block block) {
        List<Stmt> stmts = block.getStatements();
        if (stmts.isEmpty()) return null;
        Stmt last = stmts.get(stmts.size() - 1);
        if (!(last instanceof Stmt.CondJump)) return null;
        Stmt.CondJump jump = (Stmt.CondJump) last;
        if (!(jump.trueTarget instanceof Expr.Const) || !(jump.falseTarget instanceof Expr.Const)) return null;
        if (!(jump.condition instanceof Expr.BinOp)) return null;
        Expr.BinOp cond = (Expr.BinOp) jump.condition;
        if (!(cond.rhs instanceof Expr.Const)) return null;

        long trueAddr = ((Expr.Const) jump.trueTarget).value;
        long falseAddr = ((Expr.Const) jump.falseTarget).value;
        long value = ((Expr.Const) cond.rhs).value;
        boolean alone = isOnlyNonLabel(stmts);
        ExprKey key = StableExprHasher.key(cond.lhs);

        switch (cond.op) {
            case CMP_EQ:
                return new Comparison(alone ? ComparisonShape.B : ComparisonShape.A,
                        key, Kind.EQ, cond.lhs, value, trueAddr, falseAddr);
            case CMP_NE:
                return new Comparison(alone ? ComparisonShape.B : ComparisonShape.A,
                        key, Kind.EQ, cond.lhs, value, falseAddr, trueAddr);
            case CMP_GT:
            case CMP_GE:
            case CMP_LT:
            case CMP_LE:
                if (!alone || trueAddr == falseAddr) return null;
                return rangeSplit(cond, key, value, trueAddr, falseAddr);
            default:
                return null;
        }
    }

    private static Comparison rangeSplit(Expr.BinOp cond, ExprKey key, long value, long trueAddr, long falseAddr) {
        switch (cond.op) {
            case CMP_GT:
                return new Comparison(ComparisonShape.C, key, Kind.GT, cond.lhs, value, trueAddr, falseAddr);
            case CMP_GE:
                return new Comparison(ComparisonShape.C, key, Kind.GT, cond.lhs, value + 1, trueAddr, falseAddr);
            case CMP_LT:
                return new Comparison(ComparisonShape.C, key, Kind.GT, cond.lhs, value - 1, falseAddr, trueAddr);
            case CMP_LE:
                return new Comparison(ComparisonShape.C, key, Kind.GT, cond.lhs, value, falseAddr, trueAddr);
            default:
                throw new IllegalArgumentException(cond.op.name());
        }
    }

    private static boolean isOnlyNonLabel(List<Stmt> stmts) {
        for (int i = 0; i < stmts.size() - 1; i++) {
            if (!(stmts.get(i) instanceof Stmt.Label)) return false;
        }
        return true;
    }

    @Override
    public String toString() {
        return String.format("%s %s %s %d ? %#x : %#x", shape, expr, kind, value, target, next);
    }
}
