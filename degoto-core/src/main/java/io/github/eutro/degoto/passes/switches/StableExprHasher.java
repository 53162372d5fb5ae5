package io.github.eutro.degoto.passes.switches;

import io.github.eutro.degoto.ir.Expr;
import io.github.eutro.degoto.ir.ExprVisitor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Computes a key for an expression that identifies the variables it reads and the operations
 * applied to them, so that comparisons of the same value against different constants share a key.
 * <p>
 * Each variant contributes its own token in pre-order: a variable its identity, a load and every
 * operator their kind, a constant its value and width. Keys are stable across runs.
 */
public class StableExprHasher implements ExprVisitor<Void> {
    private final List<Object> tokens = new ArrayList<>();

    private StableExprHasher() {
    }

    public static ExprKey key(Expr expr) {
        StableExprHasher hasher = new StableExprHasher();
        expr.accept(hasher);
        return new ExprKey(hasher.tokens);
    }

    private Void visitChildren(Expr expr) {
        for (Expr child : expr.children()) {
            child.accept(this);
        }
        return null;
    }

    @Override
    public Void visitVar(Expr.Var expr) {
        tokens.add(Arrays.asList("Var", expr.name, expr.index));
        return null;
    }

    @Override
    public Void visitLoad(Expr.Load expr) {
        tokens.add(Arrays.asList("Load", expr.size));
        return visitChildren(expr);
    }

    @Override
    public Void visitBinOp(Expr.BinOp expr) {
        tokens.add(expr.op.name());
        return visitChildren(expr);
    }

    @Override
    public Void visitUnOp(Expr.UnOp expr) {
        tokens.add(expr.op.name());
        return visitChildren(expr);
    }

    @Override
    public Void visitConst(Expr.Const expr) {
        tokens.add(Arrays.asList(expr.value, expr.bits));
        return null;
    }

    @Override
    public Void visitConvert(Expr.Convert expr) {
        tokens.add(Arrays.asList("Convert", expr.fromBits, expr.toBits));
        return visitChildren(expr);
    }

    @Override
    public Void visitCall(Expr.Call expr) {
        tokens.add(Arrays.asList("Call", expr.target, expr.args.size()));
        return visitChildren(expr);
    }
}
