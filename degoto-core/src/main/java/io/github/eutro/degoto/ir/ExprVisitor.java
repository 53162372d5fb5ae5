package io.github.eutro.degoto.ir;

/**
 * A visitor over the closed set of {@link Expr} variants.
 *
 * @param <R> The result type.
 */
public interface ExprVisitor<R> {
    R visitConst(Expr.Const expr);

    R visitVar(Expr.Var expr);

    R visitLoad(Expr.Load expr);

    R visitBinOp(Expr.BinOp expr);

    R visitUnOp(Expr.UnOp expr);

    R visitConvert(Expr.Convert expr);

    R visitCall(Expr.Call expr);
}
