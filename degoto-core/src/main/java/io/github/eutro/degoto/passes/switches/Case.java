package io.github.eutro.degoto.passes.switches;

import io.github.eutro.degoto.cfg.Block;
import io.github.eutro.degoto.ir.CaseValue;
import io.github.eutro.degoto.ir.Expr;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * One arm of a recognised switch ladder.
 * <p>
 * Equality covers every field but the compared expression, which is already identified by
 * {@link #exprKey}.
 */
public final class Case {
    public final Block originalNode;
    /**
     * The shape of {@link #originalNode}, or null for default cases.
     */
    public final @Nullable ComparisonShape shape;
    public final ExprKey exprKey;
    public final @Nullable Expr expr;
    public final CaseValue value;
    public final long target;
    /**
     * The address of the next comparison of the ladder, null for default cases.
     */
    public final @Nullable Long nextAddr;

    public Case(Block originalNode, @Nullable ComparisonShape shape, ExprKey exprKey, @Nullable Expr expr,
                CaseValue value, long target, @Nullable Long nextAddr) {
        this.originalNode = originalNode;
        this.shape = shape;
        this.exprKey = exprKey;
        this.expr = expr;
        this.value = value;
        this.target = target;
        this.nextAddr = nextAddr;
    }

    public static Case defaultCase(Block lastNode, ExprKey exprKey, @Nullable Expr expr, long target) {
        return new Case(lastNode, null, exprKey, expr, CaseValue.DEFAULT, target, null);
    }

    public boolean isDefault() {
        return value.isDefault();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Case)) return false;
        Case that = (Case) o;
        return target == that.target
                && exprKey.equals(that.exprKey)
                && originalNode.equals(that.originalNode)
                && shape == that.shape
                && value.equals(that.value)
                && Objects.equals(nextAddr, that.nextAddr);
    }

    @Override
    public int hashCode() {
        return Objects.hash(originalNode, shape, exprKey, value, target, nextAddr);
    }

    @Override
    public String toString() {
        if (isDefault()) {
            return String.format("Case default@%#x", target);
        }
        return String.format("Case %s@%#x: %s == %s", originalNode.toTargetString(), target, expr, value);
    }
}
