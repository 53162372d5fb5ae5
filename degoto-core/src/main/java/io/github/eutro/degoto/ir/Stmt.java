package io.github.eutro.degoto.ir;

import io.github.eutro.degoto.ext.ExtHolder;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * A statement of the lifted IR. Statements are immutable; exts attached to them
 * (such as the instruction address) are not part of equality.
 */
public abstract class Stmt extends ExtHolder {
    Stmt() {
    }

    public static final class Label extends Stmt {
        public final String name;

        public Label(String name) {
            this.name = name;
        }

        @Override
        public boolean equals(Object o) {
            return this == o || o instanceof Label && name.equals(((Label) o).name);
        }

        @Override
        public int hashCode() {
            return name.hashCode();
        }

        @Override
        public String toString() {
            return name + ":";
        }
    }

    public static final class Assign extends Stmt {
        public final Expr.Var dst;
        public final Expr src;

        public Assign(Expr.Var dst, Expr src) {
            this.dst = dst;
            this.src = src;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Assign)) return false;
            Assign that = (Assign) o;
            return dst.equals(that.dst) && src.equals(that.src);
        }

        @Override
        public int hashCode() {
            return Objects.hash(dst, src);
        }

        @Override
        public String toString() {
            return dst + " = " + src;
        }
    }

    public static final class Store extends Stmt {
        public final Expr addr;
        public final Expr value;

        public Store(Expr addr, Expr value) {
            this.addr = addr;
            this.value = value;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Store)) return false;
            Store that = (Store) o;
            return addr.equals(that.addr) && value.equals(that.value);
        }

        @Override
        public int hashCode() {
            return Objects.hash(Store.class, addr, value);
        }

        @Override
        public String toString() {
            return "*(" + addr + ") = " + value;
        }
    }

    /**
     * An expression evaluated for its side effects, typically a call.
     */
    public static final class ExprStmt extends Stmt {
        public final Expr expr;

        public ExprStmt(Expr expr) {
            this.expr = expr;
        }

        @Override
        public boolean equals(Object o) {
            return this == o || o instanceof ExprStmt && expr.equals(((ExprStmt) o).expr);
        }

        @Override
        public int hashCode() {
            return Objects.hash(ExprStmt.class, expr);
        }

        @Override
        public String toString() {
            return expr.toString();
        }
    }

    public static final class Jump extends Stmt {
        public final Expr target;

        public Jump(Expr target) {
            this.target = target;
        }

        @Override
        public boolean equals(Object o) {
            return this == o || o instanceof Jump && target.equals(((Jump) o).target);
        }

        @Override
        public int hashCode() {
            return Objects.hash(Jump.class, target);
        }

        @Override
        public String toString() {
            return "goto " + target;
        }
    }

    public static final class CondJump extends Stmt {
        public final Expr condition;
        public final Expr trueTarget;
        public final Expr falseTarget;

        public CondJump(Expr condition, Expr trueTarget, Expr falseTarget) {
            this.condition = condition;
            this.trueTarget = trueTarget;
            this.falseTarget = falseTarget;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof CondJump)) return false;
            CondJump that = (CondJump) o;
            return condition.equals(that.condition)
                    && trueTarget.equals(that.trueTarget)
                    && falseTarget.equals(that.falseTarget);
        }

        @Override
        public int hashCode() {
            return Objects.hash(condition, trueTarget, falseTarget);
        }

        @Override
        public String toString() {
            return "if " + condition + " goto " + trueTarget + " else goto " + falseTarget;
        }
    }

    public static final class Return extends Stmt {
        public final @Nullable Expr value;

        public Return(@Nullable Expr value) {
            this.value = value;
        }

        @Override
        public boolean equals(Object o) {
            return this == o || o instanceof Return && Objects.equals(value, ((Return) o).value);
        }

        @Override
        public int hashCode() {
            return Objects.hash(Return.class, value);
        }

        @Override
        public String toString() {
            return value == null ? "return" : "return " + value;
        }
    }
}
