package io.github.eutro.degoto.ir;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * An expression of the lifted IR.
 * <p>
 * The set of variants is closed: every expression is one of the nested classes here,
 * and consumers dispatch over them with an {@link ExprVisitor}. Expressions are immutable
 * and compare structurally.
 */
public abstract class Expr {
    private Expr() {
    }

    public abstract <R> R accept(ExprVisitor<R> visitor);

    /**
     * The direct sub-expressions of this expression, in evaluation order.
     *
     * @return The children.
     */
    public abstract List<Expr> children();

    public static Const constant(long value, int bits) {
        return new Const(value, bits);
    }

    public static Const constant(long value) {
        return new Const(value, 64);
    }

    public static Var var(String name) {
        return new Var(name, 0);
    }

    public static BinOp binOp(BinaryOperator op, Expr lhs, Expr rhs) {
        return new BinOp(op, lhs, rhs);
    }

    public static final class Const extends Expr {
        public final long value;
        public final int bits;

        public Const(long value, int bits) {
            this.value = value;
            this.bits = bits;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitConst(this);
        }

        @Override
        public List<Expr> children() {
            return Collections.emptyList();
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Const)) return false;
            Const that = (Const) o;
            return value == that.value && bits == that.bits;
        }

        @Override
        public int hashCode() {
            return Objects.hash(value, bits);
        }

        @Override
        public String toString() {
            return String.format("%#x", value);
        }
    }

    /**
     * A reference to a recovered variable. Two references denote the same variable
     * iff their names and indices are equal.
     */
    public static final class Var extends Expr {
        public final String name;
        public final int index;

        public Var(String name, int index) {
            this.name = name;
            this.index = index;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitVar(this);
        }

        @Override
        public List<Expr> children() {
            return Collections.emptyList();
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Var)) return false;
            Var that = (Var) o;
            return index == that.index && name.equals(that.name);
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, index);
        }

        @Override
        public String toString() {
            return '$' + name + (index == 0 ? "" : "." + index);
        }
    }

    public static final class Load extends Expr {
        public final Expr addr;
        public final int size;

        public Load(Expr addr, int size) {
            this.addr = addr;
            this.size = size;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLoad(this);
        }

        @Override
        public List<Expr> children() {
            return Collections.singletonList(addr);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Load)) return false;
            Load that = (Load) o;
            return size == that.size && addr.equals(that.addr);
        }

        @Override
        public int hashCode() {
            return Objects.hash(Load.class, addr, size);
        }

        @Override
        public String toString() {
            return "*(" + addr + ")<" + size + ">";
        }
    }

    public static final class BinOp extends Expr {
        public final BinaryOperator op;
        public final Expr lhs;
        public final Expr rhs;

        public BinOp(BinaryOperator op, Expr lhs, Expr rhs) {
            this.op = op;
            this.lhs = lhs;
            this.rhs = rhs;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBinOp(this);
        }

        @Override
        public List<Expr> children() {
            return Arrays.asList(lhs, rhs);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof BinOp)) return false;
            BinOp that = (BinOp) o;
            return op == that.op && lhs.equals(that.lhs) && rhs.equals(that.rhs);
        }

        @Override
        public int hashCode() {
            return Objects.hash(op, lhs, rhs);
        }

        @Override
        public String toString() {
            return "(" + lhs + " " + op.symbol + " " + rhs + ")";
        }
    }

    public static final class UnOp extends Expr {
        public final UnaryOperator op;
        public final Expr operand;

        public UnOp(UnaryOperator op, Expr operand) {
            this.op = op;
            this.operand = operand;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitUnOp(this);
        }

        @Override
        public List<Expr> children() {
            return Collections.singletonList(operand);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof UnOp)) return false;
            UnOp that = (UnOp) o;
            return op == that.op && operand.equals(that.operand);
        }

        @Override
        public int hashCode() {
            return Objects.hash(op, operand);
        }

        @Override
        public String toString() {
            return op.symbol + operand;
        }
    }

    public static final class Convert extends Expr {
        public final int fromBits;
        public final int toBits;
        public final Expr operand;

        public Convert(int fromBits, int toBits, Expr operand) {
            this.fromBits = fromBits;
            this.toBits = toBits;
            this.operand = operand;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitConvert(this);
        }

        @Override
        public List<Expr> children() {
            return Collections.singletonList(operand);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Convert)) return false;
            Convert that = (Convert) o;
            return fromBits == that.fromBits && toBits == that.toBits && operand.equals(that.operand);
        }

        @Override
        public int hashCode() {
            return Objects.hash(Convert.class, fromBits, toBits, operand);
        }

        @Override
        public String toString() {
            return "Conv(" + fromBits + "->" + toBits + ", " + operand + ")";
        }
    }

    public static final class Call extends Expr {
        public final String target;
        public final List<Expr> args;

        public Call(String target, List<Expr> args) {
            this.target = target;
            this.args = Collections.unmodifiableList(new ArrayList<>(args));
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCall(this);
        }

        @Override
        public List<Expr> children() {
            return args;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Call)) return false;
            Call that = (Call) o;
            return target.equals(that.target) && args.equals(that.args);
        }

        @Override
        public int hashCode() {
            return Objects.hash(target, args);
        }

        @Override
        public String toString() {
            return target + args.stream()
                    .map(Objects::toString)
                    .collect(Collectors.joining(", ", "(", ")"));
        }
    }
}
