package io.github.eutro.degoto.ir;

public enum BinaryOperator {
    ADD("+"),
    SUB("-"),
    MUL("*"),
    DIV("/"),
    AND("&"),
    OR("|"),
    XOR("^"),
    SHL("<<"),
    SHR(">>"),
    CMP_EQ("=="),
    CMP_NE("!="),
    CMP_LT("<"),
    CMP_LE("<="),
    CMP_GT(">"),
    CMP_GE(">="),
    ;

    public final String symbol;

    BinaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public boolean isComparison() {
        return ordinal() >= CMP_EQ.ordinal();
    }
}
