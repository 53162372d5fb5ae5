package io.github.eutro.degoto.ir;

public enum UnaryOperator {
    NEG("-"),
    NOT("~"),
    LOGICAL_NOT("!"),
    ;

    public final String symbol;

    UnaryOperator(String symbol) {
        this.symbol = symbol;
    }
}
