package org.slowpy.rt;

/** The binary arithmetic operations dispatched by {@link Number}. */
public enum BinaryOp {
    /** Python {@code v+w} */
    ADD("+"),
    /** Python {@code v-w} */
    SUB("-"),
    /** Python {@code v*w} */
    MUL("*"),
    /** Python {@code v/w} (on integers, truncating) */
    DIV("/");

    private final String symbol;

    BinaryOp(String symbol) { this.symbol = symbol; }

    /** @return the operator as written in Python */
    public String getSymbol() { return symbol; }
}
