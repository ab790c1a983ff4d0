package io.surfworks.yovec.symbolic;

import io.surfworks.yovec.CompileException;

/**
 * Scalar unary operators of the target language.
 */
public enum UnaryOp {
    NEG("-"),
    NOT("not"),
    ABS("abs"),
    SQRT("sqrt"),
    SIN("sin"),
    COS("cos"),
    TAN("tan"),
    ASIN("asin"),
    ACOS("acos"),
    ATAN("atan"),
    FACTORIAL("!");

    private final String symbol;

    UnaryOp(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public static UnaryOp fromSymbol(String symbol) {
        for (UnaryOp op : values()) {
            if (op.symbol.equals(symbol)) {
                return op;
            }
        }
        throw CompileException.internal("unknown unary operator: %s", symbol);
    }
}
