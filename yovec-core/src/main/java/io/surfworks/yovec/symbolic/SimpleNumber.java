package io.surfworks.yovec.symbolic;

import io.surfworks.yovec.ast.SyntaxNode;

import java.util.List;
import java.util.Objects;

/**
 * A scalar whose value is a deferred {@link ScalarExpr}.
 */
public record SimpleNumber(ScalarExpr expr) implements SymbolicValue {

    public SimpleNumber {
        Objects.requireNonNull(expr, "expr cannot be null");
    }

    public static SimpleNumber literal(String text) {
        return new SimpleNumber(new ScalarExpr.Literal(text));
    }

    public static SimpleNumber literal(long value) {
        return literal(Long.toString(value));
    }

    public static SimpleNumber imported(String name) {
        return new SimpleNumber(new ScalarExpr.ImportRef(name));
    }

    public static SimpleNumber external(String text) {
        return new SimpleNumber(new ScalarExpr.ExternalRef(text));
    }

    public static SimpleNumber register(String name) {
        return new SimpleNumber(new ScalarExpr.Register(name));
    }

    public SimpleNumber unary(UnaryOp op) {
        return new SimpleNumber(new ScalarExpr.Unary(op, expr));
    }

    public SimpleNumber binary(BinaryOp op, SimpleNumber rhs) {
        return new SimpleNumber(new ScalarExpr.Binary(op, expr, rhs.expr));
    }

    @Override
    public Shape shape() {
        return Shape.NUMBER;
    }

    @Override
    public int elementCount() {
        return 1;
    }

    @Override
    public Assigned<SimpleNumber> assign(int baseIndex) {
        String name = RegisterNames.scalar(baseIndex);
        return new Assigned<>(List.of(assignTo(name)), register(name));
    }

    SyntaxNode assignTo(String name) {
        return RegisterNames.assignment(name, expr);
    }
}
