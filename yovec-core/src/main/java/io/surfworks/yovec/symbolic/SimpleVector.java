package io.surfworks.yovec.symbolic;

import io.surfworks.yovec.CompileException;
import io.surfworks.yovec.ErrorKind;
import io.surfworks.yovec.ast.SyntaxNode;

import java.util.ArrayList;
import java.util.List;

/**
 * An ordered sequence of deferred scalar elements.
 *
 * <p>All combinators are element-wise and pure unless noted. Binary combinators
 * require operands of equal length.
 */
public record SimpleVector(List<SimpleNumber> elements) implements SymbolicValue {

    public SimpleVector {
        elements = List.copyOf(elements);
    }

    public static SimpleVector of(SimpleNumber... elements) {
        return new SimpleVector(List.of(elements));
    }

    public int length() {
        return elements.size();
    }

    public SimpleNumber get(int index) {
        return elements.get(index);
    }

    @Override
    public Shape shape() {
        return Shape.VECTOR;
    }

    @Override
    public int elementCount() {
        return elements.size();
    }

    /**
     * Applies a unary operator to every element.
     */
    public SimpleVector map(UnaryOp op) {
        List<SimpleNumber> mapped = new ArrayList<>(elements.size());
        for (SimpleNumber element : elements) {
            mapped.add(element.unary(op));
        }
        return new SimpleVector(mapped);
    }

    public SimpleVector vecunary(UnaryOp op) {
        return map(op);
    }

    /**
     * Pairs elements positionally: {@code this[i] op rhs[i]}.
     */
    public SimpleVector vecbinary(BinaryOp op, SimpleVector rhs) {
        requireSameLength(op.symbol(), rhs);
        List<SimpleNumber> combined = new ArrayList<>(elements.size());
        for (int i = 0; i < elements.size(); i++) {
            combined.add(elements.get(i).binary(op, rhs.elements.get(i)));
        }
        return new SimpleVector(combined);
    }

    /**
     * Broadcasts the scalar as left operand: {@code scalar op this[i]}.
     */
    public SimpleVector premap(BinaryOp op, SimpleNumber scalar) {
        List<SimpleNumber> mapped = new ArrayList<>(elements.size());
        for (SimpleNumber element : elements) {
            mapped.add(scalar.binary(op, element));
        }
        return new SimpleVector(mapped);
    }

    /**
     * Broadcasts the scalar as right operand: {@code this[i] op scalar}.
     */
    public SimpleVector postmap(SimpleNumber scalar, BinaryOp op) {
        List<SimpleNumber> mapped = new ArrayList<>(elements.size());
        for (SimpleNumber element : elements) {
            mapped.add(element.binary(op, scalar));
        }
        return new SimpleVector(mapped);
    }

    public SimpleVector concat(SimpleVector other) {
        List<SimpleNumber> joined = new ArrayList<>(elements.size() + other.elements.size());
        joined.addAll(elements);
        joined.addAll(other.elements);
        return new SimpleVector(joined);
    }

    /**
     * Left-folds the operator across the elements in order.
     */
    public SimpleNumber reduce(BinaryOp op) {
        if (elements.isEmpty()) {
            throw new CompileException(ErrorKind.EMPTY_REDUCE,
                    "cannot reduce an empty vector with " + op.symbol());
        }
        SimpleNumber acc = elements.get(0);
        for (int i = 1; i < elements.size(); i++) {
            acc = acc.binary(op, elements.get(i));
        }
        return acc;
    }

    public SimpleNumber dot(SimpleVector other) {
        requireSameLength("dot", other);
        return vecbinary(BinaryOp.MUL, other).reduce(BinaryOp.ADD);
    }

    public SimpleVector cross(SimpleVector other) {
        if (length() != 3 || other.length() != 3) {
            throw new CompileException(ErrorKind.SHAPE_MISMATCH, String.format(
                    "cross product requires two vectors of length 3, got %d and %d", length(), other.length()));
        }
        return SimpleVector.of(
                crossTerm(other, 1, 2),
                crossTerm(other, 2, 0),
                crossTerm(other, 0, 1));
    }

    private SimpleNumber crossTerm(SimpleVector other, int i, int j) {
        SimpleNumber left = get(i).binary(BinaryOp.MUL, other.get(j));
        SimpleNumber right = get(j).binary(BinaryOp.MUL, other.get(i));
        return left.binary(BinaryOp.SUB, right);
    }

    /**
     * Element count as a compile-time literal.
     */
    public SimpleNumber len() {
        return SimpleNumber.literal(elements.size());
    }

    @Override
    public Assigned<SimpleVector> assign(int baseIndex) {
        List<SyntaxNode> statements = new ArrayList<>(elements.size());
        List<SimpleNumber> residual = new ArrayList<>(elements.size());
        for (int i = 0; i < elements.size(); i++) {
            String name = RegisterNames.element(baseIndex, i);
            statements.add(elements.get(i).assignTo(name));
            residual.add(SimpleNumber.register(name));
        }
        return new Assigned<>(statements, new SimpleVector(residual));
    }

    private void requireSameLength(String operation, SimpleVector other) {
        if (length() != other.length()) {
            throw new CompileException(ErrorKind.SHAPE_MISMATCH, String.format(
                    "%s requires vectors of equal length, got %d and %d", operation, length(), other.length()));
        }
    }
}
