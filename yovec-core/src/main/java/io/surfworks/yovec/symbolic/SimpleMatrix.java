package io.surfworks.yovec.symbolic;

import io.surfworks.yovec.CompileException;
import io.surfworks.yovec.ErrorKind;
import io.surfworks.yovec.ast.SyntaxNode;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * A row-major matrix of deferred scalar elements. Every row has the same length.
 *
 * <p>Element-wise combinators mirror {@link SimpleVector} row by row. Assignment
 * flattens row-major, so element {@code (r, c)} lands at {@code r * columns + c}.
 */
public record SimpleMatrix(List<SimpleVector> rows) implements SymbolicValue {

    public SimpleMatrix {
        rows = List.copyOf(rows);
        if (rows.isEmpty()) {
            throw new CompileException(ErrorKind.SHAPE_MISMATCH, "matrix must have at least one row");
        }
        int width = rows.get(0).length();
        for (int r = 1; r < rows.size(); r++) {
            if (rows.get(r).length() != width) {
                throw new CompileException(ErrorKind.SHAPE_MISMATCH, String.format(
                        "matrix rows must have equal length, row 0 has %d but row %d has %d",
                        width, r, rows.get(r).length()));
            }
        }
    }

    public static SimpleMatrix of(SimpleVector... rows) {
        return new SimpleMatrix(List.of(rows));
    }

    public int rowCount() {
        return rows.size();
    }

    public int columnCount() {
        return rows.get(0).length();
    }

    public SimpleVector row(int index) {
        return rows.get(index);
    }

    public SimpleVector column(int index) {
        List<SimpleNumber> column = new ArrayList<>(rows.size());
        for (SimpleVector row : rows) {
            column.add(row.get(index));
        }
        return new SimpleVector(column);
    }

    @Override
    public Shape shape() {
        return Shape.MATRIX;
    }

    @Override
    public int elementCount() {
        return rowCount() * columnCount();
    }

    public SimpleMatrix map(UnaryOp op) {
        return mapRows(row -> row.map(op));
    }

    public SimpleMatrix vecunary(UnaryOp op) {
        return map(op);
    }

    public SimpleMatrix vecbinary(BinaryOp op, SimpleMatrix rhs) {
        if (rowCount() != rhs.rowCount() || columnCount() != rhs.columnCount()) {
            throw new CompileException(ErrorKind.SHAPE_MISMATCH, String.format(
                    "%s requires matrices of equal dimensions, got %s and %s",
                    op.symbol(), dimensions(), rhs.dimensions()));
        }
        List<SimpleVector> combined = new ArrayList<>(rows.size());
        for (int r = 0; r < rows.size(); r++) {
            combined.add(rows.get(r).vecbinary(op, rhs.rows.get(r)));
        }
        return new SimpleMatrix(combined);
    }

    public SimpleMatrix premap(BinaryOp op, SimpleNumber scalar) {
        return mapRows(row -> row.premap(op, scalar));
    }

    public SimpleMatrix postmap(SimpleNumber scalar, BinaryOp op) {
        return mapRows(row -> row.postmap(scalar, op));
    }

    /**
     * Appends the other matrix's rows below this one's.
     */
    public SimpleMatrix concat(SimpleMatrix other) {
        if (columnCount() != other.columnCount()) {
            throw new CompileException(ErrorKind.SHAPE_MISMATCH, String.format(
                    "concat requires matrices with equal column counts, got %s and %s",
                    dimensions(), other.dimensions()));
        }
        List<SimpleVector> joined = new ArrayList<>(rows);
        joined.addAll(other.rows);
        return new SimpleMatrix(joined);
    }

    public SimpleMatrix transpose() {
        if (columnCount() == 0) {
            throw new CompileException(ErrorKind.SHAPE_MISMATCH, "cannot transpose a matrix with no columns");
        }
        List<SimpleVector> columns = new ArrayList<>(columnCount());
        for (int c = 0; c < columnCount(); c++) {
            columns.add(column(c));
        }
        return new SimpleMatrix(columns);
    }

    /**
     * Matrix product. Each result element is the dot product of a row of this
     * matrix with a column of {@code rhs}.
     */
    public SimpleMatrix matmul(SimpleMatrix rhs) {
        if (columnCount() != rhs.rowCount()) {
            throw new CompileException(ErrorKind.SHAPE_MISMATCH, String.format(
                    "matmul requires lhs columns to equal rhs rows, got %s and %s",
                    dimensions(), rhs.dimensions()));
        }
        List<SimpleVector> product = new ArrayList<>(rowCount());
        for (SimpleVector row : rows) {
            List<SimpleNumber> cells = new ArrayList<>(rhs.columnCount());
            for (int c = 0; c < rhs.columnCount(); c++) {
                cells.add(row.dot(rhs.column(c)));
            }
            product.add(new SimpleVector(cells));
        }
        return new SimpleMatrix(product);
    }

    /**
     * Matrix-vector product, one dot product per row.
     */
    public SimpleVector matmul(SimpleVector rhs) {
        if (columnCount() != rhs.length()) {
            throw new CompileException(ErrorKind.SHAPE_MISMATCH, String.format(
                    "matmul requires matrix columns to equal vector length, got %s and %d",
                    dimensions(), rhs.length()));
        }
        List<SimpleNumber> product = new ArrayList<>(rowCount());
        for (SimpleVector row : rows) {
            product.add(row.dot(rhs));
        }
        return new SimpleVector(product);
    }

    @Override
    public Assigned<SimpleMatrix> assign(int baseIndex) {
        List<SyntaxNode> statements = new ArrayList<>(elementCount());
        List<SimpleVector> residual = new ArrayList<>(rows.size());
        int columns = columnCount();
        for (int r = 0; r < rows.size(); r++) {
            List<SimpleNumber> readBack = new ArrayList<>(columns);
            for (int c = 0; c < columns; c++) {
                String name = RegisterNames.element(baseIndex, r * columns + c);
                statements.add(rows.get(r).get(c).assignTo(name));
                readBack.add(SimpleNumber.register(name));
            }
            residual.add(new SimpleVector(readBack));
        }
        return new Assigned<>(statements, new SimpleMatrix(residual));
    }

    private SimpleMatrix mapRows(UnaryOperator<SimpleVector> mapper) {
        List<SimpleVector> mapped = new ArrayList<>(rows.size());
        for (SimpleVector row : rows) {
            mapped.add(mapper.apply(row));
        }
        return new SimpleMatrix(mapped);
    }

    private String dimensions() {
        return rowCount() + "x" + columnCount();
    }
}
