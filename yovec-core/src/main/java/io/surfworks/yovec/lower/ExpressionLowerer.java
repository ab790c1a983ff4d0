package io.surfworks.yovec.lower;

import io.surfworks.yovec.CompileException;
import io.surfworks.yovec.ErrorKind;
import io.surfworks.yovec.ast.NodeKind;
import io.surfworks.yovec.ast.SyntaxNode;
import io.surfworks.yovec.env.Binding;
import io.surfworks.yovec.env.Environment;
import io.surfworks.yovec.symbolic.BinaryOp;
import io.surfworks.yovec.symbolic.Shape;
import io.surfworks.yovec.symbolic.SimpleMatrix;
import io.surfworks.yovec.symbolic.SimpleNumber;
import io.surfworks.yovec.symbolic.SimpleVector;
import io.surfworks.yovec.symbolic.SymbolicValue;
import io.surfworks.yovec.symbolic.UnaryOp;

import java.util.ArrayList;
import java.util.List;

/**
 * Lowers one input expression tree into a {@link SymbolicValue}.
 *
 * <p>Expressions never change the environment, so a lowerer is bound to the
 * environment in effect at the start of the statement. Variable references resolve
 * to the residual read-back value stored at their binding, never to the expression
 * that produced it.
 */
final class ExpressionLowerer {

    private final Environment env;

    ExpressionLowerer(Environment env) {
        this.env = env;
    }

    SymbolicValue lower(SyntaxNode node) {
        return switch (node.kind()) {
            case VARIABLE -> lowerVariable(node.identifier());
            case NUMBER -> SimpleNumber.literal(node.literal());
            case EXTERNAL -> SimpleNumber.external(node.literal());
            case VECTOR -> lowerVectorLiteral(node);
            case MATRIX -> lowerMatrixLiteral(node);
            case UNARY -> lowerUnary(node);
            case BINARY -> lowerBinary(node);
            case VECUNARY -> lowerVecUnary(node);
            case VECBINARY -> lowerVecBinary(node);
            case MAP -> lowerMap(node);
            case PREMAP -> lowerPremap(node);
            case POSTMAP -> lowerPostmap(node);
            case CONCAT -> lowerConcat(node);
            case REDUCE -> vectorOperand(node.child(1), "reduce").reduce(binaryOp(node.child(0)));
            case DOT -> vectorOperand(node.child(0), "dot").dot(vectorOperand(node.child(1), "dot"));
            case CROSS -> vectorOperand(node.child(0), "cross").cross(vectorOperand(node.child(1), "cross"));
            case LEN -> vectorOperand(node.child(0), "len").len();
            case TRANSPOSE -> matrixOperand(node.child(0), "transpose").transpose();
            case MATMUL -> lowerMatmul(node);
            default -> throw CompileException.internal("unexpected %s node in expression", node.kind());
        };
    }

    SimpleNumber lowerNumber(SyntaxNode node) {
        SymbolicValue value = lower(node);
        if (value instanceof SimpleNumber number) {
            return number;
        }
        throw new CompileException(ErrorKind.TYPE_MISMATCH,
                "expected a number but got a " + describe(value.shape()) + " in " + node.kind());
    }

    private SymbolicValue lowerVariable(String ident) {
        Binding binding = env.lookup(ident);
        if (binding instanceof Binding.Register register) {
            return register.value();
        }
        if (binding instanceof Binding.Imported) {
            return SimpleNumber.imported(ident);
        }
        throw CompileException.internal("%s binding cannot be referenced: %s", binding.describe(), ident);
    }

    private SimpleVector lowerVectorLiteral(SyntaxNode node) {
        List<SimpleNumber> elements = new ArrayList<>(node.childCount());
        for (SyntaxNode child : node.children()) {
            elements.add(lowerNumber(child));
        }
        return new SimpleVector(elements);
    }

    private SimpleMatrix lowerMatrixLiteral(SyntaxNode node) {
        List<SimpleVector> rows = new ArrayList<>(node.childCount());
        for (SyntaxNode child : node.children()) {
            rows.add(vectorOperand(child, "matrix row"));
        }
        return new SimpleMatrix(rows);
    }

    private SimpleNumber lowerUnary(SyntaxNode node) {
        SimpleNumber operand = lowerNumber(node.lastChild());
        // Prefix operators: the one nearest the operand applies first.
        for (int i = node.childCount() - 2; i >= 0; i--) {
            operand = operand.unary(unaryOp(node.child(i)));
        }
        return operand;
    }

    private SimpleNumber lowerBinary(SyntaxNode node) {
        requireChain(node);
        SimpleNumber acc = lowerNumber(node.child(0));
        for (int i = 1; i < node.childCount(); i += 2) {
            acc = acc.binary(binaryOp(node.child(i)), lowerNumber(node.child(i + 1)));
        }
        return acc;
    }

    private SymbolicValue lowerVecUnary(SyntaxNode node) {
        SymbolicValue operand = elementwiseOperand(node.lastChild(), "vecunary");
        for (int i = node.childCount() - 2; i >= 0; i--) {
            operand = applyUnary(operand, unaryOp(node.child(i)));
        }
        return operand;
    }

    private SymbolicValue lowerVecBinary(SyntaxNode node) {
        requireChain(node);
        SymbolicValue acc = elementwiseOperand(node.child(0), "vecbinary");
        for (int i = 1; i < node.childCount(); i += 2) {
            BinaryOp op = binaryOp(node.child(i));
            SymbolicValue rhs = elementwiseOperand(node.child(i + 1), "vecbinary");
            if (acc instanceof SimpleVector lhs && rhs instanceof SimpleVector vector) {
                acc = lhs.vecbinary(op, vector);
            } else if (acc instanceof SimpleMatrix lhs && rhs instanceof SimpleMatrix matrix) {
                acc = lhs.vecbinary(op, matrix);
            } else {
                throw new CompileException(ErrorKind.TYPE_MISMATCH, String.format(
                        "%s operands must both be vectors or both be matrices, got %s and %s",
                        op.symbol(), describe(acc.shape()), describe(rhs.shape())));
            }
        }
        return acc;
    }

    private SymbolicValue lowerMap(SyntaxNode node) {
        return applyUnary(elementwiseOperand(node.child(1), "map"), unaryOp(node.child(0)));
    }

    private SymbolicValue lowerPremap(SyntaxNode node) {
        BinaryOp op = binaryOp(node.child(0));
        SimpleNumber scalar = lowerNumber(node.child(1));
        SymbolicValue target = elementwiseOperand(node.child(2), "premap");
        if (target instanceof SimpleMatrix matrix) {
            return matrix.premap(op, scalar);
        }
        return ((SimpleVector) target).premap(op, scalar);
    }

    private SymbolicValue lowerPostmap(SyntaxNode node) {
        SimpleNumber scalar = lowerNumber(node.child(0));
        BinaryOp op = binaryOp(node.child(1));
        SymbolicValue target = elementwiseOperand(node.child(2), "postmap");
        if (target instanceof SimpleMatrix matrix) {
            return matrix.postmap(scalar, op);
        }
        return ((SimpleVector) target).postmap(scalar, op);
    }

    private SymbolicValue lowerConcat(SyntaxNode node) {
        SymbolicValue acc = elementwiseOperand(node.child(0), "concat");
        for (int i = 1; i < node.childCount(); i++) {
            SymbolicValue next = elementwiseOperand(node.child(i), "concat");
            if (acc instanceof SimpleVector lhs && next instanceof SimpleVector vector) {
                acc = lhs.concat(vector);
            } else if (acc instanceof SimpleMatrix lhs && next instanceof SimpleMatrix matrix) {
                acc = lhs.concat(matrix);
            } else {
                throw new CompileException(ErrorKind.TYPE_MISMATCH, String.format(
                        "concat operands must both be vectors or both be matrices, got %s and %s",
                        describe(acc.shape()), describe(next.shape())));
            }
        }
        return acc;
    }

    private SymbolicValue lowerMatmul(SyntaxNode node) {
        SimpleMatrix lhs = matrixOperand(node.child(0), "matmul");
        SymbolicValue rhs = elementwiseOperand(node.child(1), "matmul");
        if (rhs instanceof SimpleMatrix matrix) {
            return lhs.matmul(matrix);
        }
        return lhs.matmul((SimpleVector) rhs);
    }

    private static SymbolicValue applyUnary(SymbolicValue operand, UnaryOp op) {
        if (operand instanceof SimpleMatrix matrix) {
            return matrix.vecunary(op);
        }
        return ((SimpleVector) operand).vecunary(op);
    }

    /**
     * Lowers an operand of an element-wise combinator, which accepts vectors and matrices.
     */
    private SymbolicValue elementwiseOperand(SyntaxNode node, String operation) {
        SymbolicValue value = lower(node);
        if (value.shape() == Shape.NUMBER) {
            throw new CompileException(ErrorKind.TYPE_MISMATCH,
                    operation + " expects a vector or matrix operand but got a number");
        }
        return value;
    }

    private SimpleVector vectorOperand(SyntaxNode node, String operation) {
        SymbolicValue value = lower(node);
        if (value instanceof SimpleVector vector) {
            return vector;
        }
        if (value instanceof SimpleMatrix) {
            throw new CompileException(ErrorKind.UNSUPPORTED_OPERATION,
                    operation + " is not supported on matrices");
        }
        throw new CompileException(ErrorKind.TYPE_MISMATCH,
                operation + " expects a vector operand but got a number");
    }

    private SimpleMatrix matrixOperand(SyntaxNode node, String operation) {
        SymbolicValue value = lower(node);
        if (value instanceof SimpleMatrix matrix) {
            return matrix;
        }
        if (value instanceof SimpleVector) {
            throw new CompileException(ErrorKind.UNSUPPORTED_OPERATION,
                    operation + " is not supported on vectors");
        }
        throw new CompileException(ErrorKind.TYPE_MISMATCH,
                operation + " expects a matrix operand but got a number");
    }

    private static void requireChain(SyntaxNode node) {
        if (node.childCount() % 2 == 0) {
            throw CompileException.internal("%s node must alternate operands and operators, got %d children",
                    node.kind(), node.childCount());
        }
    }

    private static UnaryOp unaryOp(SyntaxNode node) {
        return UnaryOp.fromSymbol(operatorSymbol(node));
    }

    private static BinaryOp binaryOp(SyntaxNode node) {
        return BinaryOp.fromSymbol(operatorSymbol(node));
    }

    private static String operatorSymbol(SyntaxNode node) {
        if (node.kind() != NodeKind.OP || node.value() == null) {
            throw CompileException.internal("expected an operator but got %s", node);
        }
        return node.value();
    }

    static String describe(Shape shape) {
        return shape.name().toLowerCase();
    }
}
