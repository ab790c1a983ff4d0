package io.surfworks.yovec.symbolic;

import io.surfworks.yovec.CompileException;
import io.surfworks.yovec.ast.NodeKind;
import io.surfworks.yovec.ast.SyntaxNode;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * Deferred scalar expression tree. Element trees of symbolic values are built from
 * these nodes and only turned into output syntax when a value is assigned.
 */
public sealed interface ScalarExpr permits
        ScalarExpr.Literal, ScalarExpr.ImportRef, ScalarExpr.ExternalRef,
        ScalarExpr.Register, ScalarExpr.Unary, ScalarExpr.Binary {

    /**
     * Renders this expression as an output-tree node.
     */
    SyntaxNode toNode();

    /**
     * Numeric literal, kept in its source spelling.
     */
    record Literal(String text) implements ScalarExpr {
        public Literal {
            Objects.requireNonNull(text, "text cannot be null");
            try {
                new BigDecimal(text);
            } catch (NumberFormatException e) {
                throw CompileException.internal("malformed number literal: %s", text);
            }
        }

        @Override
        public SyntaxNode toNode() {
            return SyntaxNode.leaf(NodeKind.NUMBER, text);
        }
    }

    /**
     * Reference to an imported name. It keeps its name through mangling.
     */
    record ImportRef(String name) implements ScalarExpr {
        @Override
        public SyntaxNode toNode() {
            return SyntaxNode.leaf(NodeKind.VARIABLE, name);
        }
    }

    /**
     * Target-language external value such as {@code :speed}.
     */
    record ExternalRef(String text) implements ScalarExpr {
        @Override
        public SyntaxNode toNode() {
            return SyntaxNode.leaf(NodeKind.EXTERNAL, text);
        }
    }

    /**
     * Read-back of an already assigned register element.
     */
    record Register(String name) implements ScalarExpr {
        @Override
        public SyntaxNode toNode() {
            return SyntaxNode.leaf(NodeKind.VARIABLE, name);
        }
    }

    record Unary(UnaryOp op, ScalarExpr operand) implements ScalarExpr {
        @Override
        public SyntaxNode toNode() {
            return SyntaxNode.valued(NodeKind.UNARY_OP, op.symbol(), List.of(operand.toNode()));
        }
    }

    record Binary(BinaryOp op, ScalarExpr lhs, ScalarExpr rhs) implements ScalarExpr {
        @Override
        public SyntaxNode toNode() {
            return SyntaxNode.valued(NodeKind.BINARY_OP, op.symbol(), List.of(lhs.toNode(), rhs.toNode()));
        }
    }
}
