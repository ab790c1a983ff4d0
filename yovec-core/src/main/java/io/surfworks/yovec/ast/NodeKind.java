package io.surfworks.yovec.ast;

import io.surfworks.yovec.CompileException;

import java.util.HashMap;
import java.util.Map;

/**
 * Closed set of syntax node kinds for both the Yovec input tree and the YOLOL output tree.
 *
 * <p>Each kind carries its wire tag and an arity contract. A node either has no child
 * list at all (a leaf) or a complete list whose size fits the contract. Kinds such as
 * {@code variable} and {@code number} appear in both trees: the input form wraps an
 * {@code ident}/{@code literal} child while the output form is a valued leaf, so they
 * accept either shape.
 */
public enum NodeKind {

    // ==================== Shared structure ====================

    PROGRAM("program", Arity.atLeast(0)),
    LINE("line", Arity.exactly(1)),

    // ==================== Input statements ====================

    IMPORT("import", Arity.exactly(1)),
    EXPORT("export", Arity.exactly(2)),
    LET("let", Arity.exactly(2)),
    VEC_LET("vec_let", Arity.exactly(2)),
    NUM_LET("num_let", Arity.exactly(2)),
    MAT_LET("mat_let", Arity.exactly(2)),
    COMMENT("comment", Arity.leaf()),

    // ==================== Input leaves ====================

    VARIABLE("variable", Arity.leafOr(1)),
    IDENT("ident", Arity.leaf()),
    NUMBER("number", Arity.leafOr(1)),
    EXTERNAL("external", Arity.leafOr(1)),
    LITERAL("literal", Arity.leaf()),
    OP("op", Arity.leaf()),

    // ==================== Input expressions ====================

    VECTOR("vector", Arity.atLeast(0)),
    MATRIX("matrix", Arity.atLeast(1)),
    UNARY("unary", Arity.atLeast(2)),
    BINARY("binary", Arity.atLeast(3)),
    VECUNARY("vecunary", Arity.atLeast(2)),
    VECBINARY("vecbinary", Arity.atLeast(3)),
    MAP("map", Arity.exactly(2)),
    PREMAP("premap", Arity.exactly(3)),
    POSTMAP("postmap", Arity.exactly(3)),
    CONCAT("concat", Arity.atLeast(2)),
    REDUCE("reduce", Arity.exactly(2)),
    DOT("dot", Arity.exactly(2)),
    CROSS("cross", Arity.exactly(2)),
    LEN("len", Arity.exactly(1)),
    TRANSPOSE("transpose", Arity.exactly(1)),
    MATMUL("matmul", Arity.exactly(2)),

    // ==================== Output ====================

    MULTI("multi", Arity.atLeast(0)),
    ASSIGNMENT("assignment", Arity.exactly(2)),
    UNARY_OP("unary_op", Arity.exactly(1)),
    BINARY_OP("binary_op", Arity.exactly(2));

    private static final Map<String, NodeKind> BY_TAG = new HashMap<>();

    static {
        for (NodeKind kind : values()) {
            BY_TAG.put(kind.tag, kind);
        }
    }

    private final String tag;
    private final Arity arity;

    NodeKind(String tag, Arity arity) {
        this.tag = tag;
        this.arity = arity;
    }

    public String tag() {
        return tag;
    }

    public Arity arity() {
        return arity;
    }

    /**
     * Resolves a wire tag. An unknown tag means the producer of the tree does not
     * follow the grammar.
     */
    public static NodeKind fromTag(String tag) {
        NodeKind kind = BY_TAG.get(tag);
        if (kind == null) {
            throw CompileException.internal("unknown syntax node kind: %s", tag);
        }
        return kind;
    }

    @Override
    public String toString() {
        return tag;
    }

    /**
     * Child-count contract for a kind.
     *
     * @param leafAllowed whether the node may have no child list
     * @param min         minimum child count when a child list is present
     * @param max         maximum child count, or -1 for unbounded
     */
    public record Arity(boolean leafAllowed, int min, int max) {

        static Arity leaf() {
            return new Arity(true, 0, 0);
        }

        static Arity exactly(int n) {
            return new Arity(false, n, n);
        }

        static Arity atLeast(int n) {
            return new Arity(false, n, -1);
        }

        static Arity leafOr(int n) {
            return new Arity(true, n, n);
        }

        public boolean acceptsLeaf() {
            return leafAllowed;
        }

        public boolean accepts(int childCount) {
            if (max == 0) {
                return false;
            }
            return childCount >= min && (max < 0 || childCount <= max);
        }
    }
}
