package io.surfworks.yovec.ast;

import io.surfworks.yovec.CompileException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Immutable, kind-tagged syntax tree node shared by the input and output trees.
 *
 * <p>A node is a leaf (no child list, usually with a literal value) or an internal
 * node with a complete, ordered child list. The child count is checked against the
 * kind's {@link NodeKind.Arity} on construction, so a partially built node never exists.
 *
 * <p>Example:
 * <pre>{@code
 * SyntaxNode assignment = SyntaxNode.of(NodeKind.ASSIGNMENT,
 *     SyntaxNode.leaf(NodeKind.VARIABLE, "v0e0"),
 *     SyntaxNode.leaf(NodeKind.NUMBER, "2"));
 * }</pre>
 */
public final class SyntaxNode {

    private final NodeKind kind;
    private final String value;
    private final List<SyntaxNode> children;

    private SyntaxNode(NodeKind kind, String value, List<SyntaxNode> children) {
        this.kind = Objects.requireNonNull(kind, "kind cannot be null");
        this.value = value;
        if (children == null) {
            if (!kind.arity().acceptsLeaf()) {
                throw CompileException.internal("%s node requires children", kind);
            }
            this.children = null;
        } else {
            if (!kind.arity().accepts(children.size())) {
                throw CompileException.internal("%s node cannot have %d children", kind, children.size());
            }
            this.children = List.copyOf(children);
        }
    }

    public static SyntaxNode leaf(NodeKind kind, String value) {
        return new SyntaxNode(kind, value, null);
    }

    public static SyntaxNode leaf(NodeKind kind) {
        return new SyntaxNode(kind, null, null);
    }

    public static SyntaxNode of(NodeKind kind, SyntaxNode... children) {
        return new SyntaxNode(kind, null, Arrays.asList(children));
    }

    public static SyntaxNode of(NodeKind kind, List<SyntaxNode> children) {
        return new SyntaxNode(kind, null, children);
    }

    public static SyntaxNode valued(NodeKind kind, String value, List<SyntaxNode> children) {
        return new SyntaxNode(kind, value, children);
    }

    public NodeKind kind() {
        return kind;
    }

    /**
     * Returns the literal value, or null for nodes without one.
     */
    public String value() {
        return value;
    }

    public boolean isLeaf() {
        return children == null;
    }

    /**
     * Returns the children, or an empty list for a leaf.
     */
    public List<SyntaxNode> children() {
        return children == null ? List.of() : children;
    }

    public int childCount() {
        return children == null ? 0 : children.size();
    }

    public SyntaxNode child(int index) {
        if (children == null || index < 0 || index >= children.size()) {
            throw CompileException.internal("%s node has no child at index %d", kind, index);
        }
        return children.get(index);
    }

    public SyntaxNode lastChild() {
        return child(childCount() - 1);
    }

    /**
     * Returns a copy of this node with a different value and the same children.
     */
    public SyntaxNode withValue(String newValue) {
        return new SyntaxNode(kind, newValue, children);
    }

    /**
     * Returns a structurally equal deep copy.
     */
    public SyntaxNode copy() {
        if (children == null) {
            return new SyntaxNode(kind, value, null);
        }
        List<SyntaxNode> copied = new ArrayList<>(children.size());
        for (SyntaxNode child : children) {
            copied.add(child.copy());
        }
        return new SyntaxNode(kind, value, copied);
    }

    /**
     * Collects this node and all descendants matching the predicate, in preorder.
     */
    public List<SyntaxNode> find(Predicate<SyntaxNode> predicate) {
        List<SyntaxNode> found = new ArrayList<>();
        collect(predicate, found);
        return found;
    }

    private void collect(Predicate<SyntaxNode> predicate, List<SyntaxNode> found) {
        if (predicate.test(this)) {
            found.add(this);
        }
        if (children != null) {
            for (SyntaxNode child : children) {
                child.collect(predicate, found);
            }
        }
    }

    /**
     * Rebuilds the tree bottom-up, applying the rewrite to every node after its
     * children have been rewritten. Untouched subtrees are shared.
     */
    public SyntaxNode rewrite(UnaryOperator<SyntaxNode> rewriter) {
        SyntaxNode node = this;
        if (children != null) {
            List<SyntaxNode> rewritten = new ArrayList<>(children.size());
            boolean changed = false;
            for (SyntaxNode child : children) {
                SyntaxNode next = child.rewrite(rewriter);
                changed |= next != child;
                rewritten.add(next);
            }
            if (changed) {
                node = new SyntaxNode(kind, value, rewritten);
            }
        }
        return rewriter.apply(node);
    }

    /**
     * Resolves the identifier a {@code variable} node names. Accepts both the valued
     * leaf form and the input form wrapping an {@code ident} leaf.
     */
    public String identifier() {
        return nestedValue(NodeKind.VARIABLE, NodeKind.IDENT);
    }

    /**
     * Resolves the literal text of a {@code number} or {@code external} node.
     */
    public String literal() {
        return nestedValue(kind, NodeKind.LITERAL);
    }

    private String nestedValue(NodeKind expectedKind, NodeKind leafKind) {
        if (kind != expectedKind) {
            throw CompileException.internal("expected %s node but got %s", expectedKind, kind);
        }
        SyntaxNode holder = this;
        if (!isLeaf()) {
            holder = child(0);
            if (holder.kind != leafKind) {
                throw CompileException.internal("%s node must wrap %s, got %s", kind, leafKind, holder.kind);
            }
        }
        if (holder.value == null) {
            throw CompileException.internal("%s node has no value", holder.kind);
        }
        return holder.value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SyntaxNode that)) return false;
        return kind == that.kind
                && Objects.equals(value, that.value)
                && Objects.equals(children, that.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value, children);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(kind.tag());
        if (value != null) {
            sb.append('(').append(value).append(')');
        }
        if (children != null) {
            sb.append('[');
            for (int i = 0; i < children.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(children.get(i));
            }
            sb.append(']');
        }
        return sb.toString();
    }
}
