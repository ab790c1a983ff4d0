package io.surfworks.yovec.ast;

import io.surfworks.yovec.CompileException;
import io.surfworks.yovec.ErrorKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.surfworks.yovec.testing.Trees.num;
import static io.surfworks.yovec.testing.Trees.var;
import static io.surfworks.yovec.testing.Trees.vector;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SyntaxNodeTest {

    private static SyntaxNode assignment(String name, SyntaxNode expr) {
        return SyntaxNode.of(NodeKind.ASSIGNMENT, SyntaxNode.leaf(NodeKind.VARIABLE, name), expr);
    }

    @Nested
    @DisplayName("arity contract")
    class ArityTests {

        @Test
        void leafKindRejectsChildList() {
            CompileException e = assertThrows(CompileException.class,
                    () -> SyntaxNode.of(NodeKind.IDENT, List.of()));
            assertEquals(ErrorKind.INTERNAL_INVARIANT_VIOLATION, e.getKind());
        }

        @Test
        void internalKindRequiresChildren() {
            CompileException e = assertThrows(CompileException.class,
                    () -> SyntaxNode.leaf(NodeKind.ASSIGNMENT));
            assertTrue(e.isInternal());
        }

        @Test
        void fixedArityIsEnforced() {
            assertThrows(CompileException.class,
                    () -> SyntaxNode.of(NodeKind.DOT, vector(1, 2)));
        }

        @Test
        void emptyVectorIsAnInternalNodeNotALeaf() {
            SyntaxNode empty = SyntaxNode.of(NodeKind.VECTOR);
            assertEquals(0, empty.childCount());
            assertTrue(!empty.isLeaf());
        }

        @Test
        void variableAcceptsBothForms() {
            assertEquals("x", var("x").identifier());
            assertEquals("x", SyntaxNode.leaf(NodeKind.VARIABLE, "x").identifier());
        }

        @Test
        void numberLiteralResolvesThroughWrapper() {
            assertEquals("2.5", num("2.5").literal());
        }
    }

    @Nested
    @DisplayName("tree queries")
    class QueryTests {

        private final SyntaxNode tree = SyntaxNode.of(NodeKind.MULTI,
                assignment("a", SyntaxNode.valued(NodeKind.BINARY_OP, "+", List.of(
                        SyntaxNode.leaf(NodeKind.VARIABLE, "b"),
                        SyntaxNode.leaf(NodeKind.VARIABLE, "c")))),
                assignment("d", SyntaxNode.leaf(NodeKind.VARIABLE, "a")));

        @Test
        void findReturnsMatchesInPreorder() {
            List<String> names = tree.find(node -> node.kind() == NodeKind.VARIABLE).stream()
                    .map(SyntaxNode::value)
                    .toList();
            assertEquals(List.of("a", "b", "c", "d", "a"), names);
        }

        @Test
        void findIncludesTheRoot() {
            assertEquals(List.of(tree), tree.find(node -> node.kind() == NodeKind.MULTI));
        }

        @Test
        void copyIsEqualButDistinct() {
            SyntaxNode copy = tree.copy();
            assertEquals(tree, copy);
            assertNotSame(tree, copy);
            assertNotSame(tree.child(0), copy.child(0));
        }

        @Test
        void rewriteLeavesOriginalUntouched() {
            SyntaxNode renamed = tree.rewrite(node -> node.kind() == NodeKind.VARIABLE
                    ? node.withValue(node.value().toUpperCase()) : node);

            assertEquals("A", renamed.child(0).child(0).value());
            assertEquals("a", tree.child(0).child(0).value());
        }

        @Test
        void rewriteSharesUnchangedSubtrees() {
            SyntaxNode same = tree.rewrite(node -> node);
            assertSame(tree, same);
        }
    }
}
