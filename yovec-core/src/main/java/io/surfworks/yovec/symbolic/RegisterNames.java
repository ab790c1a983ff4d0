package io.surfworks.yovec.symbolic;

import io.surfworks.yovec.ast.NodeKind;
import io.surfworks.yovec.ast.SyntaxNode;

import java.util.List;

/**
 * Naming scheme for register elements: {@code v{index}e{element}}.
 *
 * <p>A number has no element suffix, so an exported scalar is renamed to exactly its
 * export name.
 */
public final class RegisterNames {

    private RegisterNames() {}

    public static String prefix(int index) {
        return "v" + index + "e";
    }

    public static String element(int index, int element) {
        return prefix(index) + element;
    }

    public static String scalar(int index) {
        return prefix(index);
    }

    static SyntaxNode assignment(String name, ScalarExpr expr) {
        return SyntaxNode.of(NodeKind.ASSIGNMENT, List.of(SyntaxNode.leaf(NodeKind.VARIABLE, name), expr.toNode()));
    }
}
