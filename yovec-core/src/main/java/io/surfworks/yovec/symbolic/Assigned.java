package io.surfworks.yovec.symbolic;

import io.surfworks.yovec.ast.SyntaxNode;

import java.util.List;

/**
 * Result of assigning a symbolic value to a register.
 *
 * @param statements one {@code assignment} node per element, in element order
 * @param residual   same-shaped value whose elements read the assigned registers
 */
public record Assigned<T extends SymbolicValue>(List<SyntaxNode> statements, T residual) {

    public Assigned {
        statements = List.copyOf(statements);
    }
}
