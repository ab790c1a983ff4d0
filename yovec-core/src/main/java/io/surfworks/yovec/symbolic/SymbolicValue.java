package io.surfworks.yovec.symbolic;

/**
 * A number, vector or matrix whose scalar elements are still expression trees.
 *
 * <p>Values are immutable. Every combinator returns a new value. {@link #assign(int)}
 * is the only realization step: it turns the element trees into assignment
 * statements and returns a residual value that reads the assigned registers back.
 */
public sealed interface SymbolicValue permits SimpleNumber, SimpleVector, SimpleMatrix {

    Shape shape();

    /**
     * Number of scalar registers this value occupies once assigned.
     */
    int elementCount();

    Assigned<? extends SymbolicValue> assign(int baseIndex);
}
