package io.surfworks.yovec.symbolic;

/**
 * The three value shapes the lowering engine distinguishes.
 */
public enum Shape {
    NUMBER,
    VECTOR,
    MATRIX
}
