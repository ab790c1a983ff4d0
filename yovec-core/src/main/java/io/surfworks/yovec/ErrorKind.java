package io.surfworks.yovec;

/**
 * Classifies every failure the lowering engine can report.
 *
 * <p>All kinds except {@link #INTERNAL_INVARIANT_VIOLATION} are user errors in the
 * compiled program. An internal violation means the upstream parser handed over a
 * tree the grammar does not allow.
 */
public enum ErrorKind {
    UNDEFINED_VARIABLE,
    UNDEFINED_ALIAS,
    REDEFINITION,
    IMPORT_REDEFINITION,
    EXPORT_REDEFINITION,
    CONFLICTING_ALIAS_TARGET,
    EXPORT_OF_UNDEFINED_VARIABLE,
    TYPE_MISMATCH,
    SHAPE_MISMATCH,
    EMPTY_REDUCE,
    UNSUPPORTED_OPERATION,
    INTERNAL_INVARIANT_VIOLATION;

    public boolean isInternal() {
        return this == INTERNAL_INVARIANT_VIOLATION;
    }
}
