package io.cscan.model;

/**
 * Abstract summary of what a variable currently holds.
 */
public enum SymbolicValue {
    /** Never written, or written with something not tracked. */
    UNKNOWN,
    /** Holds NULL (or a literal 0 assigned to a pointer). */
    NULL,
    /** Holds the result of malloc/calloc/realloc. */
    ALLOCATED,
    /** Passed to free(). */
    FREED,
    /** Holds some other expression's value. */
    OTHER_EXPR
}
