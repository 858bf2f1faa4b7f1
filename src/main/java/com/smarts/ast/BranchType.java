package com.smarts.ast;

/**
 * Branch kinds.
 */
public enum BranchType {
    /** A bare component. */
    LINEAR,
    /** A parenthesised component with nested continuations. */
    COMPOUND
}
