package com.smarts.ast;

/**
 * Whether a property must hold ({@link #PASS}) or must not hold ({@link #NEGATE}, written {@code !}).
 */
public enum Negation {
    PASS,
    NEGATE
}
