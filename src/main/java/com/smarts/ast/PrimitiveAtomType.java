package com.smarts.ast;

/**
 * Kinds of primitive atom.
 */
public enum PrimitiveAtomType {
    /** {@code *} */
    ANY,
    /** {@code A} */
    ANY_ALIPHATIC,
    /** {@code a} */
    ANY_AROMATIC,
    /** An element symbol such as {@code C}, {@code Cl} or {@code c}. */
    ATOM
}
