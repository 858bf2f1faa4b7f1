package com.smarts.ast;

/**
 * Atom properties that can appear inside a bracketed atom.
 * <p>
 * Numeric properties whose count may be omitted carry the value substituted for the
 * missing count, e.g. {@code D} means {@code D1} and {@code R} means "any nonzero" (-1).
 * <p>
 * {@link #RING_CONNECTIVITY} is written {@code x}. Classic SMARTS grammars also list an
 * {@code r} form for it, which ring size always claims first; that form is not accepted.
 */
public enum SpecificationType {
    // Element
    EXPLICIT(false, null),

    // Counts
    DEGREE(true, 1),
    ATTACHED_HYDROGENS(true, 1),
    IMPLICIT_HYDROGENS(true, 1),
    RING_MEMBERSHIP(true, -1),
    RING_SIZE(true, -1),
    VALENCE(true, 1),
    CONNECTIVITY(true, 1),
    RING_CONNECTIVITY(true, -1),

    // Charge
    NEGATIVE_CHARGE(true, 1),
    POSITIVE_CHARGE(true, 1),

    // Identity
    ATOMIC_NUMBER(true, null),
    ATOMIC_MASS(true, null),

    // Chirality
    COUNTER_CLOCKWISE(false, null),
    CLOCKWISE(false, null),
    CHIRALITY_CLASS(false, null),

    // Special
    RECURSIVE(false, null),
    CLASS(true, null);

    private final boolean numeric;
    private final Integer defaultValue;

    SpecificationType(boolean numeric, Integer defaultValue) {
        this.numeric = numeric;
        this.defaultValue = defaultValue;
    }

    public boolean isNumeric() {
        return numeric;
    }

    /**
     * Value used when the count is omitted.
     *
     * @throws IllegalStateException if this property always requires a written number
     */
    public int defaultValue() {
        if (defaultValue == null) {
            throw new IllegalStateException(this + " has no default value");
        }
        return defaultValue;
    }

    /**
     * Every property except the atom-map class can be negated.
     */
    public boolean isNegatable() {
        return this != CLASS;
    }
}
