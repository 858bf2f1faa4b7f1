package com.smarts.ast;

import java.util.Objects;

/**
 * A single bond primitive.
 *
 * @param type     Bond primitive
 * @param negation Negation flag
 * @param presence Presence for {@link BondType#UP}/{@link BondType#DOWN}, null for every other type
 */
public record Bond(BondType type, Negation negation, Presence presence) {

    public Bond {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(negation, "negation");
        if (type.isDirectional() && presence == null) {
            throw new IllegalArgumentException(type + " bond requires a presence");
        }
        if (!type.isDirectional() && presence != null) {
            throw new IllegalArgumentException(type + " bond does not carry a presence");
        }
    }

    /**
     * Create a non-directional bond.
     */
    public static Bond of(BondType type, Negation negation) {
        return new Bond(type, negation, null);
    }

    /**
     * Create an up or down bond.
     */
    public static Bond directional(BondType type, Negation negation, Presence presence) {
        return new Bond(type, negation, presence);
    }

    /**
     * The bond implied between two adjacent atoms when no bond is written.
     */
    public static Bond implicitSingle() {
        return of(BondType.SINGLE, Negation.PASS);
    }
}
