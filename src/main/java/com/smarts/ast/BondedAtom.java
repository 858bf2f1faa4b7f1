package com.smarts.ast;

import java.util.Objects;

/**
 * An atom together with the bond expression leading to it.
 *
 * @param bond Bond expression, the implicit single bond when none was written
 * @param atom The atom
 */
public record BondedAtom(Expression<Bond> bond, SpecificAtom atom) {

    public BondedAtom {
        Objects.requireNonNull(bond, "bond");
        Objects.requireNonNull(atom, "atom");
    }
}
