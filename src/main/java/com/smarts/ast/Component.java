package com.smarts.ast;

import java.util.Arrays;
import java.util.List;

/**
 * A linear chain of bonded atoms.
 *
 * @param atoms Non-empty chain, in source order
 */
public record Component(List<BondedAtom> atoms) {

    public Component {
        if (atoms == null || atoms.isEmpty()) {
            throw new IllegalArgumentException("Component requires at least one atom");
        }
        atoms = List.copyOf(atoms);
    }

    public static Component of(BondedAtom... atoms) {
        return new Component(Arrays.asList(atoms));
    }
}
