package com.smarts.ast;

import java.util.Objects;

/**
 * A wildcard or an element symbol.
 *
 * @param type   Primitive kind
 * @param symbol Element symbol for {@link PrimitiveAtomType#ATOM}, null otherwise
 */
public record PrimitiveAtom(PrimitiveAtomType type, String symbol) {

    private static final PrimitiveAtom ANY = new PrimitiveAtom(PrimitiveAtomType.ANY, null);
    private static final PrimitiveAtom ANY_ALIPHATIC = new PrimitiveAtom(PrimitiveAtomType.ANY_ALIPHATIC, null);
    private static final PrimitiveAtom ANY_AROMATIC = new PrimitiveAtom(PrimitiveAtomType.ANY_AROMATIC, null);

    public PrimitiveAtom {
        Objects.requireNonNull(type, "type");
        if ((type == PrimitiveAtomType.ATOM) != (symbol != null)) {
            throw new IllegalArgumentException("Only ATOM primitives carry a symbol");
        }
    }

    public static PrimitiveAtom any() {
        return ANY;
    }

    public static PrimitiveAtom anyAliphatic() {
        return ANY_ALIPHATIC;
    }

    public static PrimitiveAtom anyAromatic() {
        return ANY_AROMATIC;
    }

    public static PrimitiveAtom atom(String symbol) {
        return new PrimitiveAtom(PrimitiveAtomType.ATOM, Objects.requireNonNull(symbol, "symbol"));
    }
}
