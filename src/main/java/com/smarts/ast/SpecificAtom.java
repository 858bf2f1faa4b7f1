package com.smarts.ast;

import java.util.List;
import java.util.Objects;

/**
 * An atom in the pattern: either a bare primitive ({@code C}, {@code c1}) or a bracketed
 * description ({@code [C;H2]}), followed by its ring-closure indices.
 *
 * @param primitive    Bare primitive atom, null for bracketed atoms
 * @param description  Bracketed atom expression, null for bare atoms
 * @param ringClosures Ring-closure indices in source order
 */
public record SpecificAtom(
        PrimitiveAtom primitive,
        Expression<Specification> description,
        List<Integer> ringClosures
) {
    public SpecificAtom {
        if ((primitive == null) == (description == null)) {
            throw new IllegalArgumentException("Exactly one of primitive or description must be set");
        }
        ringClosures = List.copyOf(Objects.requireNonNull(ringClosures, "ringClosures"));
    }

    public static SpecificAtom primitive(PrimitiveAtom atom, List<Integer> ringClosures) {
        return new SpecificAtom(atom, null, ringClosures);
    }

    public static SpecificAtom description(Expression<Specification> description, List<Integer> ringClosures) {
        return new SpecificAtom(null, description, ringClosures);
    }

    public boolean isPrimitive() {
        return primitive != null;
    }
}
