package com.smarts.ast;

import java.util.Objects;

/**
 * A single atom property, the leaf of an atom expression.
 * <p>
 * Only the fields relevant to {@link #type()} are set; the rest are null:
 * <ul>
 *   <li>{@code atom} for {@link SpecificationType#EXPLICIT}</li>
 *   <li>{@code value} for numeric types</li>
 *   <li>{@code presence} for {@link SpecificationType#COUNTER_CLOCKWISE} and {@link SpecificationType#CHIRALITY_CLASS}</li>
 *   <li>{@code chiralityClass} for {@link SpecificationType#CHIRALITY_CLASS}</li>
 *   <li>{@code pattern} for {@link SpecificationType#RECURSIVE}</li>
 * </ul>
 * {@code negation} is null only for {@link SpecificationType#CLASS}.
 *
 * @param type           Property type
 * @param negation       Negation flag
 * @param value          Count, charge, number or mass
 * @param atom           Element or wildcard to match
 * @param chiralityClass Chirality class code
 * @param presence       Whether the chirality must be specified
 * @param pattern        Embedded sub-pattern
 */
public record Specification(
        SpecificationType type,
        Negation negation,
        Integer value,
        PrimitiveAtom atom,
        ChiralityClass chiralityClass,
        Presence presence,
        SmartsPattern pattern
) {
    public Specification {
        Objects.requireNonNull(type, "type");
        if (type.isNegatable() == (negation == null)) {
            throw new IllegalArgumentException(type + (type.isNegatable()
                    ? " requires a negation flag" : " cannot be negated"));
        }
        if (type.isNumeric() == (value == null)) {
            throw new IllegalArgumentException(type + (type.isNumeric()
                    ? " requires a value" : " does not carry a value"));
        }
    }

    /**
     * Create an element or wildcard match.
     */
    public static Specification explicit(Negation negation, PrimitiveAtom atom) {
        return new Specification(SpecificationType.EXPLICIT, negation, null,
                Objects.requireNonNull(atom, "atom"), null, null, null);
    }

    /**
     * Create an element match from its symbol.
     */
    public static Specification explicit(Negation negation, String symbol) {
        return explicit(negation, PrimitiveAtom.atom(symbol));
    }

    /**
     * Create a numeric property such as degree or charge.
     */
    public static Specification numeric(SpecificationType type, Negation negation, int value) {
        if (!type.isNumeric() || type == SpecificationType.CLASS) {
            throw new IllegalArgumentException(type + " is not a negatable numeric property");
        }
        return new Specification(type, negation, value, null, null, null, null);
    }

    /**
     * Create a numeric property using the value implied when the count is omitted.
     */
    public static Specification withDefault(SpecificationType type, Negation negation) {
        return numeric(type, negation, type.defaultValue());
    }

    /**
     * Create {@code @} or {@code @?}.
     */
    public static Specification counterClockwise(Negation negation, Presence presence) {
        return new Specification(SpecificationType.COUNTER_CLOCKWISE, negation, null, null, null,
                Objects.requireNonNull(presence, "presence"), null);
    }

    /**
     * Create {@code @@}.
     */
    public static Specification clockwise(Negation negation) {
        return new Specification(SpecificationType.CLOCKWISE, negation, null, null, null, null, null);
    }

    /**
     * Create a chirality class such as {@code @TH1} or {@code @SP2?}.
     */
    public static Specification chiralityClass(Negation negation, ChiralityClass chiralityClass, Presence presence) {
        return new Specification(SpecificationType.CHIRALITY_CLASS, negation, null, null,
                Objects.requireNonNull(chiralityClass, "chiralityClass"),
                Objects.requireNonNull(presence, "presence"), null);
    }

    /**
     * Create a recursive {@code $(...)} match.
     */
    public static Specification recursive(Negation negation, SmartsPattern pattern) {
        return new Specification(SpecificationType.RECURSIVE, negation, null, null, null, null,
                Objects.requireNonNull(pattern, "pattern"));
    }

    /**
     * Create an atom-map class label {@code :n}.
     */
    public static Specification atomClass(int value) {
        return new Specification(SpecificationType.CLASS, null, value, null, null, null, null);
    }
}
