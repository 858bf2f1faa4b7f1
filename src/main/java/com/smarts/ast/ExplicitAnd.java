package com.smarts.ast;

import java.util.Arrays;
import java.util.List;

/**
 * Implicit-AND groups joined by {@code &}: all must hold.
 *
 * @param terms Non-empty terms
 * @param <L>   Leaf type
 */
public record ExplicitAnd<L>(List<ImplicitAnd<L>> terms) {

    public ExplicitAnd {
        if (terms == null || terms.isEmpty()) {
            throw new IllegalArgumentException("Explicit AND requires at least one term");
        }
        terms = List.copyOf(terms);
    }

    @SafeVarargs
    public static <L> ExplicitAnd<L> of(ImplicitAnd<L>... terms) {
        return new ExplicitAnd<>(Arrays.asList(terms));
    }
}
