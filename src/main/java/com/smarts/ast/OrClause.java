package com.smarts.ast;

import java.util.Arrays;
import java.util.List;

/**
 * Explicit-AND groups joined by {@code ,}: any must hold.
 *
 * @param alternatives Non-empty alternatives
 * @param <L>          Leaf type
 */
public record OrClause<L>(List<ExplicitAnd<L>> alternatives) {

    public OrClause {
        if (alternatives == null || alternatives.isEmpty()) {
            throw new IllegalArgumentException("OR clause requires at least one alternative");
        }
        alternatives = List.copyOf(alternatives);
    }

    @SafeVarargs
    public static <L> OrClause<L> of(ExplicitAnd<L>... alternatives) {
        return new OrClause<>(Arrays.asList(alternatives));
    }

    /**
     * OR of single leaves, e.g. {@code C,N}.
     */
    @SafeVarargs
    public static <L> OrClause<L> anyOf(L... leaves) {
        return new OrClause<>(Arrays.stream(leaves)
                .map(leaf -> ExplicitAnd.of(ImplicitAnd.of(leaf)))
                .toList());
    }
}
