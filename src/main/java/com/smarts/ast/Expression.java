package com.smarts.ast;

import java.util.Arrays;
import java.util.List;

/**
 * Boolean expression over bond or atom properties.
 * <p>
 * Precedence, tightest first: juxtaposition, {@code &}, {@code ,} (OR), {@code ;}.
 * This record is the {@code ;} level: all clauses must hold.
 *
 * @param clauses Non-empty OR clauses
 * @param <L>     Leaf type ({@link Bond} or {@link Specification})
 */
public record Expression<L>(List<OrClause<L>> clauses) {

    public Expression {
        if (clauses == null || clauses.isEmpty()) {
            throw new IllegalArgumentException("Expression requires at least one clause");
        }
        clauses = List.copyOf(clauses);
    }

    @SafeVarargs
    public static <L> Expression<L> of(OrClause<L>... clauses) {
        return new Expression<>(Arrays.asList(clauses));
    }

    /**
     * Expression holding exactly one leaf.
     */
    public static <L> Expression<L> single(L leaf) {
        return of(OrClause.of(ExplicitAnd.of(ImplicitAnd.of(leaf))));
    }

    /**
     * The expression used between atoms when no bond is written.
     */
    public static Expression<Bond> implicitBond() {
        return single(Bond.implicitSingle());
    }
}
