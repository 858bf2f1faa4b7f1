package com.smarts.ast;

import java.util.Arrays;
import java.util.List;

/**
 * Leaves written next to each other ({@code CH2}): all must hold. Binds tightest.
 *
 * @param leaves Non-empty leaves
 * @param <L>    Leaf type ({@link Bond} or {@link Specification})
 */
public record ImplicitAnd<L>(List<L> leaves) {

    public ImplicitAnd {
        if (leaves == null || leaves.isEmpty()) {
            throw new IllegalArgumentException("Implicit AND requires at least one leaf");
        }
        leaves = List.copyOf(leaves);
    }

    @SafeVarargs
    public static <L> ImplicitAnd<L> of(L... leaves) {
        return new ImplicitAnd<>(Arrays.asList(leaves));
    }
}
