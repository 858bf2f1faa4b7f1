package com.smarts.ast;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Root of a parsed SMARTS query: its branches in source order.
 * An empty pattern is valid and matches nothing.
 *
 * @param branches Top-level branches
 */
public record SmartsPattern(List<Branch> branches) {

    public SmartsPattern {
        branches = List.copyOf(Objects.requireNonNull(branches, "branches"));
    }

    public static SmartsPattern of(Branch... branches) {
        return new SmartsPattern(Arrays.asList(branches));
    }

    public boolean isEmpty() {
        return branches.isEmpty();
    }
}
