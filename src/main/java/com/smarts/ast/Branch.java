package com.smarts.ast;

import java.util.List;
import java.util.Objects;

/**
 * A branch of the pattern.
 *
 * @param type      Linear or compound
 * @param component Anchor component
 * @param branches  Nested branches of a compound branch, empty for linear branches
 */
public record Branch(BranchType type, Component component, List<Branch> branches) {

    public Branch {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(component, "component");
        branches = List.copyOf(Objects.requireNonNull(branches, "branches"));
        if (type == BranchType.LINEAR && !branches.isEmpty()) {
            throw new IllegalArgumentException("Linear branch cannot have nested branches");
        }
    }

    public static Branch linear(Component component) {
        return new Branch(BranchType.LINEAR, component, List.of());
    }

    public static Branch compound(Component component, List<Branch> branches) {
        return new Branch(BranchType.COMPOUND, component, branches);
    }
}
