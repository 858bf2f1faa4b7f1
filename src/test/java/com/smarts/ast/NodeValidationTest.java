package com.smarts.ast;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the construction rules of tree nodes.
 */
class NodeValidationTest {

    @Test
    @DisplayName("Only directional bonds carry a presence")
    void bondPresence() {
        assertThrows(IllegalArgumentException.class,
                () -> new Bond(BondType.DOUBLE, Negation.PASS, Presence.PRESENT));
        assertThrows(IllegalArgumentException.class,
                () -> new Bond(BondType.UP, Negation.PASS, null));
        assertTrue(BondType.DOWN.isDirectional());
        assertFalse(BondType.RING.isDirectional());
    }

    @Test
    @DisplayName("Expression levels must not be empty")
    void emptyLevelsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ImplicitAnd<Bond>(List.of()));
        assertThrows(IllegalArgumentException.class, () -> new ExplicitAnd<Bond>(List.of()));
        assertThrows(IllegalArgumentException.class, () -> new OrClause<Bond>(List.of()));
        assertThrows(IllegalArgumentException.class, () -> new Expression<Bond>(List.of()));
        assertThrows(IllegalArgumentException.class, () -> new Component(List.of()));
    }

    @Test
    @DisplayName("Default values of omitted counts")
    void defaultValues() {
        assertEquals(1, SpecificationType.DEGREE.defaultValue());
        assertEquals(-1, SpecificationType.RING_MEMBERSHIP.defaultValue());
        assertEquals(-1, SpecificationType.RING_CONNECTIVITY.defaultValue());
        assertThrows(IllegalStateException.class, SpecificationType.ATOMIC_MASS::defaultValue);
    }

    @Test
    @DisplayName("Specifications carry exactly the fields of their type")
    void specificationFields() {
        assertThrows(IllegalArgumentException.class,
                () -> Specification.numeric(SpecificationType.EXPLICIT, Negation.PASS, 1));
        assertThrows(IllegalArgumentException.class,
                () -> Specification.numeric(SpecificationType.CLASS, Negation.PASS, 1));
        assertThrows(IllegalArgumentException.class,
                () -> new Specification(SpecificationType.CLASS, Negation.PASS, 1, null, null, null, null));
        assertThrows(IllegalArgumentException.class,
                () -> new Specification(SpecificationType.DEGREE, Negation.PASS, null, null, null, null, null));
    }

    @Test
    @DisplayName("Compound branches keep their nested branches, linear ones have none")
    void branchShape() {
        Component component = Component.of(new BondedAtom(Expression.implicitBond(),
                SpecificAtom.primitive(PrimitiveAtom.atom("C"), List.of())));

        assertTrue(Branch.linear(component).branches().isEmpty());
        assertEquals(BranchType.COMPOUND,
                Branch.compound(component, List.of(Branch.linear(component))).type());
    }

    @Test
    @DisplayName("Lists are copied on construction")
    void listsAreCopied() {
        List<Integer> closures = new ArrayList<>(List.of(1));
        SpecificAtom atom = SpecificAtom.primitive(PrimitiveAtom.atom("C"), closures);
        closures.add(2);

        assertEquals(List.of(1), atom.ringClosures());
    }
}
