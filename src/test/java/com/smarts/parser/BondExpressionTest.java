package com.smarts.parser;

import com.smarts.ast.Bond;
import com.smarts.ast.BondType;
import com.smarts.ast.ExplicitAnd;
import com.smarts.ast.Expression;
import com.smarts.ast.ImplicitAnd;
import com.smarts.ast.Negation;
import com.smarts.ast.OrClause;
import com.smarts.ast.Presence;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for bond expressions.
 */
class BondExpressionTest {

    private SmartsParser parser;

    @BeforeEach
    void setUp() {
        parser = new SmartsParser();
    }

    @Test
    @DisplayName("Empty bond expression is the implicit single bond")
    void emptyIsImplicitSingle() {
        Expression<Bond> expression = parser.parseBondExpression("");

        assertEquals(Expression.implicitBond(), expression);
        assertEquals(Expression.single(Bond.of(BondType.SINGLE, Negation.PASS)), expression);
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @DisplayName("Non-directional bond symbols")
    @CsvSource({
            "-, SINGLE",
            "=, DOUBLE",
            "'#', TRIPLE",
            "':', AROMATIC",
            "@, RING",
            "~, ANY"
    })
    void bondSymbols(String text, BondType type) {
        assertEquals(Expression.single(Bond.of(type, Negation.PASS)), parser.parseBondExpression(text));
    }

    @Test
    @DisplayName("Directional bonds carry a presence flag")
    void directionalBonds() {
        assertEquals(Expression.single(Bond.directional(BondType.UP, Negation.PASS, Presence.PRESENT)),
                parser.parseBondExpression("/"));
        assertEquals(Expression.single(Bond.directional(BondType.UP, Negation.PASS, Presence.UNSPECIFIED)),
                parser.parseBondExpression("/?"));
        assertEquals(Expression.single(Bond.directional(BondType.DOWN, Negation.PASS, Presence.PRESENT)),
                parser.parseBondExpression("\\"));
        assertEquals(Expression.single(Bond.directional(BondType.DOWN, Negation.NEGATE, Presence.UNSPECIFIED)),
                parser.parseBondExpression("!\\?"));
    }

    @Test
    @DisplayName("Negated single bond")
    void negatedSingle() {
        assertEquals(Expression.single(Bond.of(BondType.SINGLE, Negation.NEGATE)), parser.parseBondExpression("!-"));
    }

    @Test
    @DisplayName("OR of bond types")
    void orOfBondTypes() {
        Expression<Bond> expected = Expression.of(OrClause.anyOf(
                Bond.of(BondType.DOUBLE, Negation.PASS),
                Bond.of(BondType.TRIPLE, Negation.PASS)));

        assertEquals(expected, parser.parseBondExpression("=,#"));
    }

    @Test
    @DisplayName("Low-precedence AND of bond types")
    void lowAndOfBondTypes() {
        Expression<Bond> expected = Expression.of(
                OrClause.anyOf(Bond.of(BondType.SINGLE, Negation.PASS)),
                OrClause.anyOf(Bond.of(BondType.RING, Negation.PASS)));

        assertEquals(expected, parser.parseBondExpression("-;@"));
    }

    @Test
    @DisplayName("Explicit and implicit AND of bond types")
    void andOfBondTypes() {
        Expression<Bond> explicit = Expression.of(OrClause.of(ExplicitAnd.of(
                ImplicitAnd.of(Bond.of(BondType.RING, Negation.NEGATE)),
                ImplicitAnd.of(Bond.of(BondType.DOUBLE, Negation.PASS)))));
        Expression<Bond> implicit = Expression.of(OrClause.of(ExplicitAnd.of(
                ImplicitAnd.of(Bond.of(BondType.SINGLE, Negation.PASS), Bond.of(BondType.AROMATIC, Negation.PASS)))));

        assertEquals(explicit, parser.parseBondExpression("!@&="));
        assertEquals(implicit, parser.parseBondExpression("-:"));
    }

    @Test
    @DisplayName("Bond between atoms is not confused with atom syntax")
    void bondBetweenAtoms() {
        Expression<Bond> bond = parser.parse("C-,=N").branches().get(0).component().atoms().get(1).bond();

        assertEquals(Expression.of(OrClause.anyOf(
                Bond.of(BondType.SINGLE, Negation.PASS),
                Bond.of(BondType.DOUBLE, Negation.PASS))), bond);
    }
}
