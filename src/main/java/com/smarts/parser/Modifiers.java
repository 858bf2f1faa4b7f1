package com.smarts.parser;

import com.smarts.ast.Negation;
import com.smarts.ast.Presence;

import static com.smarts.parser.SmartsSymbols.Operators;

/**
 * Optional {@code !} prefix and {@code ?} suffix shared by bond and atom primitives.
 */
final class Modifiers {

    private Modifiers() {
    }

    static Negation negation(SmartsScanner in) {
        return in.match(Operators.NOT) ? Negation.NEGATE : Negation.PASS;
    }

    static Presence presence(SmartsScanner in) {
        return in.match(Operators.UNSPECIFIED) ? Presence.UNSPECIFIED : Presence.PRESENT;
    }
}
