package com.smarts.parser;

import com.smarts.ast.Bond;
import com.smarts.ast.BondType;
import com.smarts.ast.Negation;
import com.smarts.exception.SmartsSyntaxException;

/**
 * Bond primitives: {@code - = # : / \ @ ~}, each optionally negated with {@code !};
 * {@code /} and {@code \} optionally followed by {@code ?}.
 */
final class BondParser implements LeafParser<Bond> {

    @Override
    public Bond parse(SmartsScanner in) {
        int start = in.position();
        Negation negation = Modifiers.negation(in);

        BondType type = in.isAtEnd() ? null : SmartsSymbols.BOND_TYPES_BY_SYMBOL.get(in.peek());
        if (type == null) {
            // '!' only ever prefixes a bond outside brackets
            if (negation == Negation.NEGATE) {
                throw in.unexpected("bond symbol after '!'");
            }
            in.reset(start);
            return null;
        }
        in.advance();

        if (type.isDirectional()) {
            return Bond.directional(type, negation, Modifiers.presence(in));
        }
        return Bond.of(type, negation);
    }

    @Override
    public SmartsSyntaxException missing(SmartsScanner in) {
        return in.unexpected("bond symbol");
    }
}
