package com.smarts.parser;

import com.smarts.ast.Expression;
import com.smarts.ast.PrimitiveAtom;
import com.smarts.ast.SpecificAtom;
import com.smarts.ast.Specification;
import com.smarts.exception.SyntaxErrorKind;

import java.util.ArrayList;
import java.util.List;

import static com.smarts.parser.SmartsSymbols.Operators;

/**
 * Atoms: a bare primitive or a bracketed description, each followed by ring-closure indices.
 * <pre>
 * specificAtom := primitive ringClosure* | '[' expression ']' ringClosure*
 * ringClosure  := digit | '%' digit digit
 * </pre>
 */
final class AtomParser {

    private final SmartsScanner in;
    private final ExpressionParser<Specification> descriptions;

    AtomParser(SmartsScanner in, ExpressionParser<Specification> descriptions) {
        this.in = in;
        this.descriptions = descriptions;
    }

    /**
     * Parse an atom, or return null without consuming input if no atom starts at the cursor.
     */
    SpecificAtom parseSpecificAtom() {
        if (in.match(Operators.LEFT_BRACKET)) {
            Expression<Specification> description = descriptions.parseExpression();
            in.expect(Operators.RIGHT_BRACKET, "']'");
            return SpecificAtom.description(description, parseRingClosures());
        }

        PrimitiveAtom primitive = parsePrimitive(in, SmartsSymbols.ORGANIC_SUBSET);
        if (primitive == null) {
            return null;
        }
        return SpecificAtom.primitive(primitive, parseRingClosures());
    }

    /**
     * Parse an element symbol from {@code symbols} or one of the wildcards {@code * A a}.
     *
     * @return The primitive, or null if none starts at the cursor
     */
    static PrimitiveAtom parsePrimitive(SmartsScanner in, List<String> symbols) {
        String symbol = in.matchFirst(symbols);
        if (symbol != null) {
            return PrimitiveAtom.atom(symbol);
        }
        if (in.match(Operators.ANY_ATOM)) {
            return PrimitiveAtom.any();
        }
        if (in.match(Operators.ANY_ALIPHATIC)) {
            return PrimitiveAtom.anyAliphatic();
        }
        if (in.match(Operators.ANY_AROMATIC)) {
            return PrimitiveAtom.anyAromatic();
        }
        return null;
    }

    private List<Integer> parseRingClosures() {
        List<Integer> closures = new ArrayList<>();
        while (true) {
            if (in.checkDigit()) {
                closures.add(in.advance() - '0');
            } else if (in.check(Operators.PERCENT)) {
                closures.add(parseTwoDigitClosure());
            } else {
                return closures;
            }
        }
    }

    private int parseTwoDigitClosure() {
        int start = in.position();
        in.advance();
        int value = 0;
        for (int i = 0; i < 2; i++) {
            if (!in.checkDigit()) {
                throw in.error(SyntaxErrorKind.MALFORMED_RING_CLOSURE, start,
                        "'%' must be followed by two digits", "two digits");
            }
            value = value * 10 + (in.advance() - '0');
        }
        return value;
    }
}
