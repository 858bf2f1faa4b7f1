package com.smarts.parser;

import com.smarts.ast.ChiralityClass;
import com.smarts.ast.Negation;
import com.smarts.ast.Presence;
import com.smarts.ast.PrimitiveAtom;
import com.smarts.ast.SmartsPattern;
import com.smarts.ast.Specification;
import com.smarts.ast.SpecificationType;
import com.smarts.exception.SmartsSyntaxException;
import com.smarts.exception.SyntaxErrorKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static com.smarts.parser.SmartsSymbols.Operators;

/**
 * Atom properties inside brackets. Alternatives are tried in order and the first match wins:
 * element, {@code D H h R r v X x - +} counts, {@code #n}, chirality, mass, {@code $(...)}, {@code :n}.
 * <p>
 * An alternative that fails before its committing symbol leaves the cursor where it started.
 */
final class SpecificationParser implements LeafParser<Specification> {

    private final StructureParser structure;
    private final List<Function<SmartsScanner, Specification>> alternatives = new ArrayList<>();

    SpecificationParser(StructureParser structure) {
        this.structure = structure;
        alternatives.add(this::parseExplicit);
        for (Map.Entry<SpecificationType, Character> code : SmartsSymbols.PROPERTY_CODES.entrySet()) {
            alternatives.add(in -> parseCount(in, code.getKey(), code.getValue()));
        }
        alternatives.add(this::parseAtomicNumber);
        alternatives.add(this::parseChirality);
        alternatives.add(this::parseAtomicMass);
        alternatives.add(this::parseRecursive);
        alternatives.add(this::parseClass);
    }

    @Override
    public Specification parse(SmartsScanner in) {
        int start = in.position();
        for (Function<SmartsScanner, Specification> alternative : alternatives) {
            Specification specification = alternative.apply(in);
            if (specification != null) {
                return specification;
            }
            in.reset(start);
        }
        return null;
    }

    @Override
    public SmartsSyntaxException missing(SmartsScanner in) {
        return in.unexpectedSymbol("atom primitive");
    }

    private Specification parseExplicit(SmartsScanner in) {
        Negation negation = Modifiers.negation(in);
        PrimitiveAtom atom = AtomParser.parsePrimitive(in, SmartsSymbols.ELEMENTS);
        return atom == null ? null : Specification.explicit(negation, atom);
    }

    private Specification parseCount(SmartsScanner in, SpecificationType type, char code) {
        Negation negation = Modifiers.negation(in);
        if (!in.match(code)) {
            return null;
        }
        Integer value = in.readInteger();
        return value != null
                ? Specification.numeric(type, negation, value)
                : Specification.withDefault(type, negation);
    }

    private Specification parseAtomicNumber(SmartsScanner in) {
        Negation negation = Modifiers.negation(in);
        if (!in.match(Operators.ATOMIC_NUMBER)) {
            return null;
        }
        Integer value = in.readInteger();
        if (value == null) {
            throw in.unexpected("atomic number after '#'");
        }
        return Specification.numeric(SpecificationType.ATOMIC_NUMBER, negation, value);
    }

    private Specification parseChirality(SmartsScanner in) {
        int start = in.position();
        Negation negation = Modifiers.negation(in);
        if (!in.match(Operators.CHIRAL)) {
            return null;
        }
        boolean clockwise = in.match(Operators.CHIRAL);
        ChiralityClass chiralityClass = parseChiralityClass(in);
        Presence presence = Modifiers.presence(in);

        if (!clockwise && chiralityClass == null) {
            return Specification.counterClockwise(negation, presence);
        }
        if (clockwise && chiralityClass == null && presence == Presence.PRESENT) {
            return Specification.clockwise(negation);
        }
        if (!clockwise) {
            return Specification.chiralityClass(negation, chiralityClass, presence);
        }
        String detail = chiralityClass != null
                ? "'@@' cannot be combined with chirality class " + chiralityClass.code()
                : "'@@' cannot be followed by '?'";
        throw in.error(SyntaxErrorKind.INVALID_CHIRALITY_SYNTAX, start, detail, "chirality");
    }

    private ChiralityClass parseChiralityClass(SmartsScanner in) {
        for (ChiralityClass chiralityClass : SmartsSymbols.CHIRALITY_CLASSES) {
            if (in.match(chiralityClass.code())) {
                return chiralityClass;
            }
        }
        return null;
    }

    private Specification parseAtomicMass(SmartsScanner in) {
        Negation negation = Modifiers.negation(in);
        Integer value = in.readInteger();
        return value == null ? null : Specification.numeric(SpecificationType.ATOMIC_MASS, negation, value);
    }

    private Specification parseRecursive(SmartsScanner in) {
        Negation negation = Modifiers.negation(in);
        int start = in.position();
        if (!in.match(Operators.RECURSIVE_OPEN)) {
            return null;
        }
        SmartsPattern pattern = structure.parseRecursive(start);
        in.expect(Operators.RIGHT_PAREN, "')' closing recursive SMARTS");
        return Specification.recursive(negation, pattern);
    }

    private Specification parseClass(SmartsScanner in) {
        if (!in.match(Operators.CLASS)) {
            return null;
        }
        Integer value = in.readInteger();
        if (value == null) {
            throw in.unexpected("atom class number after ':'");
        }
        return Specification.atomClass(value);
    }
}
