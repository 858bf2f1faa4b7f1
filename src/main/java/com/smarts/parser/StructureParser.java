package com.smarts.parser;

import com.smarts.ast.Bond;
import com.smarts.ast.BondedAtom;
import com.smarts.ast.Branch;
import com.smarts.ast.Component;
import com.smarts.ast.Expression;
import com.smarts.ast.SmartsPattern;
import com.smarts.ast.SpecificAtom;
import com.smarts.config.SmartsParserConfig;
import com.smarts.exception.SyntaxErrorKind;

import java.util.ArrayList;
import java.util.List;

import static com.smarts.parser.SmartsSymbols.Operators;

/**
 * Pattern structure: branches, components and the bonds between atoms.
 * <pre>
 * pattern   := branch*
 * branch    := '(' component branch* ')' | component
 * component := (bondExpression? specificAtom)+
 * </pre>
 * A missing bond expression stands for a non-negated single bond.
 */
final class StructureParser {

    private final SmartsScanner in;
    private final SmartsParserConfig config;
    private final ExpressionParser<Bond> bonds;
    private final AtomParser atoms;
    private int depth;

    StructureParser(SmartsScanner in, SmartsParserConfig config) {
        this.in = in;
        this.config = config;
        this.bonds = new ExpressionParser<>(in, new BondParser());
        this.atoms = new AtomParser(in, new ExpressionParser<>(in, new SpecificationParser(this)));
        this.depth = 0;
    }

    ExpressionParser<Bond> bonds() {
        return bonds;
    }

    SmartsPattern parsePattern() {
        List<Branch> branches = new ArrayList<>();
        Branch branch;
        while ((branch = parseBranch()) != null) {
            branches.add(branch);
        }
        return new SmartsPattern(branches);
    }

    /**
     * Parse the pattern embedded in {@code $(...)}.
     *
     * @param start Position of the {@code $}
     */
    SmartsPattern parseRecursive(int start) {
        if (depth >= config.maxRecursionDepth()) {
            throw in.error(SyntaxErrorKind.LIMIT_EXCEEDED, start,
                    "Recursive SMARTS nested deeper than " + config.maxRecursionDepth(), "shallower nesting");
        }
        depth++;
        try {
            return parsePattern();
        } finally {
            depth--;
        }
    }

    private Branch parseBranch() {
        if (in.match(Operators.LEFT_PAREN)) {
            Component component = parseComponent();
            if (component == null) {
                throw in.unexpectedSymbol("atom after '('");
            }
            List<Branch> branches = new ArrayList<>();
            Branch branch;
            while ((branch = parseBranch()) != null) {
                branches.add(branch);
            }
            in.expect(Operators.RIGHT_PAREN, "')' closing branch");
            return Branch.compound(component, branches);
        }

        Component component = parseComponent();
        return component == null ? null : Branch.linear(component);
    }

    private Component parseComponent() {
        List<BondedAtom> chain = new ArrayList<>();
        while (true) {
            int start = in.position();
            Expression<Bond> bond = bonds.parseOptionalExpression();
            SpecificAtom atom = atoms.parseSpecificAtom();
            if (atom == null) {
                if (in.position() != start) {
                    throw in.unexpectedSymbol("atom after bond");
                }
                break;
            }
            chain.add(new BondedAtom(bond != null ? bond : Expression.implicitBond(), atom));
        }
        return chain.isEmpty() ? null : new Component(chain);
    }
}
