package com.smarts.parser;

import com.smarts.ast.ExplicitAnd;
import com.smarts.ast.Expression;
import com.smarts.ast.ImplicitAnd;
import com.smarts.ast.OrClause;

import java.util.ArrayList;
import java.util.List;

import static com.smarts.parser.SmartsSymbols.Operators;

/**
 * Boolean expressions over a leaf grammar, shared by bond and atom expressions.
 * <p>
 * Grammar (precedence: juxtaposition > {@code &} > {@code ,} > {@code ;}):
 * <pre>
 * expression   := or (';' or)*
 * or           := explicitAnd (',' explicitAnd)*
 * explicitAnd  := implicitAnd ('&amp;' implicitAnd)*
 * implicitAnd  := leaf leaf*
 * </pre>
 * A separator commits: it must be followed by a leaf.
 *
 * @param <L> Leaf type
 */
final class ExpressionParser<L> {

    private final SmartsScanner in;
    private final LeafParser<L> leaves;

    ExpressionParser(SmartsScanner in, LeafParser<L> leaves) {
        this.in = in;
        this.leaves = leaves;
    }

    /**
     * Parse an expression that must contain at least one leaf.
     */
    Expression<L> parseExpression() {
        Expression<L> expression = parseOptionalExpression();
        if (expression == null) {
            throw leaves.missing(in);
        }
        return expression;
    }

    /**
     * Parse an expression, or return null without consuming input if no leaf starts at the cursor.
     */
    Expression<L> parseOptionalExpression() {
        L first = leaves.parse(in);
        if (first == null) {
            return null;
        }
        List<OrClause<L>> clauses = new ArrayList<>();
        clauses.add(parseOr(first));

        while (in.match(Operators.LOW_AND)) {
            clauses.add(parseOr(requireLeaf()));
        }

        return new Expression<>(clauses);
    }

    private OrClause<L> parseOr(L first) {
        List<ExplicitAnd<L>> alternatives = new ArrayList<>();
        alternatives.add(parseExplicitAnd(first));

        while (in.match(Operators.OR)) {
            alternatives.add(parseExplicitAnd(requireLeaf()));
        }

        return new OrClause<>(alternatives);
    }

    private ExplicitAnd<L> parseExplicitAnd(L first) {
        List<ImplicitAnd<L>> terms = new ArrayList<>();
        terms.add(parseImplicitAnd(first));

        while (in.match(Operators.AND)) {
            terms.add(parseImplicitAnd(requireLeaf()));
        }

        return new ExplicitAnd<>(terms);
    }

    private ImplicitAnd<L> parseImplicitAnd(L first) {
        List<L> result = new ArrayList<>();
        result.add(first);

        L next;
        while ((next = leaves.parse(in)) != null) {
            result.add(next);
        }

        return new ImplicitAnd<>(result);
    }

    private L requireLeaf() {
        L leaf = leaves.parse(in);
        if (leaf == null) {
            throw leaves.missing(in);
        }
        return leaf;
    }
}
