package com.smarts.parser;

import com.smarts.ast.Bond;
import com.smarts.ast.Expression;
import com.smarts.ast.SmartsPattern;
import com.smarts.ast.Specification;
import com.smarts.config.SmartsParserConfig;
import com.smarts.exception.SmartsSyntaxException;
import com.smarts.exception.SyntaxErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Facade for parsing SMARTS strings into {@link SmartsPattern} trees.
 * <p>
 * Supports:
 * <ul>
 *   <li>Bare organic-subset atoms, wildcards {@code * A a} and bracketed atom expressions</li>
 *   <li>Bond expressions with {@code - = # : / \ @ ~}, implicit single bonds between adjacent atoms</li>
 *   <li>Boolean operators: juxtaposition, {@code &}, {@code ,}, {@code ;} and {@code !}</li>
 *   <li>Branches, ring closures ({@code 1}, {@code %12}) and recursive {@code $(...)} patterns</li>
 *   <li>Chirality ({@code @ @@ @TH1 @?}) and atom-map classes ({@code :n})</li>
 * </ul>
 * Instances are immutable and thread-safe; each call parses with its own cursor.
 */
public final class SmartsParser {

    private static final Logger log = LoggerFactory.getLogger(SmartsParser.class);

    private final SmartsParserConfig config;

    public SmartsParser() {
        this(SmartsParserConfig.defaults());
    }

    public SmartsParser(SmartsParserConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public SmartsParserConfig config() {
        return config;
    }

    /**
     * Parse a complete SMARTS pattern. An empty string yields an empty pattern.
     *
     * @param smarts SMARTS string
     * @return Parsed pattern
     * @throws SmartsSyntaxException if the string is not valid SMARTS
     */
    public SmartsPattern parse(String smarts) {
        SmartsScanner in = open(smarts);
        SmartsPattern pattern = new StructureParser(in, config).parsePattern();
        expectEnd(in, "atom, branch or end of input");
        log.debug("Parsed SMARTS '{}' into {} top-level branches", smarts, pattern.branches().size());
        return pattern;
    }

    /**
     * Parse the contents of a bracketed atom, e.g. {@code C,N;+0}.
     *
     * @param text Atom expression without the surrounding brackets
     * @return Parsed expression
     * @throws SmartsSyntaxException if the text is not a valid atom expression
     */
    public Expression<Specification> parseAtomExpression(String text) {
        SmartsScanner in = open(text);
        StructureParser structure = new StructureParser(in, config);
        Expression<Specification> expression =
                new ExpressionParser<>(in, new SpecificationParser(structure)).parseExpression();
        expectEnd(in, "atom primitive, operator or end of input");
        return expression;
    }

    /**
     * Parse a bond expression, e.g. {@code =,#}. Empty text yields the implicit single bond.
     *
     * @param text Bond expression
     * @return Parsed expression
     * @throws SmartsSyntaxException if the text is not a valid bond expression
     */
    public Expression<Bond> parseBondExpression(String text) {
        SmartsScanner in = open(text);
        Expression<Bond> expression = new StructureParser(in, config).bonds().parseOptionalExpression();
        expectEnd(in, "bond symbol, operator or end of input");
        return expression != null ? expression : Expression.implicitBond();
    }

    private SmartsScanner open(String text) {
        if (text == null) {
            throw new IllegalArgumentException("SMARTS input cannot be null");
        }
        SmartsScanner in = new SmartsScanner(text);
        if (text.length() > config.maxLength()) {
            throw in.error(SyntaxErrorKind.LIMIT_EXCEEDED, config.maxLength(),
                    "Input length " + text.length() + " exceeds maximum " + config.maxLength(),
                    "at most " + config.maxLength() + " characters");
        }
        return in;
    }

    private static void expectEnd(SmartsScanner in, String expected) {
        if (!in.isAtEnd()) {
            throw in.unexpectedSymbol(expected);
        }
    }
}
