package com.smarts.parser;

import com.smarts.exception.SmartsSyntaxException;
import com.smarts.exception.SyntaxErrorKind;

import java.util.List;

/**
 * Character cursor over one SMARTS string.
 * <p>
 * Every grammar rule of a single parse shares this cursor, so positions reported from
 * inside a recursive sub-pattern are offsets into the whole input.
 */
final class SmartsScanner {

    private final String input;
    private final int length;
    private int pos;

    SmartsScanner(String input) {
        this.input = input;
        this.length = input.length();
        this.pos = 0;
    }

    String input() {
        return input;
    }

    int position() {
        return pos;
    }

    /**
     * Move back to a position returned by {@link #position()}.
     */
    void reset(int position) {
        this.pos = position;
    }

    boolean isAtEnd() {
        return pos >= length;
    }

    char peek() {
        return input.charAt(pos);
    }

    boolean check(char expected) {
        return !isAtEnd() && input.charAt(pos) == expected;
    }

    boolean checkDigit() {
        return !isAtEnd() && isAsciiDigit(input.charAt(pos));
    }

    char advance() {
        return input.charAt(pos++);
    }

    boolean match(char expected) {
        if (!check(expected)) {
            return false;
        }
        pos++;
        return true;
    }

    boolean match(String expected) {
        if (!input.startsWith(expected, pos)) {
            return false;
        }
        pos += expected.length();
        return true;
    }

    /**
     * Consume the first symbol of {@code symbols} found at the cursor.
     *
     * @return The consumed symbol, or null if none matches
     */
    String matchFirst(List<String> symbols) {
        for (String symbol : symbols) {
            if (match(symbol)) {
                return symbol;
            }
        }
        return null;
    }

    void expect(char expected, String description) {
        if (!match(expected)) {
            throw unexpectedSymbol(description);
        }
    }

    /**
     * Read an unsigned decimal integer.
     *
     * @return The value, or null if no digit is at the cursor
     */
    Integer readInteger() {
        int start = pos;
        while (checkDigit()) {
            pos++;
        }
        if (start == pos) {
            return null;
        }
        String digits = input.substring(start, pos);
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw error(SyntaxErrorKind.UNEXPECTED_CHARACTER, start,
                    "Number '" + digits + "' is too large", "integer");
        }
    }

    /**
     * Error for a missing construct: end of input or an unexpected character.
     */
    SmartsSyntaxException unexpected(String expected) {
        if (isAtEnd()) {
            return error(SyntaxErrorKind.UNEXPECTED_END_OF_INPUT, pos,
                    "Unexpected end of input, expected " + expected, expected);
        }
        return error(SyntaxErrorKind.UNEXPECTED_CHARACTER, pos,
                "Unexpected character '" + peek() + "', expected " + expected, expected);
    }

    /**
     * Like {@link #unexpected(String)}, but a letter at the cursor is reported as an unknown symbol.
     */
    SmartsSyntaxException unexpectedSymbol(String expected) {
        if (!isAtEnd() && Character.isLetter(peek())) {
            return error(SyntaxErrorKind.UNKNOWN_SYMBOL, pos,
                    "Unknown symbol '" + peek() + "', expected " + expected, expected);
        }
        return unexpected(expected);
    }

    SmartsSyntaxException error(SyntaxErrorKind kind, int position, String detail, String expected) {
        return new SmartsSyntaxException(kind, position, detail, expected, input);
    }

    private static boolean isAsciiDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
