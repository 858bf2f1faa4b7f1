package com.smarts.exception;

/**
 * Exception thrown when a SMARTS string cannot be parsed.
 * <p>
 * The position is an offset into the string handed to the parser, also for failures
 * inside a recursive {@code $(...)} sub-pattern.
 */
public class SmartsSyntaxException extends SmartsException {

    private final SyntaxErrorKind kind;
    private final int position;
    private final String expected;
    private final String input;

    public SmartsSyntaxException(SyntaxErrorKind kind, int position, String detail,
                                 String expected, String input) {
        super("Invalid SMARTS at position " + position + ": " + detail + " in '" + input + "'");
        this.kind = kind;
        this.position = position;
        this.expected = expected;
        this.input = input;
    }

    public SyntaxErrorKind getKind() {
        return kind;
    }

    public int getPosition() {
        return position;
    }

    /**
     * What the grammar expected at {@link #getPosition()}.
     */
    public String getExpected() {
        return expected;
    }

    public String getInput() {
        return input;
    }
}
