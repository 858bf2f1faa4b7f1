package com.smarts.exception;

/**
 * Categories of SMARTS syntax error.
 */
public enum SyntaxErrorKind {
    /** The character at the failure position fits no grammar alternative. */
    UNEXPECTED_CHARACTER,
    /** Input ended inside a construct, e.g. an unterminated {@code [...]} or {@code $(...)}. */
    UNEXPECTED_END_OF_INPUT,
    /** No element symbol or chirality class matches. */
    UNKNOWN_SYMBOL,
    /** {@code %} not followed by two digits. */
    MALFORMED_RING_CLOSURE,
    /** {@code @@} combined with a class code, or {@code @@?}. */
    INVALID_CHIRALITY_SYNTAX,
    /** Input longer, or recursion deeper, than the configured limits allow. */
    LIMIT_EXCEEDED
}
