package com.smarts.exception;

/**
 * Base exception for the SMARTS parser.
 */
public class SmartsException extends RuntimeException {

    public SmartsException(String message) {
        super(message);
    }

    public SmartsException(String message, Throwable cause) {
        super(message, cause);
    }
}
