package com.smarts.config;

import com.smarts.exception.ConfigurationException;

/**
 * Limits applied while parsing.
 *
 * @param maxLength         Maximum number of characters in a SMARTS string
 * @param maxRecursionDepth Maximum nesting of recursive {@code $(...)} sub-patterns
 */
public record SmartsParserConfig(
        int maxLength,
        int maxRecursionDepth
) {
    public static final int DEFAULT_MAX_LENGTH = 4096;
    public static final int DEFAULT_MAX_RECURSION_DEPTH = 32;

    public SmartsParserConfig {
        if (maxLength <= 0) {
            throw new ConfigurationException("max-length must be positive, was " + maxLength);
        }
        if (maxRecursionDepth <= 0) {
            throw new ConfigurationException("max-recursion-depth must be positive, was " + maxRecursionDepth);
        }
    }

    /**
     * Default limits.
     */
    public static SmartsParserConfig defaults() {
        return new SmartsParserConfig(DEFAULT_MAX_LENGTH, DEFAULT_MAX_RECURSION_DEPTH);
    }
}
