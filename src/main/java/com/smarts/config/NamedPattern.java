package com.smarts.config;

import com.smarts.ast.SmartsPattern;

/**
 * A pattern from a library.
 *
 * @param name     Unique name within the library
 * @param source   SMARTS as written, possibly with {@code $name} references
 * @param expanded SMARTS after reference expansion, the text that was parsed
 * @param pattern  Parsed pattern
 */
public record NamedPattern(
        String name,
        String source,
        String expanded,
        SmartsPattern pattern
) {
}
