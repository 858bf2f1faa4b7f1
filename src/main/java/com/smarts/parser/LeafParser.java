package com.smarts.parser;

import com.smarts.exception.SmartsSyntaxException;

/**
 * Parses one leaf of a boolean expression.
 *
 * @param <L> Leaf type
 */
interface LeafParser<L> {

    /**
     * Parse a leaf at the cursor.
     *
     * @return The leaf, or null (with the cursor unmoved) if no leaf starts here
     * @throws SmartsSyntaxException if a leaf started but is malformed
     */
    L parse(SmartsScanner in);

    /**
     * Error reported when a leaf is required but none starts at the cursor.
     */
    SmartsSyntaxException missing(SmartsScanner in);
}
