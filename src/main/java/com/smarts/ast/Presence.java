package com.smarts.ast;

/**
 * Whether a directional bond or chirality must be observed ({@link #PRESENT})
 * or may also be unspecified ({@link #UNSPECIFIED}, written with a trailing {@code ?}).
 */
public enum Presence {
    PRESENT,
    UNSPECIFIED
}
