package com.smarts.ast;

/**
 * Bond primitives.
 */
public enum BondType {
    SINGLE,
    DOUBLE,
    TRIPLE,
    AROMATIC,
    UP,
    DOWN,
    RING,
    ANY;

    /**
     * Up and down bonds carry a {@link Presence}.
     */
    public boolean isDirectional() {
        return this == UP || this == DOWN;
    }
}
