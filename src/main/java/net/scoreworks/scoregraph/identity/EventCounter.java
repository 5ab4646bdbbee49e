/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoregraph.identity;


/**
 * Ordinal counter for symbolic events (notes and rests). One counter spans the whole work: it is not reset per
 * measure or per movement. Every pass that needs event ids creates its own counter and hands it through its
 * traversal, so replaying the same traversal yields the same ordinals.
 */
public final class EventCounter {
    private static final int FIRST_ORDINAL = 1;

    private int current = FIRST_ORDINAL;

    /**
     * @return the ordinal for the next event and advance the counter
     */
    public int next() {
        return current++;
    }

    /**
     * @return how many ordinals were handed out so far
     */
    public int issued() {
        return current - FIRST_ORDINAL;
    }

    @Override
    public String toString() {
        return "EventCounter[next=" + current + "]";
    }
}
