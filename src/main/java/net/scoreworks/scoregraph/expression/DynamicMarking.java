/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoregraph.expression;

import org.jetbrains.annotations.Nullable;


/**
 * Loudness markings and a rough loudness level from 1 (ppp) to 8 (fff). Accented forms are placed near the
 * level they usually sound at.
 */
public enum DynamicMarking {
    PPP("ppp", 1),
    PP("pp", 2),
    P("p", 3),
    MP("mp", 4),
    MF("mf", 5),
    F("f", 6),
    FF("ff", 7),
    FFF("fff", 8),
    SF("sf", 7),
    SFP("sfp", 7),
    FP("fp", 6),
    PF("pf", 6);

    private final String token;
    private final int level;

    DynamicMarking(String token, int level) {
        this.token = token;
        this.level = level;
    }

    public String getToken() {
        return token;
    }

    public int getLevel() {
        return level;
    }

    /**
     * @return the marking for a token like "mf", ignoring case, or null if it is not a loudness marking
     */
    public static @Nullable DynamicMarking fromToken(@Nullable String token) {
        if (token == null)
            return null;
        String normalized = token.trim().toLowerCase();
        for (DynamicMarking marking : values()) {
            if (marking.token.equals(normalized))
                return marking;
        }
        return null;
    }
}
