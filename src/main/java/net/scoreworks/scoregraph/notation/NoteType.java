/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoregraph.notation;

import org.jetbrains.annotations.Nullable;


/**
 * Graphical note types as written in a score. The base denominator is the fraction of a whole note the type
 * stands for; types longer than a whole note have 0 and take no part in rhythmic metrics.
 */
public enum NoteType {
    MAXIMA("maxima", 0),
    LONG("long", 0),
    BREVE("breve", 0),
    WHOLE("whole", 1),
    HALF("half", 2),
    QUARTER("quarter", 4),
    EIGHTH("eighth", 8),
    SIXTEENTH("16th", 16),
    THIRTY_SECOND("32nd", 32),
    SIXTY_FOURTH("64th", 64),
    HUNDRED_TWENTY_EIGHTH("128th", 128),
    TWO_HUNDRED_FIFTY_SIXTH("256th", 256);

    private final String text;
    private final int baseDenominator;

    NoteType(String text, int baseDenominator) {
        this.text = text;
        this.baseDenominator = baseDenominator;
    }

    public String getText() {
        return text;
    }

    public int getBaseDenominator() {
        return baseDenominator;
    }

    /**
     * @return the type for text like "quarter" or "16th", ignoring case and surrounding whitespace, or null
     */
    public static @Nullable NoteType fromText(@Nullable String text) {
        if (text == null)
            return null;
        String normalized = text.trim().toLowerCase();
        for (NoteType type : values()) {
            if (type.text.equals(normalized))
                return type;
        }
        return null;
    }
}
