/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoregraph.notation;

import net.scoreworks.scoregraph.graph.NodeType;
import org.jetbrains.annotations.Nullable;


/**
 * Written accidentals with their ontology class and the shift in semitones they apply
 */
public enum AccidentalClass {
    FLAT("flat", "Flat", -1),
    NATURAL("natural", "Natural", 0),
    SHARP("sharp", "Sharp", 1),
    DOUBLE_FLAT("double-flat", "DoubleFlat", -2),
    DOUBLE_SHARP("double-sharp", "DoubleSharp", 2),
    FLAT_FLAT("flat-flat", "FlatFlat", -2),
    SHARP_SHARP("sharp-sharp", "SharpSharp", 2);

    private final String text;
    private final NodeType type;
    private final int semitoneShift;

    AccidentalClass(String text, String localName, int semitoneShift) {
        this.text = text;
        this.type = NodeType.so(localName);
        this.semitoneShift = semitoneShift;
    }

    public String getText() {
        return text;
    }

    public NodeType getType() {
        return type;
    }

    public int getSemitoneShift() {
        return semitoneShift;
    }

    /**
     * @return the accidental for text like "double-sharp", ignoring case and surrounding whitespace, or null
     */
    public static @Nullable AccidentalClass fromText(@Nullable String text) {
        if (text == null)
            return null;
        String normalized = text.trim().toLowerCase();
        for (AccidentalClass accidental : values()) {
            if (accidental.text.equals(normalized))
                return accidental;
        }
        return null;
    }
}
