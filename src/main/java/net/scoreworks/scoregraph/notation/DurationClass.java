/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoregraph.notation;

import net.scoreworks.scoregraph.graph.NodeType;
import org.jetbrains.annotations.Nullable;


/**
 * Ontology classes of durations. Only plain values from whole to 64th and single-dotted half, quarter and eighth
 * have a class.
 */
public enum DurationClass {
    WHOLE_NOTE(NoteType.WHOLE, 0, "WholeNote"),
    HALF_NOTE(NoteType.HALF, 0, "HalfNote"),
    QUARTER_NOTE(NoteType.QUARTER, 0, "QuarterNote"),
    EIGHTH_NOTE(NoteType.EIGHTH, 0, "EighthNote"),
    SIXTEENTH_NOTE(NoteType.SIXTEENTH, 0, "SixteenthNote"),
    THIRTY_SECOND_NOTE(NoteType.THIRTY_SECOND, 0, "ThirtySecondNote"),
    SIXTY_FOURTH_NOTE(NoteType.SIXTY_FOURTH, 0, "SixtyFourthNote"),
    DOTTED_HALF(NoteType.HALF, 1, "DottedHalf"),
    DOTTED_QUARTER(NoteType.QUARTER, 1, "DottedQuarter"),
    DOTTED_EIGHTH(NoteType.EIGHTH, 1, "DottedEighth");

    private final NoteType noteType;
    private final int dots;
    private final NodeType type;

    DurationClass(NoteType noteType, int dots, String localName) {
        this.noteType = noteType;
        this.dots = dots;
        this.type = NodeType.so(localName);
    }

    public NodeType getType() {
        return type;
    }

    /**
     * @param noteTypeText note type as written, e.g. "quarter"
     * @param dots number of augmentation dots
     * @return the class, or null for unknown types and combinations without a class (e.g. dotted whole)
     */
    public static @Nullable DurationClass classify(@Nullable String noteTypeText, int dots) {
        NoteType noteType = NoteType.fromText(noteTypeText);
        if (noteType == null)
            return null;
        for (DurationClass durationClass : values()) {
            if (durationClass.noteType == noteType && durationClass.dots == dots)
                return durationClass;
        }
        return null;
    }
}
