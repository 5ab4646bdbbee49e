/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoregraph.metadata;

import net.scoreworks.scoregraph.graph.NodeType;
import org.jetbrains.annotations.Nullable;

import java.util.Map;


/**
 * Global key of a work as position on the circle of fifths plus an optional mode
 */
public final class KeyEstimate {
    public static final String MAJOR = "major";
    public static final String MINOR = "minor";

    private static final Map<Integer, String> FIFTHS_TO_MAJOR_TONIC = Map.ofEntries(
            Map.entry(-7, "C_flat"), Map.entry(-6, "G_flat"), Map.entry(-5, "D_flat"), Map.entry(-4, "A_flat"),
            Map.entry(-3, "E_flat"), Map.entry(-2, "B_flat"), Map.entry(-1, "F"), Map.entry(0, "C"),
            Map.entry(1, "G"), Map.entry(2, "D"), Map.entry(3, "A"), Map.entry(4, "E"), Map.entry(5, "B"),
            Map.entry(6, "F_sharp"), Map.entry(7, "C_sharp"));

    private static final Map<Integer, String> FIFTHS_TO_MINOR_TONIC = Map.ofEntries(
            Map.entry(-7, "A_flat"), Map.entry(-6, "E_flat"), Map.entry(-5, "B_flat"), Map.entry(-4, "F"),
            Map.entry(-3, "C"), Map.entry(-2, "G"), Map.entry(-1, "D"), Map.entry(0, "A"),
            Map.entry(1, "E"), Map.entry(2, "B"), Map.entry(3, "F_sharp"), Map.entry(4, "C_sharp"),
            Map.entry(5, "G_sharp"), Map.entry(6, "D_sharp"), Map.entry(7, "A_sharp"));

    /** sharps if positive, flats if negative */
    private final int fifths;

    /** lower case mode, e.g. "major" */
    private final String mode;

    public KeyEstimate(int fifths, @Nullable String mode) {
        this.fifths = fifths;
        this.mode = mode == null || mode.isBlank() ? null : mode.trim().toLowerCase();
    }

    public int getFifths() {
        return fifths;
    }

    public @Nullable String getMode() {
        return mode;
    }

    public int getAccidentalCount() {
        return Math.abs(fifths);
    }

    /**
     * @return "none", "sharp" or "flat"
     */
    public String getAccidentalType() {
        if (fifths == 0)
            return "none";
        return fifths > 0 ? "sharp" : "flat";
    }

    /**
     * @return class of the key signature, e.g. {@code so:KS_0}, {@code so:KS_3sharps} or {@code so:KS_4flats}
     */
    public NodeType getKeySignatureClass() {
        if (fifths == 0)
            return NodeType.so("KS_0");
        return NodeType.so("KS_" + Math.abs(fifths) + (fifths > 0 ? "sharps" : "flats"));
    }

    /**
     * @return tonic such as "F_sharp", or null if the mode is neither major nor minor or fifths is out of range
     */
    public @Nullable String getTonic() {
        if (MAJOR.equals(mode))
            return FIFTHS_TO_MAJOR_TONIC.get(fifths);
        if (MINOR.equals(mode))
            return FIFTHS_TO_MINOR_TONIC.get(fifths);
        return null;
    }

    /**
     * @return class of the key, e.g. {@code so:Key_F_minor}, or null if there is no tonic
     */
    public @Nullable NodeType getKeyClass() {
        String tonic = getTonic();
        return tonic == null ? null : NodeType.so("Key_" + tonic + "_" + mode);
    }

    @Override
    public String toString() {
        return "KeyEstimate[fifths=" + fifths + ", mode=" + mode + "]";
    }
}
