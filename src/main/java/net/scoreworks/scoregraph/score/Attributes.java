/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoregraph.score;

import org.jetbrains.annotations.Nullable;

import java.util.List;


/**
 * Attributes block of a measure: staff count, time signature, clefs and key
 */
public final class Attributes implements MeasureElement {
    private final Integer staves;
    private final TimeSignature time;
    private final List<ClefDeclaration> clefs;
    private final KeyDeclaration key;

    public Attributes(@Nullable Integer staves, @Nullable TimeSignature time, List<ClefDeclaration> clefs,
                      @Nullable KeyDeclaration key) {
        this.staves = staves;
        this.time = time;
        this.clefs = List.copyOf(clefs);
        this.key = key;
    }

    public @Nullable Integer getStaves() {
        return staves;
    }

    public @Nullable TimeSignature getTime() {
        return time;
    }

    public List<ClefDeclaration> getClefs() {
        return clefs;
    }

    public @Nullable KeyDeclaration getKey() {
        return key;
    }


    /**
     * Raw time signature text. Beats can be compound (e.g. "3+2"), so nothing is parsed here
     */
    public static final class TimeSignature {
        private final String beats;
        private final String beatType;
        private final String symbol;

        public TimeSignature(@Nullable String beats, @Nullable String beatType, @Nullable String symbol) {
            this.beats = beats;
            this.beatType = beatType;
            this.symbol = symbol;
        }

        public @Nullable String getBeats() {
            return beats;
        }

        public @Nullable String getBeatType() {
            return beatType;
        }

        public @Nullable String getSymbol() {
            return symbol;
        }
    }

    public static final class ClefDeclaration {
        private final String sign;
        private final String line;
        private final Integer staff;

        public ClefDeclaration(@Nullable String sign, @Nullable String line, @Nullable Integer staff) {
            this.sign = sign;
            this.line = line;
            this.staff = staff;
        }

        public @Nullable String getSign() {
            return sign;
        }

        public @Nullable String getLine() {
            return line;
        }

        /**
         * @return the staff the clef applies to, null if not given
         */
        public @Nullable Integer getStaff() {
            return staff;
        }
    }

    public static final class KeyDeclaration {
        private final Integer fifths;
        private final String mode;

        public KeyDeclaration(@Nullable Integer fifths, @Nullable String mode) {
            this.fifths = fifths;
            this.mode = mode;
        }

        public @Nullable Integer getFifths() {
            return fifths;
        }

        public @Nullable String getMode() {
            return mode;
        }
    }
}
