/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoregraph.score;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;


/**
 * A note element of a measure. Rests are note elements too. Every note element, chord members included, becomes
 * one symbolic event in the graph
 */
public final class Note implements MeasureElement {
    private final boolean rest;
    private final boolean pitched;
    private final boolean unpitched;
    private final boolean chord;
    private final Integer staff;
    private final String duration;
    private final String type;
    private final int dots;
    private final String step;
    private final String octave;
    private final String accidental;
    private final List<String> dynamics;
    private final List<String> articulations;
    private final List<String> slurTypes;

    private Note(Builder builder) {
        this.rest = builder.rest;
        this.pitched = builder.pitched;
        this.unpitched = builder.unpitched;
        this.chord = builder.chord;
        this.staff = builder.staff;
        this.duration = builder.duration;
        this.type = builder.type;
        this.dots = builder.dots;
        this.step = builder.step;
        this.octave = builder.octave;
        this.accidental = builder.accidental;
        this.dynamics = List.copyOf(builder.dynamics);
        this.articulations = List.copyOf(builder.articulations);
        this.slurTypes = List.copyOf(builder.slurTypes);
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isRest() {
        return rest;
    }

    /**
     * @return true if the note has a pitch element (step and octave might still be missing)
     */
    public boolean isPitched() {
        return pitched;
    }

    public boolean isUnpitched() {
        return unpitched;
    }

    public boolean isChord() {
        return chord;
    }

    public @Nullable Integer getStaff() {
        return staff;
    }

    public @Nullable String getDuration() {
        return duration;
    }

    /**
     * @return the graphical note type, e.g. "quarter" or "16th"
     */
    public @Nullable String getType() {
        return type;
    }

    public int getDots() {
        return dots;
    }

    public @Nullable String getStep() {
        return step;
    }

    public @Nullable String getOctave() {
        return octave;
    }

    public @Nullable String getAccidental() {
        return accidental;
    }

    /**
     * @return dynamics written inside the note's notations
     */
    public List<String> getDynamics() {
        return dynamics;
    }

    public List<String> getArticulations() {
        return articulations;
    }

    /**
     * @return the type attribute ("start", "stop", "continue") of every slur of the note
     */
    public List<String> getSlurTypes() {
        return slurTypes;
    }


    public static final class Builder {
        private boolean rest;
        private boolean pitched;
        private boolean unpitched;
        private boolean chord;
        private Integer staff;
        private String duration;
        private String type;
        private int dots;
        private String step;
        private String octave;
        private String accidental;
        private final List<String> dynamics = new ArrayList<>();
        private final List<String> articulations = new ArrayList<>();
        private final List<String> slurTypes = new ArrayList<>();

        private Builder() {}

        public Builder rest() {
            this.rest = true;
            return this;
        }

        /**
         * Mark the note as pitched. Step or octave may be null to describe an incomplete pitch
         */
        public Builder pitch(@Nullable String step, @Nullable String octave) {
            this.pitched = true;
            this.step = step;
            this.octave = octave;
            return this;
        }

        public Builder unpitched() {
            this.unpitched = true;
            return this;
        }

        public Builder chord() {
            this.chord = true;
            return this;
        }

        public Builder staff(@Nullable Integer staff) {
            this.staff = staff;
            return this;
        }

        public Builder duration(@Nullable String duration) {
            this.duration = duration;
            return this;
        }

        public Builder type(@Nullable String type) {
            this.type = type;
            return this;
        }

        public Builder dots(int dots) {
            this.dots = dots;
            return this;
        }

        public Builder accidental(@Nullable String accidental) {
            this.accidental = accidental;
            return this;
        }

        public Builder dynamic(String dynamic) {
            this.dynamics.add(dynamic);
            return this;
        }

        public Builder articulation(String articulation) {
            this.articulations.add(articulation);
            return this;
        }

        public Builder slur(String slurType) {
            this.slurTypes.add(slurType);
            return this;
        }

        public Note build() {
            return new Note(this);
        }
    }
}
