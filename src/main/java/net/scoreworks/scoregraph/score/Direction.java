/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoregraph.score;

import org.jetbrains.annotations.Nullable;

import java.util.List;


/**
 * Direction of a measure: tempo words, metronome marks and dynamics placed between notes
 */
public final class Direction implements MeasureElement {
    private final Integer staff;
    private final String words;
    private final List<String> dynamics;
    private final Metronome metronome;
    private final Sound sound;

    public Direction(@Nullable Integer staff, @Nullable String words, List<String> dynamics,
                     @Nullable Metronome metronome, @Nullable Sound sound) {
        this.staff = staff;
        this.words = words;
        this.dynamics = List.copyOf(dynamics);
        this.metronome = metronome;
        this.sound = sound;
    }

    public @Nullable Integer getStaff() {
        return staff;
    }

    public @Nullable String getWords() {
        return words;
    }

    /**
     * @return the dynamic marking tags in document order, e.g. ["p"] or ["sf", "p"]
     */
    public List<String> getDynamics() {
        return dynamics;
    }

    public @Nullable Metronome getMetronome() {
        return metronome;
    }

    public @Nullable Sound getSound() {
        return sound;
    }


    public static final class Metronome {
        private final String beatUnit;
        private final String perMinute;

        public Metronome(@Nullable String beatUnit, @Nullable String perMinute) {
            this.beatUnit = beatUnit;
            this.perMinute = perMinute;
        }

        public @Nullable String getBeatUnit() {
            return beatUnit;
        }

        public @Nullable String getPerMinute() {
            return perMinute;
        }
    }
}
